package org.pragmatica.vfmt.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Concrete syntax tree node: either a {@link Leaf} wrapping one token or an {@link Interior}
 * node grouping children under a grammar construct.
 *
 * Interior children may contain {@code null} slots. These are placeholders left by the
 * parser's error recovery; traversals skip them but still count them when numbering
 * child positions.
 */
public sealed interface SyntaxNode {

    static Leaf leaf(Token token) {
        return new Leaf(token);
    }

    static Interior node(NodeKind kind, SyntaxNode... children) {
        return new Interior(kind, Arrays.asList(children));
    }

    static Interior node(NodeKind kind, List<SyntaxNode> children) {
        return new Interior(kind, children);
    }

    record Leaf(Token token) implements SyntaxNode {
        public Leaf {
            Objects.requireNonNull(token, "token");
        }
    }

    record Interior(NodeKind kind, List<SyntaxNode> children) implements SyntaxNode {
        public Interior {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(children, "children");
            // List.copyOf() rejects nulls, placeholder slots must survive the copy
            children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        /// Number of child slots, including empty placeholders.
        public int slotCount() {
            return children.size();
        }
    }
}
