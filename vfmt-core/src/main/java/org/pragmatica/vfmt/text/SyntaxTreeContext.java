package org.pragmatica.vfmt.text;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Chain of enclosing interior node kinds, from the tree root down to the direct parent
 * of the current position.
 *
 * Values are immutable and persistent: {@link #push(NodeKind)} returns a new context that
 * shares its ancestors with the receiver, so a snapshot taken at a leaf stays valid after
 * the traversal moves on.
 */
public final class SyntaxTreeContext {
    private static final SyntaxTreeContext EMPTY = new SyntaxTreeContext(null, null, 0);

    private final SyntaxTreeContext parent;
    private final NodeKind kind;
    private final int size;

    private SyntaxTreeContext(SyntaxTreeContext parent, NodeKind kind, int size) {
        this.parent = parent;
        this.kind = kind;
        this.size = size;
    }

    /**
     * Context outside of any node.
     */
    public static SyntaxTreeContext syntaxTreeContext() {
        return EMPTY;
    }

    /**
     * Context built from kinds listed root-first.
     */
    public static SyntaxTreeContext syntaxTreeContext(NodeKind... rootFirst) {
        var context = EMPTY;
        for (var nodeKind : rootFirst) {
            context = context.push(nodeKind);
        }
        return context;
    }

    /**
     * Context with one more (innermost) enclosing node.
     */
    public SyntaxTreeContext push(NodeKind nodeKind) {
        if (nodeKind == null) {
            throw new IllegalArgumentException("Context element must not be null");
        }
        return new SyntaxTreeContext(this, nodeKind, size + 1);
    }

    /**
     * Context without the innermost node.
     */
    public SyntaxTreeContext pop() {
        if (isEmpty()) {
            throw new NoSuchElementException("Cannot pop an empty context");
        }
        return parent;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /**
     * Innermost enclosing node kind.
     */
    public NodeKind top() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty context has no top");
        }
        return kind;
    }

    /**
     * Enclosing node kinds, root first.
     */
    public List<NodeKind> kinds() {
        var result = new ArrayList<NodeKind>(size);
        for (var current = this; !current.isEmpty(); current = current.parent) {
            result.add(current.kind);
        }
        Collections.reverse(result);
        return Collections.unmodifiableList(result);
    }

    /**
     * True if the direct parent is of the given kind.
     */
    public boolean directParentIs(NodeKind expected) {
        return !isEmpty() && kind == expected;
    }

    /**
     * True if the direct parent is any of the given kinds.
     */
    public boolean directParentIsOneOf(Collection<NodeKind> expected) {
        return !isEmpty() && expected.contains(kind);
    }

    /**
     * True if the innermost ancestors match the given kinds, innermost first.
     * For example {@code directParentsAre(BRACE_GROUP, ENUM_TYPE)} holds when the direct
     * parent is a brace group whose own parent is an enum type.
     */
    public boolean directParentsAre(NodeKind... innermostFirst) {
        if (innermostFirst.length > size) {
            return false;
        }
        var current = this;
        for (var expected : innermostFirst) {
            if (current.kind != expected) {
                return false;
            }
            current = current.parent;
        }
        return true;
    }

    /**
     * True if any ancestor is of the given kind.
     */
    public boolean isInside(NodeKind expected) {
        for (var current = this; !current.isEmpty(); current = current.parent) {
            if (current.kind == expected) {
                return true;
            }
        }
        return false;
    }

    /**
     * Scans ancestors from the innermost outward. Returns true if a kind from
     * {@code includes} is met before any kind from {@code excludes}.
     */
    public boolean isInsideFirst(Set<NodeKind> includes, Set<NodeKind> excludes) {
        for (var current = this; !current.isEmpty(); current = current.parent) {
            if (includes.contains(current.kind)) {
                return true;
            }
            if (excludes.contains(current.kind)) {
                return false;
            }
        }
        return false;
    }

    /**
     * Number of leading (root-side) kinds shared with the other context.
     */
    public int commonAncestors(SyntaxTreeContext other) {
        var mine = kinds();
        var theirs = other.kinds();
        var limit = Math.min(mine.size(), theirs.size());
        int common = 0;
        while (common < limit && mine.get(common) == theirs.get(common)) {
            common++;
        }
        return common;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxTreeContext other) || other.size != size) {
            return false;
        }
        var left = this;
        var right = other;
        while (!left.isEmpty()) {
            if (left == right) {
                return true;
            }
            if (left.kind != right.kind) {
                return false;
            }
            left = left.parent;
            right = right.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return kinds().hashCode();
    }

    @Override
    public String toString() {
        return kinds().toString();
    }
}
