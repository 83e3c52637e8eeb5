package org.pragmatica.vfmt.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Depth-first traversal that reports every leaf together with the chain of its
 * enclosing interior nodes.
 *
 * The context is passed down the recursion as an immutable value: entering an interior
 * node extends it, returning from the node discards the extension. Empty child slots are
 * skipped.
 */
public final class TreeContextVisitor {

    private TreeContextVisitor() {}

    /**
     * Callback receiving each leaf token with its ancestor context.
     */
    @FunctionalInterface
    public interface LeafVisitor {
        void visitLeaf(Token token, SyntaxTreeContext context);
    }

    /**
     * Leaf token paired with the ancestor context observed at that leaf.
     */
    public record ContextualToken(Token token, SyntaxTreeContext context) {}

    /**
     * Visit all leaves of the tree in order.
     *
     * @param root    tree root
     * @param visitor leaf callback
     */
    public static void traverse(SyntaxNode root, LeafVisitor visitor) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(visitor, "visitor");
        visit(root, SyntaxTreeContext.syntaxTreeContext(), visitor);
    }

    /**
     * Collect every leaf token with its context, in traversal order.
     */
    public static List<ContextualToken> contextualTokens(SyntaxNode root) {
        var result = new ArrayList<ContextualToken>();
        traverse(root, (token, context) -> result.add(new ContextualToken(token, context)));
        return result;
    }

    private static void visit(SyntaxNode node, SyntaxTreeContext context, LeafVisitor visitor) {
        if (node instanceof SyntaxNode.Leaf leaf) {
            visitor.visitLeaf(leaf.token(), context);
        } else if (node instanceof SyntaxNode.Interior interior) {
            var inner = context.push(interior.kind());
            for (var child : interior.children()) {
                if (child != null) {
                    visit(child, inner, visitor);
                }
            }
        }
    }
}
