package org.pragmatica.vfmt.text;

import java.util.Objects;

/**
 * Variant of {@link TreeContextVisitor} that also reports the position of each leaf as a
 * {@link TreePath}. Contexts reported for the same tree are identical to those of the
 * basic traversal.
 */
public final class TreePathVisitor {

    private TreePathVisitor() {}

    @FunctionalInterface
    public interface LeafPathVisitor {
        void visitLeaf(Token token, SyntaxTreeContext context, TreePath path);
    }

    public static void traverse(SyntaxNode root, LeafPathVisitor visitor) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(visitor, "visitor");
        visit(root, SyntaxTreeContext.syntaxTreeContext(), TreePath.root(), visitor);
    }

    private static void visit(SyntaxNode node, SyntaxTreeContext context, TreePath path, LeafPathVisitor visitor) {
        if (node instanceof SyntaxNode.Leaf leaf) {
            visitor.visitLeaf(leaf.token(), context, path);
        } else if (node instanceof SyntaxNode.Interior interior) {
            var inner = context.push(interior.kind());
            var children = interior.children();
            for (int index = 0; index < children.size(); index++) {
                var child = children.get(index);
                if (child != null) {
                    visit(child, inner, path.child(index), visitor);
                }
            }
        }
    }
}
