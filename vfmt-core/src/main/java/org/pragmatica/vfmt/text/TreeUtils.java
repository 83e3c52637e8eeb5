package org.pragmatica.vfmt.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for inspecting syntax trees.
 */
public final class TreeUtils {

    private TreeUtils() {}

    /**
     * Leaf tokens in traversal order.
     */
    public static List<Token> leaves(SyntaxNode root) {
        var result = new ArrayList<Token>();
        TreeContextVisitor.traverse(root, (token, context) -> result.add(token));
        return result;
    }

    public static int leafCount(SyntaxNode root) {
        var counter = new int[1];
        TreeContextVisitor.traverse(root, (token, context) -> counter[0]++);
        return counter[0];
    }

    /**
     * First leaf token of the subtree, if it has any.
     */
    public static Optional<Token> leftmostLeaf(SyntaxNode node) {
        if (node instanceof SyntaxNode.Leaf leaf) {
            return Optional.of(leaf.token());
        }
        if (node instanceof SyntaxNode.Interior interior) {
            for (var child : interior.children()) {
                if (child == null) {
                    continue;
                }
                var found = leftmostLeaf(child);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Node addressed by the path, empty if the path leaves the tree or lands on an empty slot.
     */
    public static Optional<SyntaxNode> descend(SyntaxNode root, TreePath path) {
        var current = root;
        for (int level = 0; level < path.depth(); level++) {
            if (!(current instanceof SyntaxNode.Interior interior)) {
                return Optional.empty();
            }
            var index = path.get(level);
            if (index >= interior.slotCount()) {
                return Optional.empty();
            }
            current = interior.children().get(index);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }
}
