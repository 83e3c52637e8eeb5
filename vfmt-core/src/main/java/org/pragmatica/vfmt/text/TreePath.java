package org.pragmatica.vfmt.text;

import java.util.Arrays;

/**
 * Position of a node in a syntax tree as a sequence of child slot indices from the root.
 * Empty slots count towards the indices.
 */
public final class TreePath implements Comparable<TreePath> {
    private static final TreePath ROOT = new TreePath(new int[0]);

    private final int[] indices;

    private TreePath(int[] indices) {
        this.indices = indices;
    }

    public static TreePath root() {
        return ROOT;
    }

    public static TreePath treePath(int... indices) {
        for (var index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("Negative child index in " + Arrays.toString(indices));
            }
        }
        return new TreePath(indices.clone());
    }

    /**
     * Path of the child at the given slot index.
     */
    public TreePath child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative child index " + index);
        }
        var extended = Arrays.copyOf(indices, indices.length + 1);
        extended[indices.length] = index;
        return new TreePath(extended);
    }

    public int depth() {
        return indices.length;
    }

    public int get(int level) {
        return indices[level];
    }

    public int[] toArray() {
        return indices.clone();
    }

    @Override
    public int compareTo(TreePath other) {
        return Arrays.compare(indices, other.indices);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TreePath other && Arrays.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indices);
    }

    @Override
    public String toString() {
        return Arrays.toString(indices);
    }
}
