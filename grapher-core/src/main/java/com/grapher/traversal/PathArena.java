package com.grapher.traversal;

import com.grapher.graph.Node;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Append-only storage for the branches of one depth-first walk.
 *
 * <p>Each entry stores its node, its depth and the index of its parent
 * entry, so branches sharing a prefix share the entries of that prefix.
 * The root entry has parent {@link #NO_PARENT}.</p>
 */
final class PathArena {

    /** Parent index of the root entry. */
    static final int NO_PARENT = -1;

    /** Initial capacity of the parallel arrays. */
    private static final int INITIAL_CAPACITY = 16;

    /** Node payload per entry. */
    private final List<Node> nodes = new ArrayList<>(INITIAL_CAPACITY);

    /** Parent index per entry. */
    private int[] parents = new int[INITIAL_CAPACITY];

    /** Depth per entry. */
    private int[] depths = new int[INITIAL_CAPACITY];

    /**
     * Appends an entry.
     *
     * @param node the node reached
     * @param parent the index of the entry it was reached from
     * @return the index of the new entry
     */
    int add(final Node node, final int parent) {
        int index = nodes.size();
        if (index == parents.length) {
            parents = Arrays.copyOf(parents, index * 2);
            depths = Arrays.copyOf(depths, index * 2);
        }
        nodes.add(node);
        parents[index] = parent;
        depths[index] = parent == NO_PARENT ? 0 : depths[parent] + 1;
        return index;
    }

    Node node(final int index) {
        return nodes.get(index);
    }

    int parent(final int index) {
        return parents[index];
    }

    int depth(final int index) {
        return depths[index];
    }

    int size() {
        return nodes.size();
    }
}
