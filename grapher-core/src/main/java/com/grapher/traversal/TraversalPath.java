package com.grapher.traversal;

import com.grapher.graph.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The branch of a depth-first walk that led to a reported node.
 *
 * <p>A path is a view over one entry of the walk's {@link PathArena}; it
 * stays valid after the walk moves on.</p>
 */
public final class TraversalPath {
    /** Arena holding the branch. */
    private final PathArena arena;
    /** Entry of the end node. */
    private final int index;

    TraversalPath(final PathArena arena, final int index) {
        this.arena = arena;
        this.index = index;
    }

    /**
     * Returns the node this path ends at.
     *
     * @return the end node
     */
    public Node endNode() {
        return arena.node(index);
    }

    /**
     * Returns the number of edges traversed from the start node.
     *
     * @return the depth, 0 for the start node
     */
    public int depth() {
        return arena.depth(index);
    }

    /**
     * Returns the path one step shorter.
     *
     * @return the parent path, empty for the start node
     */
    public Optional<TraversalPath> previous() {
        int parent = arena.parent(index);
        return parent == PathArena.NO_PARENT
            ? Optional.empty()
            : Optional.of(new TraversalPath(arena, parent));
    }

    /**
     * Returns the nodes of this path from the start node to the end node.
     *
     * @return the nodes, {@code depth() + 1} of them
     */
    public List<Node> nodes() {
        List<Node> nodes = new ArrayList<>(depth() + 1);
        for (int i = index; i != PathArena.NO_PARENT; i = arena.parent(i)) {
            nodes.add(arena.node(i));
        }
        Collections.reverse(nodes);
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes()) {
            if (sb.length() > 0) {
                sb.append("->");
            }
            sb.append(node.id());
        }
        return sb.toString();
    }
}
