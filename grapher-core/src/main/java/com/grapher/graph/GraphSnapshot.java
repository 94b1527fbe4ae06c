package com.grapher.graph;

import java.util.List;

/**
 * A consistent copy of a whole graph: every node and every edge, taken
 * under a single read lock.
 *
 * @param nodes the nodes, sorted by id when produced by a store
 * @param edges the edges, sorted by (from, to) when produced by a store
 */
public record GraphSnapshot(List<Node> nodes, List<Edge> edges) {

    /** An empty snapshot. */
    public static final GraphSnapshot EMPTY =
        new GraphSnapshot(List.of(), List.of());

    /**
     * Copies the given lists.
     */
    public GraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
