package com.grapher.graph;

import java.util.Objects;

/**
 * A directed, weighted edge. At most one edge exists per ordered
 * {@code (from, to)} pair.
 *
 * @param from the source node id
 * @param to the target node id
 * @param weight the edge weight
 */
public record Edge(String from, String to, double weight) {

    /**
     * Validates the endpoints are non-null.
     */
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    /**
     * Returns a copy of this edge carrying a different weight.
     *
     * @param newWeight the new weight
     * @return the re-weighted edge
     */
    public Edge withWeight(final double newWeight) {
        return new Edge(from, to, newWeight);
    }
}
