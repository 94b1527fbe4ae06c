package com.grapher.traversal;

import com.grapher.graph.Node;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A window over a depth-first walk: nodes are reported from the first node
 * satisfying {@code start} up to and including the next node satisfying
 * {@code end}.
 *
 * @param start predicate opening the window
 * @param end predicate closing the window
 */
public record RangeFilter(Predicate<Node> start, Predicate<Node> end) {

    /**
     * Validates both predicates are present.
     */
    public RangeFilter {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }
}
