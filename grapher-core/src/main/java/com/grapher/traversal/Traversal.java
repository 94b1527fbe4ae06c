package com.grapher.traversal;

import com.grapher.graph.GraphStore;
import com.grapher.graph.Node;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Builder for depth-first walks over a {@link GraphStore}.
 *
 * <pre>{@code
 * DepthFirstTraverser walk = Traversal.from(store, "A")
 *     .direction(Direction.OUTGOING)
 *     .maxDepth(2)
 *     .iterator();
 * }</pre>
 */
public final class Traversal {
    /** Depth value meaning "no limit". */
    public static final int UNBOUNDED = -1;

    /** Store to walk. */
    private final GraphStore store;
    /** Id of the start node. */
    private final String startId;
    /** Edge direction to follow. */
    private Direction direction = Direction.OUTGOING;
    /** Maximum depth. */
    private int maxDepth = UNBOUNDED;
    /** Reporting window, optional. */
    private RangeFilter rangeFilter;

    private Traversal(final GraphStore store, final String startId) {
        this.store = Objects.requireNonNull(store, "store");
        this.startId = startId;
    }

    /**
     * Start describing a walk.
     *
     * @param store the store to walk
     * @param startId the id of the node to start from
     * @return a new builder
     */
    public static Traversal from(final GraphStore store,
                                 final String startId) {
        return new Traversal(store, startId);
    }

    /**
     * Set the edge direction to follow (default outgoing).
     *
     * @param value the direction
     * @return this builder
     */
    public Traversal direction(final Direction value) {
        this.direction = Objects.requireNonNull(value, "direction");
        return this;
    }

    /**
     * Set the maximum depth; any negative value means unbounded.
     *
     * @param value the maximum number of edges from the start node
     * @return this builder
     */
    public Traversal maxDepth(final int value) {
        this.maxDepth = value < 0 ? UNBOUNDED : value;
        return this;
    }

    /**
     * Report only nodes inside the window opened by {@code start} and
     * closed by {@code end}.
     *
     * @param start predicate opening the window
     * @param end predicate closing the window
     * @return this builder
     */
    public Traversal rangeFilter(final Predicate<Node> start,
                                 final Predicate<Node> end) {
        this.rangeFilter = new RangeFilter(start, end);
        return this;
    }

    /**
     * Create the walk.
     *
     * @return a traverser positioned before the start node
     * @throws com.grapher.graph.NotFoundException if the start node is
     *     absent
     */
    public DepthFirstTraverser iterator() {
        Node start = store.getNode(startId);
        return new DepthFirstTraverser(store, start, direction, maxDepth,
            rangeFilter);
    }
}
