package com.grapher.traversal;

import com.grapher.graph.Edge;
import com.grapher.graph.GraphStore;
import com.grapher.graph.Node;
import com.grapher.graph.NotFoundException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack-based depth-first walk over a {@link GraphStore}.
 *
 * <p>The frontier may hold the same node several times; duplicates are
 * dropped when popped, not when pushed, which decides the branch through
 * which a node is first reached. Each reachable node is reported at most
 * once.</p>
 *
 * <p>Every neighbour lookup is a separate read of the store, so a walk
 * racing with writers sees a sequence of snapshots. A neighbour removed
 * between two reads is skipped.</p>
 *
 * <p>Instances are created by {@link Traversal#iterator()} and are not
 * thread-safe.</p>
 */
public final class DepthFirstTraverser implements Iterator<TraversalPath> {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        DepthFirstTraverser.class);

    /** Store being walked. */
    private final GraphStore store;
    /** Edge direction to follow. */
    private final Direction direction;
    /** Maximum depth, negative for unbounded. */
    private final int maxDepth;
    /** Optional reporting window, may be null. */
    private final RangeFilter rangeFilter;

    /** Branch storage. */
    private final PathArena arena = new PathArena();
    /** Frontier of arena indices. */
    private final Deque<Integer> stack = new ArrayDeque<>();
    /** Ids of nodes already popped. */
    private final Set<String> visited = new HashSet<>();
    /** Whether the walk is inside the range window. */
    private boolean inRange;
    /** Next path to report, computed ahead by {@link #hasNext()}. */
    private TraversalPath pending;

    DepthFirstTraverser(final GraphStore store,
                        final Node start,
                        final Direction direction,
                        final int maxDepth,
                        final RangeFilter rangeFilter) {
        this.store = store;
        this.direction = direction;
        this.maxDepth = maxDepth;
        this.rangeFilter = rangeFilter;
        stack.push(arena.add(start, PathArena.NO_PARENT));
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public TraversalPath next() {
        if (!hasNext()) {
            throw new NoSuchElementException("traversal exhausted");
        }
        TraversalPath path = pending;
        pending = null;
        return path;
    }

    /**
     * Returns the depth of the entry on top of the frontier.
     *
     * @return the depth, or -1 when the frontier is empty
     */
    public int currentDepth() {
        Integer top = stack.peek();
        return top == null ? -1 : arena.depth(top);
    }

    /**
     * Reports every remaining path to {@code visitor}. An exception thrown
     * by the visitor stops the walk at once; the rest of the frontier is
     * discarded.
     *
     * @param visitor the callback
     * @param <E> the exception the visitor may throw
     * @throws E when the visitor aborts
     */
    public <E extends Exception> void iterate(final PathVisitor<E> visitor)
            throws E {
        boolean completed = false;
        try {
            while (hasNext()) {
                visitor.visit(next());
            }
            completed = true;
        } finally {
            if (!completed) {
                stack.clear();
                pending = null;
            }
        }
    }

    private TraversalPath advance() {
        while (!stack.isEmpty()) {
            int index = stack.pop();
            Node node = arena.node(index);
            if (!visited.add(node.id())) {
                continue;
            }

            boolean closesRange = false;
            if (rangeFilter != null) {
                if (!inRange && rangeFilter.start().test(node)) {
                    inRange = true;
                }
                if (inRange && rangeFilter.end().test(node)) {
                    inRange = false;
                    closesRange = true;
                }
            }

            int depth = arena.depth(index);
            if (maxDepth < 0 || depth < maxDepth) {
                List<Node> neighbours = neighbours(node);
                // Reverse order so the first neighbour is popped first.
                for (int i = neighbours.size() - 1; i >= 0; i--) {
                    Node neighbour = neighbours.get(i);
                    if (!visited.contains(neighbour.id())) {
                        stack.push(arena.add(neighbour, index));
                    }
                }
            }

            // The node closing the window is still reported.
            if (rangeFilter == null
                    || inRange
                    || closesRange
                    || rangeFilter.end().test(node)) {
                return new TraversalPath(arena, index);
            }
        }
        return null;
    }

    private List<Node> neighbours(final Node node) {
        Set<String> ids = new LinkedHashSet<>();
        try {
            if (direction != Direction.INCOMING) {
                for (Edge edge : store.getOutEdges(node.id())) {
                    ids.add(edge.to());
                }
            }
            if (direction != Direction.OUTGOING) {
                for (Edge edge : store.getInEdges(node.id())) {
                    ids.add(edge.from());
                }
            }
        } catch (NotFoundException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Node {} removed during traversal",
                    node.id());
            }
            return List.of();
        }

        List<Node> neighbours = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                neighbours.add(store.getNode(id));
            } catch (NotFoundException e) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Neighbour {} of {} removed during "
                        + "traversal", id, node.id());
                }
            }
        }
        return neighbours;
    }
}
