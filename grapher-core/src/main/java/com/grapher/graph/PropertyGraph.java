package com.grapher.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link GraphStore} guarded by a single reader/writer lock.
 *
 * <p>Edges are indexed twice: the outgoing index maps
 * {@code from -> to -> edge} and the incoming index maps
 * {@code to -> from -> edge}. Both entries for one edge are written and
 * removed only through {@link Contents#link(Edge)} and
 * {@link Contents#unlink(String, String)}, so the two indices cannot
 * diverge.</p>
 *
 * <p>Key features:</p>
 * <ul>
 *   <li>Readers share the lock and get copies, so nobody iterates while
 *       holding it</li>
 *   <li>Writers hold the lock exclusively for the duration of the call</li>
 *   <li>Validation happens before mutation, so a failed call leaves the
 *       store untouched</li>
 * </ul>
 */
public final class PropertyGraph implements GraphStore {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        PropertyGraph.class);

    /** Default graph name. */
    public static final String DEFAULT_NAME = "graph";

    /** Orders snapshot edges. */
    private static final Comparator<Edge> EDGE_ORDER =
        Comparator.comparing(Edge::from).thenComparing(Edge::to);

    /** Name used in log messages and traces. */
    private final String name;

    /** Guards {@link #contents}. */
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** Node table and adjacency indices. */
    private Contents contents = new Contents();

    /**
     * Create an empty graph with the default name.
     */
    public PropertyGraph() {
        this(DEFAULT_NAME);
    }

    /**
     * Create an empty graph.
     *
     * @param graphName name used in log messages and traces
     */
    public PropertyGraph(final String graphName) {
        this.name = Objects.requireNonNull(graphName, "graphName");
    }

    /**
     * Returns the graph name.
     *
     * @return the graph name
     */
    public String getName() {
        return name;
    }

    // ==================== Nodes ====================

    @Override
    public void addNode(final String id,
                        final Map<String, Object> properties) {
        addNode(id, null, properties);
    }

    @Override
    public void addNode(final String id,
                        final Collection<String> labels,
                        final Map<String, Object> properties) {
        requireId(id, "node id");
        write(() -> {
            if (contents.nodes.containsKey(id)) {
                throw new AlreadyExistsException(
                    "node already exists: " + id);
            }
            contents.nodes.put(id, new NodeEntry(id, labels, properties));
            return null;
        });
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Node added to {}: {}", name, id);
        }
    }

    @Override
    public void updateNodeProperties(final String id,
                                     final Map<String, Object> properties) {
        write(() -> {
            NodeEntry entry = requireNode(id);
            if (properties != null) {
                entry.properties.putAll(properties);
            }
            return null;
        });
    }

    @Override
    public void addNodeLabels(final String id,
                              final Collection<String> labels) {
        write(() -> {
            NodeEntry entry = requireNode(id);
            if (labels != null) {
                entry.labels.addAll(labels);
            }
            return null;
        });
    }

    @Override
    public void removeNode(final String id) {
        int removedEdges = write(() -> {
            requireNode(id);
            int count = contents.unlinkAll(id);
            contents.nodes.remove(id);
            return count;
        });
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Node removed from {}: {} ({} incident edges)",
                name, id, removedEdges);
        }
    }

    @Override
    public Node getNode(final String id) {
        return read(() -> requireNode(id).toNode());
    }

    @Override
    public boolean containsNode(final String id) {
        return read(() -> contents.nodes.containsKey(id));
    }

    @Override
    public List<Node> allNodes() {
        return read(() -> {
            List<Node> nodes = new ArrayList<>(contents.nodes.size());
            for (NodeEntry entry : contents.nodes.values()) {
                nodes.add(entry.toNode());
            }
            return nodes;
        });
    }

    @Override
    public List<Node> findNodesByProperty(final String key,
                                          final Object value) {
        return read(() -> {
            List<Node> nodes = new ArrayList<>();
            for (NodeEntry entry : contents.nodes.values()) {
                if (entry.properties.containsKey(key)
                        && Objects.equals(entry.properties.get(key), value)) {
                    nodes.add(entry.toNode());
                }
            }
            return nodes;
        });
    }

    @Override
    public int nodeCount() {
        return read(() -> contents.nodes.size());
    }

    // ==================== Edges ====================

    @Override
    public void addEdge(final String from, final String to,
                        final double weight) {
        requireId(from, "edge source");
        requireId(to, "edge target");
        write(() -> {
            requireNode(from);
            requireNode(to);
            if (contents.find(from, to) != null) {
                throw new AlreadyExistsException(
                    "edge already exists: " + from + "->" + to);
            }
            contents.link(new Edge(from, to, weight));
            return null;
        });
    }

    @Override
    public void updateEdge(final String from, final String to,
                           final double weight) {
        write(() -> {
            Edge edge = contents.find(from, to);
            if (edge == null) {
                throw NotFoundException.edge(from, to);
            }
            contents.link(edge.withWeight(weight));
            return null;
        });
    }

    @Override
    public void removeEdge(final String from, final String to) {
        write(() -> {
            if (contents.find(from, to) == null) {
                throw NotFoundException.edge(from, to);
            }
            contents.unlink(from, to);
            return null;
        });
    }

    @Override
    public Edge getEdge(final String from, final String to) {
        return read(() -> {
            Edge edge = contents.find(from, to);
            if (edge == null) {
                throw NotFoundException.edge(from, to);
            }
            return edge;
        });
    }

    @Override
    public List<Edge> getOutEdges(final String id) {
        return read(() -> {
            requireNode(id);
            return new ArrayList<>(
                contents.out.getOrDefault(id, Map.of()).values());
        });
    }

    @Override
    public List<Edge> getInEdges(final String id) {
        return read(() -> {
            requireNode(id);
            return new ArrayList<>(
                contents.in.getOrDefault(id, Map.of()).values());
        });
    }

    @Override
    public int edgeCount() {
        return read(() -> contents.edgeCount);
    }

    // ==================== Whole graph ====================

    @Override
    public GraphSnapshot snapshot() {
        return read(() -> {
            List<Node> nodes = new ArrayList<>(contents.nodes.size());
            for (NodeEntry entry : contents.nodes.values()) {
                nodes.add(entry.toNode());
            }
            nodes.sort(Comparator.comparing(Node::id));

            List<Edge> edges = new ArrayList<>(contents.edgeCount);
            for (Map<String, Edge> targets : contents.out.values()) {
                edges.addAll(targets.values());
            }
            edges.sort(EDGE_ORDER);
            return new GraphSnapshot(nodes, edges);
        });
    }

    @Override
    public void replaceContents(final GraphSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        // Built outside the lock; the store is only touched once the
        // whole snapshot has been accepted.
        Contents replacement = Contents.of(snapshot);
        write(() -> {
            contents = replacement;
            return null;
        });
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Graph {} replaced (nodes={}, edges={})",
                name, replacement.nodes.size(), replacement.edgeCount);
        }
    }

    @Override
    public void clear() {
        write(() -> {
            contents = new Contents();
            return null;
        });
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Graph {} cleared", name);
        }
    }

    // ==================== Locking ====================

    private <T> T read(final Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(final Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Utility Methods ====================

    /** Must be called with the lock held. */
    private NodeEntry requireNode(final String id) {
        NodeEntry entry = id == null ? null : contents.nodes.get(id);
        if (entry == null) {
            throw NotFoundException.node(id);
        }
        return entry;
    }

    private static void requireId(final String id, final String what) {
        if (id == null || id.isEmpty()) {
            throw new InvalidInputException(what + " must not be empty");
        }
    }

    // ==================== Inner Types ====================

    /**
     * Mutable node state owned by the store.
     */
    private static final class NodeEntry {
        /** Node id. */
        private final String id;
        /** Labels, insertion ordered. */
        private final Set<String> labels;
        /** Properties, insertion ordered. */
        private final Map<String, Object> properties;

        NodeEntry(final String id,
                  final Collection<String> labels,
                  final Map<String, Object> properties) {
            this.id = id;
            this.labels = labels == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(labels);
            this.properties = properties == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(properties);
        }

        Node toNode() {
            return new Node(id, labels, properties);
        }
    }

    /**
     * Node table plus both adjacency indices.
     */
    private static final class Contents {
        /** Nodes by id, insertion ordered. */
        private final Map<String, NodeEntry> nodes = new LinkedHashMap<>();
        /** Outgoing index: from -> to -> edge. */
        private final Map<String, Map<String, Edge>> out = new HashMap<>();
        /** Incoming index: to -> from -> edge. */
        private final Map<String, Map<String, Edge>> in = new HashMap<>();
        /** Number of distinct edges. */
        private int edgeCount;

        static Contents of(final GraphSnapshot snapshot) {
            Contents contents = new Contents();
            for (Node node : snapshot.nodes()) {
                if (node.id().isEmpty()) {
                    throw new InvalidInputException("empty node id");
                }
                if (contents.nodes.containsKey(node.id())) {
                    throw new InvalidInputException(
                        "duplicate node id: " + node.id());
                }
                contents.nodes.put(node.id(), new NodeEntry(
                    node.id(), node.labels(), node.properties()));
            }
            for (Edge edge : snapshot.edges()) {
                if (!contents.nodes.containsKey(edge.from())) {
                    throw new InvalidInputException(
                        "edge references missing node: " + edge.from());
                }
                if (!contents.nodes.containsKey(edge.to())) {
                    throw new InvalidInputException(
                        "edge references missing node: " + edge.to());
                }
                if (contents.find(edge.from(), edge.to()) != null) {
                    throw new InvalidInputException("duplicate edge: "
                        + edge.from() + "->" + edge.to());
                }
                contents.link(edge);
            }
            return contents;
        }

        Edge find(final String from, final String to) {
            Map<String, Edge> targets = out.get(from);
            return targets == null ? null : targets.get(to);
        }

        /** Writes one edge into both indices, replacing any previous. */
        void link(final Edge edge) {
            Edge previous = out.computeIfAbsent(edge.from(),
                k -> new HashMap<>()).put(edge.to(), edge);
            in.computeIfAbsent(edge.to(), k -> new HashMap<>())
                .put(edge.from(), edge);
            if (previous == null) {
                edgeCount++;
            }
        }

        /** Removes one edge from both indices. */
        void unlink(final String from, final String to) {
            Edge outgoing = removeEntry(out, from, to);
            Edge incoming = removeEntry(in, to, from);
            if (outgoing == null || !outgoing.equals(incoming)) {
                throw new IllegalStateException("adjacency indices diverged"
                    + " for edge " + from + "->" + to);
            }
            edgeCount--;
        }

        /** Removes every edge touching {@code id}; returns how many. */
        int unlinkAll(final String id) {
            int removed = 0;
            for (String to : new ArrayList<>(
                    out.getOrDefault(id, Map.of()).keySet())) {
                unlink(id, to);
                removed++;
            }
            for (String from : new ArrayList<>(
                    in.getOrDefault(id, Map.of()).keySet())) {
                unlink(from, id);
                removed++;
            }
            return removed;
        }

        private static Edge removeEntry(
                final Map<String, Map<String, Edge>> index,
                final String key, final String neighbour) {
            Map<String, Edge> edges = index.get(key);
            if (edges == null) {
                return null;
            }
            Edge removed = edges.remove(neighbour);
            if (edges.isEmpty()) {
                index.remove(key);
            }
            return removed;
        }
    }
}
