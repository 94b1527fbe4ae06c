package com.grapher.snapshot;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.grapher.graph.Edge;
import com.grapher.graph.GraphSnapshot;
import com.grapher.graph.InvalidInputException;
import com.grapher.graph.Node;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reads and writes {@link GraphSnapshot}s as JSON.
 *
 * <pre>
 * { "nodes": [ { "id": ..., "labels": [...], "properties": {...} } ],
 *   "edges": [ { "from": ..., "to": ..., "weight": ... } ] }
 * </pre>
 *
 * <p>Output is canonical: nodes sorted by id, labels sorted, property keys
 * sorted at every level, edges sorted by (from, to), two-space indent and
 * {@code \n} line breaks. Writing a snapshot that was read from canonical
 * output reproduces the same bytes.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class SnapshotCodec {
    /** Edge order of the canonical form. */
    private static final Comparator<Edge> EDGE_ORDER =
        Comparator.comparing(Edge::from).thenComparing(Edge::to);

    /** Mapper used for reading. */
    private final ObjectMapper objectMapper;

    /** Canonical pretty-printing writer. */
    private final ObjectWriter writer;

    /**
     * Creates a codec.
     */
    public SnapshotCodec() {
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(indenter);
        printer.indentArraysWith(indenter);
        this.writer = objectMapper.writer(printer);
    }

    /**
     * Writes a snapshot in canonical form.
     *
     * @param snapshot the snapshot
     * @param out the destination, closed afterwards
     * @throws IOException if writing fails
     */
    public void write(final GraphSnapshot snapshot, final Writer out)
            throws IOException {
        writer.writeValue(out, toDocument(snapshot));
    }

    /**
     * Renders a snapshot in canonical form.
     *
     * @param snapshot the snapshot
     * @return the JSON text
     * @throws IOException if a property value cannot be serialized
     */
    public String writeString(final GraphSnapshot snapshot)
            throws IOException {
        StringWriter out = new StringWriter();
        write(snapshot, out);
        return out.toString();
    }

    /**
     * Reads and validates a snapshot.
     *
     * @param in the JSON source
     * @return the snapshot
     * @throws IOException if the JSON is malformed or cannot be read
     * @throws InvalidInputException if a node id is missing, empty or
     *     duplicated, or an edge is duplicated or references a missing node
     */
    public GraphSnapshot read(final Reader in) throws IOException {
        SnapshotDocument document =
            objectMapper.readValue(in, SnapshotDocument.class);
        if (document == null) {
            throw new InvalidInputException("snapshot document is null");
        }
        return fromDocument(document);
    }

    /**
     * Reads and validates a snapshot from text.
     *
     * @param json the JSON text
     * @return the snapshot
     * @throws IOException if the JSON is malformed
     * @throws InvalidInputException if the contents are invalid
     */
    public GraphSnapshot readString(final String json) throws IOException {
        return read(new StringReader(json));
    }

    private static SnapshotDocument toDocument(final GraphSnapshot snapshot) {
        List<Node> nodes = new ArrayList<>(snapshot.nodes());
        nodes.sort(Comparator.comparing(Node::id));
        List<NodeEntry> nodeEntries = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            nodeEntries.add(new NodeEntry(node.id(),
                new ArrayList<>(new TreeSet<>(node.labels())),
                new TreeMap<>(node.properties())));
        }

        List<Edge> edges = new ArrayList<>(snapshot.edges());
        edges.sort(EDGE_ORDER);
        List<EdgeEntry> edgeEntries = new ArrayList<>(edges.size());
        for (Edge edge : edges) {
            edgeEntries.add(new EdgeEntry(edge.from(), edge.to(),
                edge.weight()));
        }
        return new SnapshotDocument(nodeEntries, edgeEntries);
    }

    private static GraphSnapshot fromDocument(final SnapshotDocument document) {
        List<Node> nodes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (NodeEntry entry : nullToEmpty(document.nodes())) {
            if (entry == null || entry.id() == null || entry.id().isEmpty()) {
                throw new InvalidInputException("node id must not be empty");
            }
            if (!ids.add(entry.id())) {
                throw new InvalidInputException("duplicate node id: "
                    + entry.id());
            }
            nodes.add(new Node(entry.id(),
                entry.labels() == null ? null
                    : new LinkedHashSet<>(entry.labels()),
                entry.properties()));
        }

        List<Edge> edges = new ArrayList<>();
        Set<List<String>> pairs = new HashSet<>();
        for (EdgeEntry entry : nullToEmpty(document.edges())) {
            if (entry == null) {
                throw new InvalidInputException("edge must not be null");
            }
            if (!ids.contains(entry.from()) || !ids.contains(entry.to())) {
                throw new InvalidInputException("edge references missing "
                    + "node: " + entry.from() + "->" + entry.to());
            }
            if (!pairs.add(List.of(entry.from(), entry.to()))) {
                throw new InvalidInputException("duplicate edge: "
                    + entry.from() + "->" + entry.to());
            }
            edges.add(new Edge(entry.from(), entry.to(), entry.weight()));
        }
        return new GraphSnapshot(nodes, edges);
    }

    private static <T> List<T> nullToEmpty(final List<T> list) {
        return list == null ? List.of() : list;
    }

    /** Top-level JSON document. */
    @JsonPropertyOrder({"nodes", "edges"})
    record SnapshotDocument(List<NodeEntry> nodes, List<EdgeEntry> edges) {
    }

    /** JSON form of a node. */
    @JsonPropertyOrder({"id", "labels", "properties"})
    record NodeEntry(String id, List<String> labels,
                     Map<String, Object> properties) {
    }

    /** JSON form of an edge. */
    @JsonPropertyOrder({"from", "to", "weight"})
    record EdgeEntry(String from, String to, double weight) {
    }
}
