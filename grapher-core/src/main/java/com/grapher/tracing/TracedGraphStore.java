package com.grapher.tracing;

import com.grapher.graph.Edge;
import com.grapher.graph.GraphSnapshot;
import com.grapher.graph.GraphStore;
import com.grapher.graph.Node;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A {@link GraphStore} decorator that records one span per call.
 *
 * <p>Spans are named {@code GraphStore.<operation>} and carry the graph
 * name, the node or edge addressed and, for list reads, the number of
 * results. Failures are recorded on the span and rethrown unchanged.</p>
 */
public final class TracedGraphStore implements GraphStore {
    /** Attribute key for the graph name. */
    public static final AttributeKey<String> ATTR_GRAPH_NAME =
        AttributeKey.stringKey("grapher.graph.name");

    /** Attribute key for the node id. */
    public static final AttributeKey<String> ATTR_NODE_ID =
        AttributeKey.stringKey("grapher.node.id");

    /** Attribute key for the edge source id. */
    public static final AttributeKey<String> ATTR_EDGE_FROM =
        AttributeKey.stringKey("grapher.edge.from");

    /** Attribute key for the edge target id. */
    public static final AttributeKey<String> ATTR_EDGE_TO =
        AttributeKey.stringKey("grapher.edge.to");

    /** Attribute key for the property key of a lookup. */
    public static final AttributeKey<String> ATTR_PROPERTY_KEY =
        AttributeKey.stringKey("grapher.property.key");

    /** Attribute key for the number of results. */
    public static final AttributeKey<Long> ATTR_RESULT_COUNT =
        AttributeKey.longKey("grapher.result_count");

    /** The wrapped store. */
    private final GraphStore delegate;

    /** The graph name for tracing attributes. */
    private final String graphName;

    /** Tracer for creating spans. */
    private final Tracer tracer;

    /** Whether spans are recorded. */
    private final boolean enabled;

    /**
     * Wrap a store using the globally configured tracer. Calls go straight
     * to the delegate while tracing is disabled.
     *
     * @param delegate the store to wrap
     * @param graphName the graph name for attributes
     */
    public TracedGraphStore(final GraphStore delegate,
                            final String graphName) {
        this(delegate, graphName,
            TracingUtil.getTracer(TracingScope.GRAPH_STORE),
            TracingUtil.isTracingEnabled());
    }

    /**
     * Wrap a store using the given tracer; every call is traced.
     *
     * @param delegate the store to wrap
     * @param graphName the graph name for attributes
     * @param tracer the tracer to use
     */
    public TracedGraphStore(final GraphStore delegate,
                            final String graphName,
                            final Tracer tracer) {
        this(delegate, graphName, tracer, true);
    }

    private TracedGraphStore(final GraphStore delegate,
                             final String graphName,
                             final Tracer tracer,
                             final boolean enabled) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.graphName = graphName;
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.enabled = enabled;
    }

    /**
     * Get the underlying store.
     *
     * @return the wrapped store
     */
    public GraphStore getDelegate() {
        return delegate;
    }

    @Override
    public void addNode(final String id, final Map<String, Object> properties) {
        run("addNode", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.addNode(id, properties));
    }

    @Override
    public void addNode(final String id, final Collection<String> labels,
                        final Map<String, Object> properties) {
        run("addNode", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.addNode(id, labels, properties));
    }

    @Override
    public void updateNodeProperties(final String id,
                                     final Map<String, Object> properties) {
        run("updateNodeProperties", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.updateNodeProperties(id, properties));
    }

    @Override
    public void addNodeLabels(final String id,
                              final Collection<String> labels) {
        run("addNodeLabels", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.addNodeLabels(id, labels));
    }

    @Override
    public void removeNode(final String id) {
        run("removeNode", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.removeNode(id));
    }

    @Override
    public void addEdge(final String from, final String to,
                        final double weight) {
        run("addEdge", edge(from, to),
            () -> delegate.addEdge(from, to, weight));
    }

    @Override
    public void updateEdge(final String from, final String to,
                           final double weight) {
        run("updateEdge", edge(from, to),
            () -> delegate.updateEdge(from, to, weight));
    }

    @Override
    public void removeEdge(final String from, final String to) {
        run("removeEdge", edge(from, to),
            () -> delegate.removeEdge(from, to));
    }

    @Override
    public Edge getEdge(final String from, final String to) {
        return call("getEdge", edge(from, to),
            () -> delegate.getEdge(from, to));
    }

    @Override
    public Node getNode(final String id) {
        return call("getNode", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.getNode(id));
    }

    @Override
    public boolean containsNode(final String id) {
        return call("containsNode", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.containsNode(id));
    }

    @Override
    public List<Node> allNodes() {
        return callList("allNodes", b -> { }, delegate::allNodes);
    }

    @Override
    public List<Node> findNodesByProperty(final String key,
                                          final Object value) {
        return callList("findNodesByProperty",
            b -> b.setAttribute(ATTR_PROPERTY_KEY, key),
            () -> delegate.findNodesByProperty(key, value));
    }

    @Override
    public List<Edge> getOutEdges(final String id) {
        return callList("getOutEdges", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.getOutEdges(id));
    }

    @Override
    public List<Edge> getInEdges(final String id) {
        return callList("getInEdges", b -> b.setAttribute(ATTR_NODE_ID, id),
            () -> delegate.getInEdges(id));
    }

    @Override
    public int nodeCount() {
        return call("nodeCount", b -> { }, delegate::nodeCount);
    }

    @Override
    public int edgeCount() {
        return call("edgeCount", b -> { }, delegate::edgeCount);
    }

    @Override
    public GraphSnapshot snapshot() {
        return call("snapshot", b -> { }, delegate::snapshot);
    }

    @Override
    public void replaceContents(final GraphSnapshot snapshot) {
        run("replaceContents", b -> b.setAttribute(ATTR_RESULT_COUNT,
                (long) snapshot.nodes().size()),
            () -> delegate.replaceContents(snapshot));
    }

    @Override
    public void clear() {
        run("clear", b -> { }, delegate::clear);
    }

    private static Consumer<SpanBuilder> edge(final String from,
                                              final String to) {
        return b -> b.setAttribute(ATTR_EDGE_FROM, from)
            .setAttribute(ATTR_EDGE_TO, to);
    }

    private void run(final String operation,
                     final Consumer<SpanBuilder> attributes,
                     final Runnable action) {
        call(operation, attributes, () -> {
            action.run();
            return null;
        });
    }

    private <T> List<T> callList(final String operation,
                                 final Consumer<SpanBuilder> attributes,
                                 final Supplier<List<T>> action) {
        return call(operation, attributes, () -> {
            List<T> result = action.get();
            Span.current().setAttribute(ATTR_RESULT_COUNT,
                (long) result.size());
            return result;
        });
    }

    private <T> T call(final String operation,
                       final Consumer<SpanBuilder> attributes,
                       final Supplier<T> action) {
        if (!enabled) {
            return action.get();
        }

        SpanBuilder builder = tracer.spanBuilder("GraphStore." + operation)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_GRAPH_NAME, graphName);
        attributes.accept(builder);
        Span span = builder.startSpan();

        try (Scope scope = span.makeCurrent()) {
            T result = action.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
