package com.grapher;

import com.grapher.graph.GraphStore;
import com.grapher.graph.PropertyGraph;
import com.grapher.tracing.TracedGraphStore;
import com.grapher.tracing.TracingScope;
import com.grapher.tracing.TracingUtil;

/**
 * Factory and convenience methods for creating {@link GraphStore}
 * instances.
 */
public final class GraphStoreFactory {
    /** Environment variable naming the default graph. */
    public static final String ENV_GRAPH_NAME = "GRAPHER_GRAPH_NAME";

    private GraphStoreFactory() {
        throw new AssertionError("No instances");
    }

    /**
     * Create an in-memory store, traced when tracing is enabled.
     *
     * @param graphName the graph name used in logs and spans
     * @return the store
     */
    public static GraphStore createStore(final String graphName) {
        return builder().graphName(graphName).build();
    }

    /**
     * Create a store named by {@code GRAPHER_GRAPH_NAME}, or "graph" when
     * unset or blank.
     *
     * @return the store
     */
    public static GraphStore createDefaultStore() {
        String graphName = System.getenv(ENV_GRAPH_NAME);
        if (graphName == null || graphName.isBlank()) {
            graphName = PropertyGraph.DEFAULT_NAME;
        }
        return createStore(graphName);
    }

    /**
     * Obtain a {@link Builder} to configure and create a store.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link GraphStore} instances.
     */
    public static class Builder {
        /** Name of the graph. */
        private String graphName = PropertyGraph.DEFAULT_NAME;
        /** Whether to wrap the store in a {@link TracedGraphStore}. */
        private boolean tracing = TracingUtil.isTracingEnabled();

        /**
         * Creates a new Builder with default settings.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Set the graph name.
         *
         * @param name the graph name
         * @return this builder
         */
        public Builder graphName(final String name) {
            this.graphName = name;
            return this;
        }

        /**
         * Set whether calls are traced. Defaults to
         * {@link TracingUtil#isTracingEnabled()}.
         *
         * @param value true to trace
         * @return this builder
         */
        public Builder tracing(final boolean value) {
            this.tracing = value;
            return this;
        }

        /**
         * Build and return a store configured with the builder values.
         *
         * @return the store
         */
        public GraphStore build() {
            PropertyGraph graph = new PropertyGraph(graphName);
            if (tracing) {
                return new TracedGraphStore(graph, graphName,
                    TracingUtil.getTracer(TracingScope.GRAPH_STORE));
            }
            return graph;
        }
    }
}
