package com.grapher.tracing;

/**
 * Instrumentation scopes, one per traced layer.
 */
public enum TracingScope {
    /** Calls made through a {@link TracedGraphStore}. */
    GRAPH_STORE("com.grapher.graph"),
    /** Query parsing and execution. */
    QUERY("com.grapher.query"),
    /** Snapshot save and load. */
    SNAPSHOT("com.grapher.snapshot");

    /** OpenTelemetry instrumentation scope name. */
    private final String scopeName;

    TracingScope(final String scopeName) {
        this.scopeName = scopeName;
    }

    /**
     * Gets the instrumentation scope name.
     *
     * @return the scope name
     */
    public String scopeName() {
        return scopeName;
    }
}
