package com.grapher.graph;

/**
 * Base class for failures reported by a {@link GraphStore}.
 *
 * <p>A store operation that throws leaves the store exactly as it was
 * before the call.</p>
 */
public abstract class GraphException extends RuntimeException {

    /**
     * Constructs a new GraphException.
     *
     * @param message the detail message
     */
    protected GraphException(final String message) {
        super(message);
    }
}
