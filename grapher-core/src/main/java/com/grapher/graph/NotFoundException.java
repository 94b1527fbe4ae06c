package com.grapher.graph;

/**
 * Thrown when a node or edge referenced by an operation is not present.
 */
public class NotFoundException extends GraphException {

    /**
     * Constructs a new NotFoundException.
     *
     * @param message the detail message
     */
    public NotFoundException(final String message) {
        super(message);
    }

    static NotFoundException node(final String id) {
        return new NotFoundException("node not found: " + id);
    }

    static NotFoundException edge(final String from, final String to) {
        return new NotFoundException("edge not found: " + from + "->" + to);
    }
}
