package com.grapher.graph;

/**
 * Thrown when adding a node or edge whose key is already taken.
 */
public class AlreadyExistsException extends GraphException {

    /**
     * Constructs a new AlreadyExistsException.
     *
     * @param message the detail message
     */
    public AlreadyExistsException(final String message) {
        super(message);
    }
}
