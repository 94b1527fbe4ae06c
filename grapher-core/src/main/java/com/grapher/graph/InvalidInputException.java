package com.grapher.graph;

/**
 * Thrown when an identifier or document handed to the store is malformed,
 * for example an empty node id.
 */
public class InvalidInputException extends GraphException {

    /**
     * Constructs a new InvalidInputException.
     *
     * @param message the detail message
     */
    public InvalidInputException(final String message) {
        super(message);
    }
}
