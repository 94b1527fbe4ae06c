package com.grapher.query;

/**
 * Base class of every failure raised while parsing or executing a query.
 */
public abstract class QueryException extends Exception {

    /**
     * Constructs a new QueryException.
     *
     * @param message the detail message
     */
    protected QueryException(final String message) {
        super(message);
    }
}
