package com.grapher.query;

/**
 * Execution failed: an unsupported expression kind or a property value
 * that cannot be compared with a literal.
 */
public class QueryExecutionException extends QueryException {

    /**
     * Constructs a new QueryExecutionException.
     *
     * @param message the detail message
     */
    public QueryExecutionException(final String message) {
        super(message);
    }
}
