package com.grapher.query;

/**
 * A query that parsed but has a shape the executor cannot run, such as a
 * missing MATCH clause or a pattern that does not alternate nodes and
 * edges.
 */
public class QueryStructureException extends QueryException {

    /**
     * Constructs a new QueryStructureException.
     *
     * @param message the detail message
     */
    public QueryStructureException(final String message) {
        super(message);
    }
}
