package com.grapher.query.ast;

import java.util.Objects;

/**
 * A parsed statement.
 *
 * @param root the statement body
 */
public record Query(SingleQuery root) {

    /**
     * Validates the root.
     *
     * @param root the statement body
     */
    public Query {
        Objects.requireNonNull(root, "root");
    }

    @Override
    public String toString() {
        return root + ";";
    }
}
