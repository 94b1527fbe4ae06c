package com.grapher.query.ast;

import java.util.Objects;

/**
 * One ORDER BY item.
 *
 * @param item the sort key
 * @param direction the sort order
 */
public record OrderBy(Expr item, SortDirection direction) {

    /**
     * Validates the components.
     *
     * @param item the sort key
     * @param direction the sort order
     */
    public OrderBy {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(direction, "direction");
    }

    @Override
    public String toString() {
        return direction == SortDirection.DESC ? item + " DESC" : item.toString();
    }
}
