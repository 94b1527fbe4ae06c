package com.grapher.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One result of a query: RETURN columns to values, in RETURN order.
 * Values are {@link com.grapher.graph.Node} copies for node variables,
 * node lists for path variables, literal values, or null for an
 * unmatched OPTIONAL MATCH.
 *
 * @param values column name to value
 */
public record ResultRow(Map<String, Object> values) {

    /**
     * Copies the values, keeping column order.
     *
     * @param values column name to value
     */
    public ResultRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Gets a column value.
     *
     * @param column the column name
     * @return the value, null if absent or null
     */
    public Object get(final String column) {
        return values.get(column);
    }

    /**
     * Gets the column names in RETURN order.
     *
     * @return the columns
     */
    public List<String> columns() {
        return List.copyOf(values.keySet());
    }
}
