package com.grapher.query.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One statement: reading clauses followed by RETURN and its modifiers.
 *
 * @param reading the MATCH clauses
 * @param distinct whether RETURN DISTINCT was written
 * @param returnItems the projected expressions
 * @param order the ORDER BY items, empty when absent
 * @param skip the SKIP expression, if any
 * @param limit the LIMIT expression, if any
 */
public record SingleQuery(List<ReadingClause> reading,
                          boolean distinct,
                          List<Expr> returnItems,
                          List<OrderBy> order,
                          Optional<Expr> skip,
                          Optional<Expr> limit) {

    /**
     * Copies the lists.
     *
     * @param reading the MATCH clauses
     * @param distinct whether DISTINCT was written
     * @param returnItems the projected expressions
     * @param order the ORDER BY items
     * @param skip the SKIP expression
     * @param limit the LIMIT expression
     */
    public SingleQuery {
        reading = List.copyOf(reading);
        returnItems = List.copyOf(returnItems);
        order = order == null ? List.of() : List.copyOf(order);
        Objects.requireNonNull(skip, "skip");
        Objects.requireNonNull(limit, "limit");
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (ReadingClause clause : reading) {
            buf.append(clause).append(' ');
        }
        buf.append("RETURN ");
        if (distinct) {
            buf.append("DISTINCT ");
        }
        buf.append(returnItems.stream().map(Expr::toString)
            .collect(Collectors.joining(", ")));
        if (!order.isEmpty()) {
            buf.append(" ORDER BY ").append(order.stream()
                .map(OrderBy::toString).collect(Collectors.joining(", ")));
        }
        skip.ifPresent(s -> buf.append(" SKIP ").append(s));
        limit.ifPresent(l -> buf.append(" LIMIT ").append(l));
        return buf.toString();
    }
}
