package com.grapher.query.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A path pattern, optionally bound to a path variable as in
 * {@code p = (a)-->(b)}.
 *
 * @param variable the path variable, if any
 * @param elements node and edge patterns in query order
 */
public record MatchPattern(Optional<Variable> variable,
                           List<PatternElement> elements) {

    /**
     * Copies the elements.
     *
     * @param variable the path variable, if any
     * @param elements node and edge patterns
     */
    public MatchPattern {
        Objects.requireNonNull(variable, "variable");
        elements = List.copyOf(elements);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        variable.ifPresent(v -> buf.append(v).append(" = "));
        elements.forEach(buf::append);
        return buf.toString();
    }
}
