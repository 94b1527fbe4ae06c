package com.grapher.query.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An edge in a match pattern, such as {@code -[r:KNOWS*1..3]->}.
 *
 * <p>Hop bounds are inclusive and count traversed edges. An unwritten
 * lower bound is one hop and an unwritten upper bound is unbounded, for
 * plain and variable-length edges alike; {@code -->} therefore reaches
 * every node downstream of its source.</p>
 *
 * @param direction how the edge is drawn
 * @param variable the bound variable, if any
 * @param relTypes relationship types, any of which may match
 * @param properties properties the edge must have, in query order
 * @param variableLength whether a {@code *} range was given
 * @param minHops the lower hop bound, if written
 * @param maxHops the upper hop bound, if written
 */
public record EdgePattern(EdgeDirection direction,
                          Optional<Variable> variable,
                          List<String> relTypes,
                          Map<String, Expr> properties,
                          boolean variableLength,
                          OptionalInt minHops,
                          OptionalInt maxHops) implements PatternElement {

    /**
     * Validates the bounds and copies the collections.
     *
     * @param direction how the edge is drawn
     * @param variable the bound variable, if any
     * @param relTypes relationship types
     * @param properties properties the edge must have
     * @param variableLength whether a range was given
     * @param minHops the lower hop bound
     * @param maxHops the upper hop bound
     */
    public EdgePattern {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(minHops, "minHops");
        Objects.requireNonNull(maxHops, "maxHops");
        relTypes = relTypes == null ? List.of() : List.copyOf(relTypes);
        properties = Properties.copyOf(properties);
        if (minHops.isPresent() && maxHops.isPresent()
                && minHops.getAsInt() > maxHops.getAsInt()) {
            throw new IllegalArgumentException("minHops " + minHops.getAsInt()
                + " exceeds maxHops " + maxHops.getAsInt());
        }
    }

    /**
     * Gets the effective lower hop bound.
     *
     * @return the minimum number of edges to traverse
     */
    public int effectiveMinHops() {
        return minHops.orElse(1);
    }

    /**
     * Gets the effective upper hop bound.
     *
     * @return the maximum number of edges to traverse, -1 for unbounded
     */
    public int effectiveMaxHops() {
        return maxHops.orElse(-1);
    }

    @Override
    public String toString() {
        StringBuilder inner = new StringBuilder();
        variable.ifPresent(inner::append);
        for (int i = 0; i < relTypes.size(); i++) {
            inner.append(i == 0 ? ':' : '|').append(new Variable(relTypes.get(i)));
        }
        if (variableLength) {
            inner.append('*');
            minHops.ifPresent(inner::append);
            if (maxHops.isPresent()) {
                inner.append("..").append(maxHops.getAsInt());
            } else if (minHops.isPresent()) {
                inner.append("..");
            }
        }
        if (!properties.isEmpty()) {
            if (inner.length() > 0) {
                inner.append(' ');
            }
            inner.append(Properties.render(properties));
        }

        String body = inner.length() == 0 ? "--" : "-[" + inner + "]-";
        switch (direction) {
            case LEFT:
                return "<" + body;
            case RIGHT:
                return body + ">";
            case BOTH:
                return "<" + body + ">";
            default:
                return body;
        }
    }
}
