package com.grapher.query.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node in a match pattern, such as {@code (a:Person {name: 'x'})}.
 *
 * @param variable the bound variable, if any
 * @param labels labels the node must carry
 * @param properties properties the node must have, in query order
 */
public record NodePattern(Optional<Variable> variable,
                          List<String> labels,
                          Map<String, Expr> properties)
        implements PatternElement {

    /**
     * Copies the collections.
     *
     * @param variable the bound variable, if any
     * @param labels labels the node must carry
     * @param properties properties the node must have
     */
    public NodePattern {
        Objects.requireNonNull(variable, "variable");
        labels = labels == null ? List.of() : List.copyOf(labels);
        properties = Properties.copyOf(properties);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("(");
        variable.ifPresent(buf::append);
        for (String label : labels) {
            buf.append(':').append(new Variable(label));
        }
        if (!properties.isEmpty()) {
            if (buf.length() > 1) {
                buf.append(' ');
            }
            buf.append(Properties.render(properties));
        }
        return buf.append(')').toString();
    }
}
