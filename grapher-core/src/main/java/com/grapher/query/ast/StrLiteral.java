package com.grapher.query.ast;

import java.util.Objects;

/**
 * A string literal.
 *
 * @param value the unescaped text
 */
public record StrLiteral(String value) implements Expr {

    /**
     * Validates the value.
     *
     * @param value the unescaped text
     */
    public StrLiteral {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return "'" + value.replace("\\", "\\\\")
            .replace("'", "\\'")
            .replace("\n", "\\n") + "'";
    }
}
