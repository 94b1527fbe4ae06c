package com.grapher.query.ast;

/**
 * An integer literal.
 *
 * @param value the value
 */
public record IntegerLiteral(long value) implements Expr {

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
