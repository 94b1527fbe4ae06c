package com.grapher.query.ast;

import com.grapher.query.TokenType;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named variable.
 *
 * @param name the variable name
 */
public record Variable(String name) implements Expr {
    /** Names that can be written without backticks. */
    private static final Pattern PLAIN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Validates the name.
     *
     * @param name the variable name
     */
    public Variable {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        if (PLAIN.matcher(name).matches()
                && TokenType.lookup(name) == TokenType.IDENT) {
            return name;
        }
        return "`" + name.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }
}
