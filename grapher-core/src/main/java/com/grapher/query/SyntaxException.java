package com.grapher.query;

import java.util.List;

/**
 * An unexpected token. Parsing stops at the first one.
 */
public class SyntaxException extends ParseException {
    /** Text of the token found. */
    private final String found;
    /** Lexemes that would have been accepted. */
    private final List<String> expected;

    /**
     * Constructs a new SyntaxException.
     *
     * @param found text of the token found
     * @param expected lexemes that would have been accepted
     * @param pos position of the token found
     */
    public SyntaxException(final String found, final List<String> expected,
                           final Pos pos) {
        super("found " + found + ", expected " + String.join(", ", expected),
            pos);
        this.found = found;
        this.expected = List.copyOf(expected);
    }

    /**
     * Creates an exception carrying a free-form message.
     *
     * @param message the detail message
     * @param pos the offending position
     * @return the exception
     */
    static SyntaxException withMessage(final String message, final Pos pos) {
        return new SyntaxException(message, pos);
    }

    private SyntaxException(final String message, final Pos pos) {
        super(message, pos);
        this.found = "";
        this.expected = List.of();
    }

    /**
     * Gets the text of the token found.
     *
     * @return the found text
     */
    public String getFound() {
        return found;
    }

    /**
     * Gets the lexemes that would have been accepted.
     *
     * @return the expected lexemes, empty for free-form errors
     */
    public List<String> getExpected() {
        return expected;
    }
}
