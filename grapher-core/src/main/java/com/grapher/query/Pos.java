package com.grapher.query;

/**
 * A position in query text.
 *
 * @param line the line, starting at 1
 * @param column the column, starting at 1
 * @param offset the number of characters before this position
 */
public record Pos(int line, int column, int offset) {

    /** Position of the first character. */
    public static final Pos START = new Pos(1, 1, 0);

    @Override
    public String toString() {
        return "line " + line + ", char " + column;
    }
}
