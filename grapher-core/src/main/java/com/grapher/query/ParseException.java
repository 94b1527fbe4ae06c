package com.grapher.query;

/**
 * Query text could not be turned into an AST.
 */
public abstract class ParseException extends QueryException {
    /** Where the problem starts. */
    private final Pos pos;

    /**
     * Constructs a new ParseException.
     *
     * @param message the detail message, without position
     * @param pos the offending position
     */
    protected ParseException(final String message, final Pos pos) {
        super(message + " at " + pos);
        this.pos = pos;
    }

    /**
     * Gets the offending position.
     *
     * @return the position
     */
    public Pos getPos() {
        return pos;
    }
}
