package com.grapher.query;

/**
 * A lexical unit produced by the {@link Scanner}.
 *
 * @param type the token kind
 * @param pos where the token starts
 * @param literal the source text, unescaped for strings
 */
public record Token(TokenType type, Pos pos, String literal) {

    /**
     * Renders the token the way error messages quote it.
     *
     * @return the literal, or the kind name when the literal is empty
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "EOF";
        }
        if (literal == null || literal.isEmpty()) {
            return type.lexeme();
        }
        return type == TokenType.STRING ? "'" + literal + "'" : literal;
    }
}
