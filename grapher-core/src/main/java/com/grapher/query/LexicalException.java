package com.grapher.query;

/**
 * The scanner met text that is not a valid token: an unterminated string,
 * an unknown escape sequence, an unterminated comment or an illegal
 * character.
 */
public class LexicalException extends ParseException {
    /** The offending token. */
    private final Token token;

    /**
     * Constructs a new LexicalException.
     *
     * @param token the offending token
     */
    public LexicalException(final Token token) {
        super(describe(token), token.pos());
        this.token = token;
    }

    /**
     * Gets the offending token.
     *
     * @return the token
     */
    public Token getToken() {
        return token;
    }

    private static String describe(final Token token) {
        switch (token.type()) {
            case BADSTRING:
                return "unterminated string literal";
            case BADESCAPE:
                return "invalid escape sequence " + token.literal();
            default:
                if (token.literal().startsWith("/*")) {
                    return "unterminated comment";
                } else if (token.literal().startsWith("[*")) {
                    return "unterminated relationship range";
                }
                return "illegal character " + token.literal();
        }
    }
}
