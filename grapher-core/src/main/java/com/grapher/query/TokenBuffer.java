package com.grapher.query;

/**
 * Lookahead over a {@link Scanner} that drops whitespace and comments and
 * can push back up to three tokens.
 */
final class TokenBuffer {
    /** Number of tokens kept for pushback. */
    private static final int SIZE = 3;

    /** Token source. */
    private final Scanner scanner;
    /** Recently scanned tokens, circular. */
    private final Token[] tokens = new Token[SIZE];
    /** Slot of the most recently scanned token. */
    private int index = SIZE - 1;
    /** Number of filled slots. */
    private int filled;
    /** Number of tokens pushed back. */
    private int unread;

    TokenBuffer(final Scanner scanner) {
        this.scanner = scanner;
    }

    /**
     * Returns the next significant token, a pushed back one first.
     */
    Token scan() {
        if (unread > 0) {
            Token token = tokens[(index - unread + 1 + SIZE) % SIZE];
            unread--;
            return token;
        }

        Token token;
        do {
            token = scanner.scan();
        } while (token.type() == TokenType.WS
            || token.type() == TokenType.COMMENT);

        index = (index + 1) % SIZE;
        tokens[index] = token;
        filled = Math.min(filled + 1, SIZE);
        return token;
    }

    /**
     * Pushes back the most recently returned token.
     */
    void unscan() {
        if (unread >= filled) {
            throw new IllegalStateException("nothing left to unscan");
        }
        unread++;
    }
}
