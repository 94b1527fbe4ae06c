package com.grapher.query;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;

/**
 * Lexical scanner for query text.
 *
 * <p>Produces every token including whitespace and comments; the
 * {@link Parser} filters those out. Lexical problems do not throw here:
 * they surface as {@link TokenType#ILLEGAL}, {@link TokenType#BADSTRING}
 * or {@link TokenType#BADESCAPE} tokens that the parser reports.</p>
 */
public final class Scanner {
    /** Marker returned by the reader at end of input. */
    private static final int EOF = -1;

    /** Character source with unread support. */
    private final CharReader reader;

    /**
     * Create a scanner over a reader.
     *
     * @param input the query text
     */
    public Scanner(final Reader input) {
        this.reader = new CharReader(input);
    }

    /**
     * Create a scanner over a string.
     *
     * @param input the query text
     */
    public Scanner(final String input) {
        this(new StringReader(input));
    }

    /**
     * Returns the next token.
     *
     * @return the token, {@link TokenType#EOF} once input is exhausted
     */
    public Token scan() {
        int ch = reader.read();
        Pos pos = reader.pos();

        if (isWhitespace(ch)) {
            return scanWhitespace(ch, pos);
        } else if (isIdentFirstChar(ch)) {
            reader.unread();
            return scanIdent(pos);
        } else if (isDigit(ch)) {
            reader.unread();
            return scanNumber(pos);
        }

        switch (ch) {
            case EOF:
                return new Token(TokenType.EOF, pos, "");
            case '"':
            case '\'':
                return scanString(ch, pos, TokenType.STRING);
            case '`':
                return scanString(ch, pos, TokenType.IDENT);
            case '+':
                return choose('=', TokenType.INC, TokenType.PLUS, pos);
            case '*':
                return token(TokenType.MUL, pos);
            case '%':
                return token(TokenType.MOD, pos);
            case '^':
                return token(TokenType.POW, pos);
            case '(':
                return token(TokenType.LPAREN, pos);
            case ')':
                return token(TokenType.RPAREN, pos);
            case '{':
                return token(TokenType.LBRACE, pos);
            case '}':
                return token(TokenType.RBRACE, pos);
            case '[':
                if (reader.read() == '*') {
                    return scanRelRange(pos);
                }
                reader.unread();
                return token(TokenType.LBRACKET, pos);
            case ']':
                return token(TokenType.RBRACKET, pos);
            case ',':
                return token(TokenType.COMMA, pos);
            case ';':
                return token(TokenType.SEMICOLON, pos);
            case ':':
                return token(TokenType.COLON, pos);
            case '|':
                return token(TokenType.BAR, pos);
            case '=':
                return token(TokenType.EQ, pos);
            case '-':
                return choose('>', TokenType.ARROW_RIGHT, TokenType.SUB, pos);
            case '.':
                return choose('.', TokenType.DOUBLEDOT, TokenType.DOT, pos);
            case '<':
                int next = reader.read();
                if (next == '>') {
                    return token(TokenType.NEQ, pos);
                } else if (next == '=') {
                    return token(TokenType.LTE, pos);
                } else if (next == '-') {
                    return token(TokenType.ARROW_LEFT, pos);
                }
                reader.unread();
                return token(TokenType.LT, pos);
            case '>':
                return choose('=', TokenType.GTE, TokenType.GT, pos);
            case '/':
                return scanSlash(pos);
            default:
                return new Token(TokenType.ILLEGAL, pos,
                    new String(Character.toChars(ch)));
        }
    }

    private static Token token(final TokenType type, final Pos pos) {
        return new Token(type, pos, type.lexeme());
    }

    /** Two-character operator if {@code second} follows, else one. */
    private Token choose(final int second, final TokenType ifMatched,
                         final TokenType otherwise, final Pos pos) {
        if (reader.read() == second) {
            return token(ifMatched, pos);
        }
        reader.unread();
        return token(otherwise, pos);
    }

    private Token scanWhitespace(final int first, final Pos pos) {
        StringBuilder buf = new StringBuilder();
        buf.appendCodePoint(first);
        while (true) {
            int ch = reader.read();
            if (!isWhitespace(ch)) {
                reader.unread();
                break;
            }
            buf.appendCodePoint(ch);
        }
        return new Token(TokenType.WS, pos, buf.toString());
    }

    private Token scanIdent(final Pos pos) {
        StringBuilder buf = new StringBuilder();
        while (true) {
            int ch = reader.read();
            if (!isIdentChar(ch)) {
                reader.unread();
                break;
            }
            buf.appendCodePoint(ch);
        }
        String lit = buf.toString();
        return new Token(TokenType.lookup(lit), pos, lit);
    }

    /**
     * Reads a quoted literal whose opening quote {@code quote} has been
     * consumed. A newline or end of input before the closing quote makes a
     * {@link TokenType#BADSTRING}.
     */
    private Token scanString(final int quote, final Pos pos,
                             final TokenType type) {
        StringBuilder buf = new StringBuilder();
        while (true) {
            int ch = reader.read();
            if (ch == quote) {
                return new Token(type, pos, buf.toString());
            } else if (ch == EOF || ch == '\n') {
                return new Token(TokenType.BADSTRING, pos, buf.toString());
            } else if (ch == '\\') {
                Pos escapePos = reader.pos();
                int escaped = reader.read();
                switch (escaped) {
                    case 'n':
                        buf.append('\n');
                        break;
                    case '\\':
                    case '"':
                    case '\'':
                    case '`':
                        buf.appendCodePoint(escaped);
                        break;
                    default:
                        String seq = escaped == EOF
                            ? "\\"
                            : "\\" + new String(Character.toChars(escaped));
                        return new Token(TokenType.BADESCAPE, escapePos, seq);
                }
            } else {
                buf.appendCodePoint(ch);
            }
        }
    }

    private Token scanNumber(final Pos pos) {
        StringBuilder buf = new StringBuilder(scanDigits());

        int dot = reader.read();
        if (dot == '.') {
            int fraction = reader.read();
            if (isDigit(fraction)) {
                reader.unread();
                buf.append('.').append(scanDigits());
                return new Token(TokenType.NUMBER, pos, buf.toString());
            }
            // "1..3" or "1.x": the dot belongs to the next token.
            reader.unread();
        }
        reader.unread();
        return new Token(TokenType.INTEGER, pos, buf.toString());
    }

    private String scanDigits() {
        StringBuilder buf = new StringBuilder();
        while (true) {
            int ch = reader.read();
            if (!isDigit(ch)) {
                reader.unread();
                return buf.toString();
            }
            buf.append((char) ch);
        }
    }

    private Token scanSlash(final Pos pos) {
        int next = reader.read();
        if (next == '/') {
            StringBuilder buf = new StringBuilder("//");
            while (true) {
                int ch = reader.read();
                if (ch == '\n' || ch == EOF) {
                    return new Token(TokenType.COMMENT, pos, buf.toString());
                }
                buf.appendCodePoint(ch);
            }
        } else if (next == '*') {
            // Block comments do not nest: the first "*/" ends it.
            StringBuilder buf = new StringBuilder("/*");
            int prev = EOF;
            while (true) {
                int ch = reader.read();
                if (ch == EOF) {
                    return new Token(TokenType.ILLEGAL, pos, buf.toString());
                }
                buf.appendCodePoint(ch);
                if (prev == '*' && ch == '/') {
                    return new Token(TokenType.COMMENT, pos, buf.toString());
                }
                prev = ch;
            }
        }
        reader.unread();
        return token(TokenType.DIV, pos);
    }

    /**
     * Reads a variable-length relationship such as {@code [*1..3]}; the
     * opening {@code [*} has been consumed.
     */
    private Token scanRelRange(final Pos pos) {
        StringBuilder buf = new StringBuilder("[*");
        while (true) {
            int ch = reader.read();
            if (ch == EOF) {
                return new Token(TokenType.ILLEGAL, pos, buf.toString());
            }
            buf.appendCodePoint(ch);
            if (ch == ']') {
                return new Token(TokenType.REL_RANGE, pos, buf.toString());
            }
        }
    }

    private static boolean isWhitespace(final int ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\f';
    }

    private static boolean isDigit(final int ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isIdentFirstChar(final int ch) {
        return ch != EOF && (Character.isLetter(ch) || ch == '_');
    }

    private static boolean isIdentChar(final int ch) {
        return ch != EOF && (Character.isLetterOrDigit(ch) || ch == '_');
    }

    /**
     * Code point reader keeping the last three code points so up to three
     * of them can be pushed back. Line breaks ({@code \r\n}, {@code \r} or
     * {@code \n}) are all reported as {@code \n}.
     */
    private static final class CharReader {
        /** Size of the unread buffer. */
        private static final int CAPACITY = 3;

        /**
         * Underlying source. Two chars of pushback hold a code point read
         * ahead after {@code \r}, which may be a surrogate pair.
         */
        private final PushbackReader in;
        /** Recently read code points. */
        private final int[] chars = new int[CAPACITY];
        /** Positions of {@link #chars}. */
        private final Pos[] positions = new Pos[CAPACITY];
        /** Slot of the most recently read code point. */
        private int index;
        /** Number of code points pushed back. */
        private int unread;
        /** Line of the next fresh code point. */
        private int line = 1;
        /** Column of the next fresh code point. */
        private int column = 1;
        /** Offset of the next fresh code point. */
        private int offset;

        CharReader(final Reader input) {
            this.in = new PushbackReader(input, 2);
            positions[0] = Pos.START;
            chars[0] = EOF;
        }

        int read() {
            if (unread > 0) {
                unread--;
                return chars[current()];
            }

            int ch = next();
            int width = Character.charCount(Math.max(ch, 0));
            if (ch == '\r') {
                int following = next();
                if (following == '\n') {
                    width++;
                } else if (following != EOF) {
                    pushBack(following);
                }
                ch = '\n';
            }

            Pos pos = new Pos(line, column, offset);
            if (ch == '\n') {
                line++;
                column = 1;
                offset += width;
            } else if (ch != EOF) {
                column++;
                offset += width;
            }

            index = (index + 1) % CAPACITY;
            chars[index] = ch;
            positions[index] = pos;
            return ch;
        }

        void unread() {
            if (unread >= CAPACITY) {
                throw new IllegalStateException("unread buffer overflow");
            }
            unread++;
        }

        /** Position of the most recently returned code point. */
        Pos pos() {
            return positions[current()];
        }

        private int current() {
            return (index - unread + CAPACITY) % CAPACITY;
        }

        private int next() {
            try {
                int high = in.read();
                if (high == EOF || !Character.isHighSurrogate((char) high)) {
                    return high;
                }
                int low = in.read();
                if (low == EOF || !Character.isLowSurrogate((char) low)) {
                    if (low != EOF) {
                        in.unread(low);
                    }
                    return high;
                }
                return Character.toCodePoint((char) high, (char) low);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read query", e);
            }
        }

        private void pushBack(final int ch) {
            try {
                in.unread(Character.toChars(ch));
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read query", e);
            }
        }
    }
}
