package com.grapher.query;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token kinds of the query language.
 *
 * <p>Keywords are matched case-insensitively through {@link #lookup}.
 * Most reserved words are tokenized but not used by the parser.</p>
 */
public enum TokenType {
    // Special tokens
    ILLEGAL("ILLEGAL", Category.SPECIAL),
    EOF("EOF", Category.SPECIAL),
    WS("WS", Category.SPECIAL),
    COMMENT("COMMENT", Category.SPECIAL),

    // Literals
    IDENT("IDENT", Category.LITERAL),
    NUMBER("NUMBER", Category.LITERAL),
    INTEGER("INTEGER", Category.LITERAL),
    STRING("STRING", Category.LITERAL),
    BADSTRING("BADSTRING", Category.LITERAL),
    BADESCAPE("BADESCAPE", Category.LITERAL),
    REL_RANGE("[*", Category.LITERAL),

    // Operators
    PLUS("+", Category.OPERATOR),
    SUB("-", Category.OPERATOR),
    MUL("*", Category.OPERATOR),
    DIV("/", Category.OPERATOR),
    MOD("%", Category.OPERATOR),
    POW("^", Category.OPERATOR),
    EQ("=", Category.OPERATOR),
    NEQ("<>", Category.OPERATOR),
    LT("<", Category.OPERATOR),
    LTE("<=", Category.OPERATOR),
    GT(">", Category.OPERATOR),
    GTE(">=", Category.OPERATOR),
    INC("+=", Category.OPERATOR),
    BAR("|", Category.OPERATOR),
    ARROW_RIGHT("->", Category.OPERATOR),
    ARROW_LEFT("<-", Category.OPERATOR),

    // Punctuation
    LPAREN("(", Category.PUNCTUATION),
    RPAREN(")", Category.PUNCTUATION),
    LBRACE("{", Category.PUNCTUATION),
    RBRACE("}", Category.PUNCTUATION),
    LBRACKET("[", Category.PUNCTUATION),
    RBRACKET("]", Category.PUNCTUATION),
    COMMA(",", Category.PUNCTUATION),
    COLON(":", Category.PUNCTUATION),
    SEMICOLON(";", Category.PUNCTUATION),
    DOT(".", Category.PUNCTUATION),
    DOUBLEDOT("..", Category.PUNCTUATION),

    // Keywords
    ADD("ADD", Category.KEYWORD),
    ALL("ALL", Category.KEYWORD),
    AND("AND", Category.KEYWORD),
    AS("AS", Category.KEYWORD),
    ASC("ASC", Category.KEYWORD),
    ASCENDING("ASCENDING", Category.KEYWORD),
    BY("BY", Category.KEYWORD),
    CASE("CASE", Category.KEYWORD),
    CONSTRAINT("CONSTRAINT", Category.KEYWORD),
    CONTAINS("CONTAINS", Category.KEYWORD),
    CREATE("CREATE", Category.KEYWORD),
    DELETE("DELETE", Category.KEYWORD),
    DESC("DESC", Category.KEYWORD),
    DESCENDING("DESCENDING", Category.KEYWORD),
    DETACH("DETACH", Category.KEYWORD),
    DISTINCT("DISTINCT", Category.KEYWORD),
    DO("DO", Category.KEYWORD),
    DROP("DROP", Category.KEYWORD),
    ELSE("ELSE", Category.KEYWORD),
    END("END", Category.KEYWORD),
    ENDS("ENDS", Category.KEYWORD),
    EXISTS("EXISTS", Category.KEYWORD),
    FALSE("FALSE", Category.KEYWORD),
    FOR("FOR", Category.KEYWORD),
    IN("IN", Category.KEYWORD),
    IS("IS", Category.KEYWORD),
    LIMIT("LIMIT", Category.KEYWORD),
    MANDATORY("MANDATORY", Category.KEYWORD),
    MATCH("MATCH", Category.KEYWORD),
    MERGE("MERGE", Category.KEYWORD),
    NOT("NOT", Category.KEYWORD),
    NULL("NULL", Category.KEYWORD),
    OF("OF", Category.KEYWORD),
    ON("ON", Category.KEYWORD),
    OPTIONAL("OPTIONAL", Category.KEYWORD),
    OR("OR", Category.KEYWORD),
    ORDER("ORDER", Category.KEYWORD),
    REMOVE("REMOVE", Category.KEYWORD),
    REQUIRE("REQUIRE", Category.KEYWORD),
    RETURN("RETURN", Category.KEYWORD),
    SCALAR("SCALAR", Category.KEYWORD),
    SET("SET", Category.KEYWORD),
    SKIP("SKIP", Category.KEYWORD),
    STARTS("STARTS", Category.KEYWORD),
    THEN("THEN", Category.KEYWORD),
    TRUE("TRUE", Category.KEYWORD),
    UNION("UNION", Category.KEYWORD),
    UNIQUE("UNIQUE", Category.KEYWORD),
    UNWIND("UNWIND", Category.KEYWORD),
    WHEN("WHEN", Category.KEYWORD),
    WHERE("WHERE", Category.KEYWORD),
    WITH("WITH", Category.KEYWORD),
    XOR("XOR", Category.KEYWORD);

    /** Token families. */
    private enum Category {
        SPECIAL, LITERAL, OPERATOR, PUNCTUATION, KEYWORD
    }

    /** Lowercase keyword text to token, built once. */
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        for (TokenType type : values()) {
            if (type.category == Category.KEYWORD) {
                keywords.put(type.lexeme.toLowerCase(Locale.ROOT), type);
            }
        }
        KEYWORDS = Map.copyOf(keywords);
    }

    /** Canonical source text of the token. */
    private final String lexeme;
    /** Token family. */
    private final Category category;

    TokenType(final String lexeme, final Category category) {
        this.lexeme = lexeme;
        this.category = category;
    }

    /**
     * Returns the canonical text, as quoted in error messages.
     *
     * @return the lexeme
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * Returns whether this is a reserved word.
     *
     * @return true for keywords
     */
    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    /**
     * Returns whether this is an operator.
     *
     * @return true for operators
     */
    public boolean isOperator() {
        return category == Category.OPERATOR;
    }

    /**
     * Maps an identifier to its keyword, ignoring case.
     *
     * @param ident the identifier text
     * @return the keyword token, or {@link #IDENT} if not reserved
     */
    public static TokenType lookup(final String ident) {
        return KEYWORDS.getOrDefault(ident.toLowerCase(Locale.ROOT), IDENT);
    }
}
