package com.grapher.query;

import com.grapher.query.ast.EdgeDirection;
import com.grapher.query.ast.EdgePattern;
import com.grapher.query.ast.Expr;
import com.grapher.query.ast.IntegerLiteral;
import com.grapher.query.ast.MatchPattern;
import com.grapher.query.ast.NodePattern;
import com.grapher.query.ast.OrderBy;
import com.grapher.query.ast.PatternElement;
import com.grapher.query.ast.Query;
import com.grapher.query.ast.ReadingClause;
import com.grapher.query.ast.SingleQuery;
import com.grapher.query.ast.SortDirection;
import com.grapher.query.ast.StrLiteral;
import com.grapher.query.ast.Variable;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Recursive-descent parser for the pattern query language.
 *
 * <pre>
 * Query         := (SingleQuery ';'?)*
 * SingleQuery   := ReadingClause+ 'RETURN' 'DISTINCT'? Expr (',' Expr)*
 *                  ('ORDER' 'BY' Expr ('ASC'|'DESC')? (',' ...)*)?
 *                  ('SKIP' Expr)? ('LIMIT' Expr)?
 * ReadingClause := 'OPTIONAL'? 'MATCH' MatchPattern (',' MatchPattern)*
 *                  ('WHERE' Expr)?
 * MatchPattern  := (IDENT '=')? NodePattern (EdgePattern NodePattern)*
 * NodePattern   := '(' IDENT? (':' IDENT)* Properties? ')'
 * EdgePattern   := ('-'|'&lt;-') ('[' IDENT? (':' IDENT ('|' IDENT)*)?
 *                  ('*' INT? ('..' INT?)?)? Properties? ']')? ('-'|'-&gt;')
 * Properties    := '{' (IDENT ':' Expr (',' IDENT ':' Expr)*)? '}'
 * Expr          := IDENT | STRING | INTEGER
 * </pre>
 *
 * <p>Parsing stops at the first error. Instances are single-use and not
 * thread-safe; the static helpers create one per call.</p>
 */
public final class Parser {
    /** Token source. */
    private final TokenBuffer tokens;

    /**
     * Creates a parser reading from {@code input}.
     *
     * @param input the query text
     */
    public Parser(final Reader input) {
        this.tokens = new TokenBuffer(new Scanner(input));
    }

    /**
     * Parses exactly one statement. A trailing {@code ;} is allowed.
     *
     * @param text the query text
     * @return the query
     * @throws ParseException if the text is not a single valid statement
     */
    public static Query parse(final String text) throws ParseException {
        Parser parser = new Parser(new StringReader(text));
        Query query = parser.parseStatement();
        parser.skipSemicolons();
        Token next = parser.next();
        if (next.type() != TokenType.EOF) {
            throw unexpected(next, "EOF");
        }
        return query;
    }

    /**
     * Parses every {@code ;}-separated statement.
     *
     * @param text the query text
     * @return the queries in order, empty for blank text
     * @throws ParseException on the first invalid statement
     */
    public static List<Query> parseAll(final String text)
            throws ParseException {
        return new Parser(new StringReader(text)).parseStatements();
    }

    /**
     * Parses statements until end of input.
     *
     * @return the queries in order
     * @throws ParseException on the first invalid statement
     */
    public List<Query> parseStatements() throws ParseException {
        List<Query> queries = new ArrayList<>();
        while (true) {
            skipSemicolons();
            Token token = next();
            if (token.type() == TokenType.EOF) {
                return queries;
            }
            tokens.unscan();
            queries.add(parseStatement());
        }
    }

    /**
     * Parses one statement and its optional terminating {@code ;}.
     *
     * @return the query
     * @throws ParseException if the statement is invalid
     */
    public Query parseStatement() throws ParseException {
        SingleQuery root = parseSingleQuery();
        Token token = next();
        if (token.type() != TokenType.SEMICOLON
                && token.type() != TokenType.EOF) {
            throw unexpected(token, ";");
        }
        if (token.type() == TokenType.EOF) {
            tokens.unscan();
        }
        return new Query(root);
    }

    private SingleQuery parseSingleQuery() throws ParseException {
        List<ReadingClause> reading = new ArrayList<>();
        while (true) {
            Token token = next();
            tokens.unscan();
            if (token.type() != TokenType.MATCH
                    && token.type() != TokenType.OPTIONAL) {
                break;
            }
            reading.add(parseReadingClause());
        }

        Token ret = next();
        if (ret.type() != TokenType.RETURN) {
            if (reading.isEmpty()) {
                throw unexpected(ret, "MATCH", "OPTIONAL");
            }
            throw unexpected(ret, "RETURN");
        }

        boolean distinct = accept(TokenType.DISTINCT);
        List<Expr> items = new ArrayList<>();
        do {
            items.add(parseExpr());
        } while (accept(TokenType.COMMA));

        List<OrderBy> order = new ArrayList<>();
        if (accept(TokenType.ORDER)) {
            expect(TokenType.BY);
            do {
                Expr item = parseExpr();
                SortDirection direction = SortDirection.ASC;
                if (accept(TokenType.DESC) || accept(TokenType.DESCENDING)) {
                    direction = SortDirection.DESC;
                } else if (!accept(TokenType.ASC)) {
                    accept(TokenType.ASCENDING);
                }
                order.add(new OrderBy(item, direction));
            } while (accept(TokenType.COMMA));
        }

        Optional<Expr> skip = accept(TokenType.SKIP)
            ? Optional.of(parseExpr()) : Optional.empty();
        Optional<Expr> limit = accept(TokenType.LIMIT)
            ? Optional.of(parseExpr()) : Optional.empty();

        return new SingleQuery(reading, distinct, items, order, skip, limit);
    }

    private ReadingClause parseReadingClause() throws ParseException {
        boolean optional = accept(TokenType.OPTIONAL);
        expect(TokenType.MATCH);

        List<MatchPattern> patterns = new ArrayList<>();
        do {
            patterns.add(parseMatchPattern());
        } while (accept(TokenType.COMMA));

        Optional<Expr> where = accept(TokenType.WHERE)
            ? Optional.of(parseExpr()) : Optional.empty();
        return new ReadingClause(optional, patterns, where);
    }

    private MatchPattern parseMatchPattern() throws ParseException {
        Optional<Variable> variable = Optional.empty();
        Token token = next();
        if (token.type() == TokenType.IDENT) {
            expect(TokenType.EQ);
            variable = Optional.of(new Variable(token.literal()));
        } else {
            tokens.unscan();
        }

        List<PatternElement> elements = new ArrayList<>();
        elements.add(parseNodePattern());
        while (true) {
            Token start = next();
            tokens.unscan();
            if (start.type() != TokenType.SUB
                    && start.type() != TokenType.ARROW_LEFT) {
                break;
            }
            elements.add(parseEdgePattern());
            elements.add(parseNodePattern());
        }
        return new MatchPattern(variable, elements);
    }

    private NodePattern parseNodePattern() throws ParseException {
        expect(TokenType.LPAREN);

        Optional<Variable> variable = Optional.empty();
        Token token = next();
        if (token.type() == TokenType.IDENT) {
            variable = Optional.of(new Variable(token.literal()));
        } else {
            tokens.unscan();
        }

        List<String> labels = new ArrayList<>();
        while (accept(TokenType.COLON)) {
            labels.add(expect(TokenType.IDENT).literal());
        }

        Map<String, Expr> properties = parseProperties();
        expect(TokenType.RPAREN);
        return new NodePattern(variable, labels, properties);
    }

    private EdgePattern parseEdgePattern() throws ParseException {
        Token start = next();
        boolean left = start.type() == TokenType.ARROW_LEFT;

        Optional<Variable> variable = Optional.empty();
        List<String> relTypes = new ArrayList<>();
        Map<String, Expr> properties = Map.of();
        boolean variableLength = false;
        OptionalInt minHops = OptionalInt.empty();
        OptionalInt maxHops = OptionalInt.empty();

        Token token = next();
        if (token.type() == TokenType.REL_RANGE) {
            variableLength = true;
            int[] range = parseRelRange(token);
            minHops = range[0] < 0 ? OptionalInt.empty() : OptionalInt.of(range[0]);
            maxHops = range[1] < 0 ? OptionalInt.empty() : OptionalInt.of(range[1]);
        } else if (token.type() == TokenType.LBRACKET) {
            Token name = next();
            if (name.type() == TokenType.IDENT) {
                variable = Optional.of(new Variable(name.literal()));
            } else {
                tokens.unscan();
            }

            if (accept(TokenType.COLON)) {
                do {
                    relTypes.add(expect(TokenType.IDENT).literal());
                } while (accept(TokenType.BAR));
            }

            if (accept(TokenType.MUL)) {
                variableLength = true;
                minHops = optionalHops();
                if (accept(TokenType.DOUBLEDOT)) {
                    maxHops = optionalHops();
                }
            }

            properties = parseProperties();
            Token close = next();
            if (close.type() != TokenType.RBRACKET) {
                throw unexpected(close, "]");
            }
        } else {
            tokens.unscan();
        }

        Token end = next();
        boolean right;
        if (end.type() == TokenType.ARROW_RIGHT) {
            right = true;
        } else if (end.type() == TokenType.SUB) {
            right = false;
        } else {
            throw unexpected(end, "-", "->");
        }

        if (minHops.isPresent() && maxHops.isPresent()
                && minHops.getAsInt() > maxHops.getAsInt()) {
            throw SyntaxException.withMessage("minimum hops "
                + minHops.getAsInt() + " exceeds maximum hops "
                + maxHops.getAsInt(), start.pos());
        }

        EdgeDirection direction;
        if (left && right) {
            direction = EdgeDirection.BOTH;
        } else if (left) {
            direction = EdgeDirection.LEFT;
        } else if (right) {
            direction = EdgeDirection.RIGHT;
        } else {
            direction = EdgeDirection.UNDIRECTED;
        }
        return new EdgePattern(direction, variable, relTypes, properties,
            variableLength, minHops, maxHops);
    }

    private OptionalInt optionalHops() throws ParseException {
        Token token = next();
        if (token.type() != TokenType.INTEGER) {
            tokens.unscan();
            return OptionalInt.empty();
        }
        return OptionalInt.of(toHops(token.literal(), token.pos()));
    }

    /**
     * Reads the bounds of a {@code [*...]} token as {min, max}, -1 where
     * a bound is absent.
     */
    private static int[] parseRelRange(final Token token)
            throws SyntaxException {
        String lit = token.literal();
        String body = lit.substring(2, lit.length() - 1).strip();
        int[] range = {-1, -1};
        if (body.isEmpty()) {
            return range;
        }

        int dots = body.indexOf("..");
        String min = dots < 0 ? body : body.substring(0, dots).strip();
        String max = dots < 0 ? "" : body.substring(dots + 2).strip();
        if (!isDigits(min) || !isDigits(max)
                || (min.isEmpty() && max.isEmpty())) {
            throw SyntaxException.withMessage(
                "invalid relationship range " + lit, token.pos());
        }
        if (!min.isEmpty()) {
            range[0] = toHops(min, token.pos());
        }
        if (!max.isEmpty()) {
            range[1] = toHops(max, token.pos());
        }
        return range;
    }

    private static boolean isDigits(final String text) {
        return text.chars().allMatch(ch -> ch >= '0' && ch <= '9');
    }

    private static int toHops(final String digits, final Pos pos)
            throws SyntaxException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw SyntaxException.withMessage("hop count out of range "
                + digits, pos);
        }
    }

    private Map<String, Expr> parseProperties() throws ParseException {
        if (!accept(TokenType.LBRACE)) {
            return Map.of();
        }

        Map<String, Expr> properties = new LinkedHashMap<>();
        if (accept(TokenType.RBRACE)) {
            return properties;
        }
        do {
            Token key = expect(TokenType.IDENT);
            expect(TokenType.COLON);
            Expr value = parseExpr();
            if (properties.putIfAbsent(key.literal(), value) != null) {
                throw SyntaxException.withMessage("duplicate property key "
                    + key.literal(), key.pos());
            }
        } while (accept(TokenType.COMMA));
        expect(TokenType.RBRACE);
        return properties;
    }

    private Expr parseExpr() throws ParseException {
        Token token = next();
        switch (token.type()) {
            case IDENT:
                return new Variable(token.literal());
            case STRING:
                return new StrLiteral(token.literal());
            case INTEGER:
                try {
                    return new IntegerLiteral(Long.parseLong(token.literal()));
                } catch (NumberFormatException e) {
                    throw SyntaxException.withMessage("integer out of range "
                        + token.literal(), token.pos());
                }
            default:
                throw unexpected(token, "identifier", "string", "integer");
        }
    }

    private void skipSemicolons() throws ParseException {
        while (accept(TokenType.SEMICOLON)) {
            // consumed
        }
    }

    /** Consumes the next token if it has the given type. */
    private boolean accept(final TokenType type) throws ParseException {
        if (next().type() == type) {
            return true;
        }
        tokens.unscan();
        return false;
    }

    private Token expect(final TokenType type) throws ParseException {
        Token token = next();
        if (token.type() != type) {
            throw unexpected(token, type == TokenType.IDENT
                ? "identifier" : type.lexeme());
        }
        return token;
    }

    private Token next() throws LexicalException {
        Token token = tokens.scan();
        switch (token.type()) {
            case ILLEGAL:
            case BADSTRING:
            case BADESCAPE:
                throw new LexicalException(token);
            default:
                return token;
        }
    }

    private static SyntaxException unexpected(final Token found,
                                              final String... expected) {
        return new SyntaxException(found.describe(), List.of(expected),
            found.pos());
    }
}
