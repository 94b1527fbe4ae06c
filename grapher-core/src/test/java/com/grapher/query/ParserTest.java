package com.grapher.query;

import com.grapher.query.ast.EdgeDirection;
import com.grapher.query.ast.EdgePattern;
import com.grapher.query.ast.IntegerLiteral;
import com.grapher.query.ast.MatchPattern;
import com.grapher.query.ast.NodePattern;
import com.grapher.query.ast.Query;
import com.grapher.query.ast.ReadingClause;
import com.grapher.query.ast.SingleQuery;
import com.grapher.query.ast.SortDirection;
import com.grapher.query.ast.StrLiteral;
import com.grapher.query.ast.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Parser.
 */
public class ParserTest {

    private static EdgePattern edge(final String text) throws ParseException {
        Query query = Parser.parse("MATCH (a)" + text + "(b) RETURN a");
        return (EdgePattern) query.root().reading().get(0).patterns().get(0)
            .elements().get(1);
    }

    @Test
    @DisplayName("Test variable-length pattern with properties")
    public void testVariableLengthPattern() throws Exception {
        Query query = Parser.parse(
            "MATCH (a {k: 'v'})-[*1..3]->(b) RETURN a, b;");
        SingleQuery root = query.root();

        assertEquals(1, root.reading().size());
        ReadingClause clause = root.reading().get(0);
        assertFalse(clause.optional());
        assertEquals(1, clause.patterns().size());

        MatchPattern pattern = clause.patterns().get(0);
        assertEquals(3, pattern.elements().size());
        NodePattern a = (NodePattern) pattern.elements().get(0);
        EdgePattern edge = (EdgePattern) pattern.elements().get(1);
        NodePattern b = (NodePattern) pattern.elements().get(2);

        assertEquals(Optional.of(new Variable("a")), a.variable());
        assertEquals(Map.of("k", new StrLiteral("v")), a.properties());
        assertEquals(Optional.of(new Variable("b")), b.variable());
        assertEquals(EdgeDirection.RIGHT, edge.direction());
        assertTrue(edge.variableLength());
        assertEquals(OptionalInt.of(1), edge.minHops());
        assertEquals(OptionalInt.of(3), edge.maxHops());
        assertEquals(List.of(new Variable("a"), new Variable("b")),
            root.returnItems());
    }

    @Test
    @DisplayName("Test missing closing parenthesis reports position and expectation")
    public void testMissingParen() {
        SyntaxException e = assertThrows(SyntaxException.class,
            () -> Parser.parse("MATCH (a RETURN a;"));
        assertTrue(e.getExpected().contains(")"));
        assertEquals("RETURN", e.getFound());
        assertEquals(new Pos(1, 10, 9), e.getPos());
        assertTrue(e.getMessage().contains("line 1, char 10"));
    }

    @Test
    @DisplayName("Test edge directions")
    public void testEdgeDirections() throws Exception {
        assertEquals(EdgeDirection.RIGHT, edge("-->").direction());
        assertEquals(EdgeDirection.LEFT, edge("<--").direction());
        assertEquals(EdgeDirection.UNDIRECTED, edge("--").direction());
        assertEquals(EdgeDirection.BOTH, edge("<-->").direction());
        assertEquals(EdgeDirection.LEFT, edge("<-[*2]-").direction());
        assertFalse(edge("-->").variableLength());
    }

    @Test
    @DisplayName("Test hop range forms")
    public void testHopRanges() throws Exception {
        EdgePattern star = edge("-[*]->");
        assertTrue(star.variableLength());
        assertEquals(OptionalInt.empty(), star.minHops());
        assertEquals(OptionalInt.empty(), star.maxHops());
        assertEquals(1, star.effectiveMinHops());
        assertEquals(-1, star.effectiveMaxHops());

        EdgePattern min = edge("-[*2]->");
        assertEquals(OptionalInt.of(2), min.minHops());
        assertEquals(OptionalInt.empty(), min.maxHops());

        EdgePattern max = edge("-[*..4]->");
        assertEquals(OptionalInt.empty(), max.minHops());
        assertEquals(OptionalInt.of(4), max.maxHops());

        EdgePattern open = edge("-[r*2..]->");
        assertEquals(Optional.of(new Variable("r")), open.variable());
        assertEquals(OptionalInt.of(2), open.minHops());
        assertEquals(OptionalInt.empty(), open.maxHops());

        EdgePattern plain = edge("-->");
        assertFalse(plain.variableLength());
        assertEquals(1, plain.effectiveMinHops());
        assertEquals(-1, plain.effectiveMaxHops());
    }

    @Test
    @DisplayName("Test bracketed edge with variable, types and properties")
    public void testEdgeDetails() throws Exception {
        EdgePattern e = edge("-[r:KNOWS|LIKES *1..2 {since: 2020}]->");
        assertEquals(Optional.of(new Variable("r")), e.variable());
        assertEquals(List.of("KNOWS", "LIKES"), e.relTypes());
        assertEquals(Map.of("since", new IntegerLiteral(2020)), e.properties());
        assertEquals(OptionalInt.of(1), e.minHops());
        assertEquals(OptionalInt.of(2), e.maxHops());
    }

    @Test
    @DisplayName("Test minimum hops above maximum is rejected")
    public void testInvertedRange() {
        assertThrows(SyntaxException.class, () -> edge("-[*3..1]->"));
        assertThrows(SyntaxException.class, () -> edge("-[r*3..1]->"));
        assertThrows(SyntaxException.class, () -> edge("-[*x]->"));
    }

    @Test
    @DisplayName("Test node labels, path variable and several patterns")
    public void testNodesAndPatterns() throws Exception {
        Query query = Parser.parse(
            "OPTIONAL MATCH p = (a:Person:Admin {age: 30}), (b) RETURN p");
        ReadingClause clause = query.root().reading().get(0);
        assertTrue(clause.optional());
        assertEquals(2, clause.patterns().size());

        MatchPattern first = clause.patterns().get(0);
        assertEquals(Optional.of(new Variable("p")), first.variable());
        NodePattern a = (NodePattern) first.elements().get(0);
        assertEquals(List.of("Person", "Admin"), a.labels());
        assertEquals(Map.of("age", new IntegerLiteral(30)), a.properties());

        NodePattern anonymous = (NodePattern) Parser.parse(
            "MATCH () RETURN 1").root().reading().get(0).patterns().get(0)
            .elements().get(0);
        assertTrue(anonymous.variable().isEmpty());
    }

    @Test
    @DisplayName("Test RETURN modifiers")
    public void testReturnModifiers() throws Exception {
        SingleQuery root = Parser.parse("MATCH (a)-->(b) WHERE a "
            + "RETURN DISTINCT a, b, 'x', 7 ORDER BY a DESC, b ASC, a "
            + "SKIP 2 LIMIT 5").root();

        assertEquals(Optional.of(new Variable("a")),
            root.reading().get(0).where());
        assertTrue(root.distinct());
        assertEquals(List.of(new Variable("a"), new Variable("b"),
            new StrLiteral("x"), new IntegerLiteral(7)), root.returnItems());
        assertEquals(3, root.order().size());
        assertEquals(SortDirection.DESC, root.order().get(0).direction());
        assertEquals(SortDirection.ASC, root.order().get(1).direction());
        assertEquals(SortDirection.ASC, root.order().get(2).direction());
        assertEquals(Optional.of(new IntegerLiteral(2)), root.skip());
        assertEquals(Optional.of(new IntegerLiteral(5)), root.limit());
    }

    @Test
    @DisplayName("Test syntax errors carry what was expected")
    public void testSyntaxErrors() {
        SyntaxException noReturn = assertThrows(SyntaxException.class,
            () -> Parser.parse("MATCH (a)"));
        assertEquals(List.of("RETURN"), noReturn.getExpected());
        assertEquals("EOF", noReturn.getFound());

        SyntaxException noMatch = assertThrows(SyntaxException.class,
            () -> Parser.parse("RETURN a"));
        assertEquals(List.of("MATCH", "OPTIONAL"), noMatch.getExpected());

        SyntaxException noBy = assertThrows(SyntaxException.class,
            () -> Parser.parse("MATCH (a) RETURN a ORDER a"));
        assertEquals(List.of("BY"), noBy.getExpected());

        SyntaxException badEdge = assertThrows(SyntaxException.class,
            () -> Parser.parse("MATCH (a)-(b) RETURN a"));
        assertEquals(List.of("-", "->"), badEdge.getExpected());

        SyntaxException badProp = assertThrows(SyntaxException.class,
            () -> Parser.parse("MATCH (a {k 'v'}) RETURN a"));
        assertEquals(List.of(":"), badProp.getExpected());
        assertEquals("'v'", badProp.getFound());
    }

    @Test
    @DisplayName("Test duplicate property keys are rejected")
    public void testDuplicateKeys() {
        SyntaxException e = assertThrows(SyntaxException.class,
            () -> Parser.parse("MATCH (a {k: 1, k: 2}) RETURN a"));
        assertTrue(e.getMessage().contains("duplicate property key k"));
    }

    @Test
    @DisplayName("Test lexical errors surface as LexicalException")
    public void testLexicalErrors() {
        assertThrows(LexicalException.class,
            () -> Parser.parse("MATCH (a {k: 'v}) RETURN a"));
        LexicalException escape = assertThrows(LexicalException.class,
            () -> Parser.parse("MATCH (a {k: 'a\\zb'}) RETURN a"));
        assertEquals(TokenType.BADESCAPE, escape.getToken().type());
        assertThrows(LexicalException.class,
            () -> Parser.parse("MATCH (a) RETURN a $"));
        assertThrows(LexicalException.class,
            () -> Parser.parse("MATCH (a) /* never closed RETURN a"));
    }

    @Test
    @DisplayName("Test comments and whitespace are ignored")
    public void testCommentsIgnored() throws Exception {
        Query query = Parser.parse("// find things\nMATCH /* all */ (a)\n"
            + "RETURN a ;");
        assertEquals(List.of(new Variable("a")), query.root().returnItems());
    }

    @Test
    @DisplayName("Test single-statement parse rejects a second statement")
    public void testSecondStatementRejected() throws Exception {
        assertNotNull(Parser.parse("MATCH (a) RETURN a;;"));
        SyntaxException e = assertThrows(SyntaxException.class,
            () -> Parser.parse("MATCH (a) RETURN a; MATCH (b) RETURN b"));
        assertEquals("MATCH", e.getFound());
    }

    @Test
    @DisplayName("Test parseAll returns every statement")
    public void testParseAll() throws Exception {
        List<Query> queries = Parser.parseAll(
            "MATCH (a) RETURN a; MATCH (b)-->(c) RETURN c;");
        assertEquals(2, queries.size());
        assertEquals(List.of(new Variable("c")),
            queries.get(1).root().returnItems());
        assertTrue(Parser.parseAll("  ").isEmpty());
    }

    @Test
    @DisplayName("Test toString renders text that parses to the same query")
    public void testToStringRoundTrip() throws Exception {
        String[] texts = {
            "MATCH (a {k: 'v'})-[*1..3]->(b) RETURN a, b",
            "OPTIONAL MATCH p = (a:Person)<-[r:KNOWS|LIKES*2..]-(b) "
                + "RETURN DISTINCT p, 'it''s' ORDER BY p DESC SKIP 1 LIMIT 2",
            "MATCH (`odd name`)<-->(b {n: 5}), (c) WHERE c RETURN c",
            "MATCH (a)--(b) RETURN a",
        };
        for (String text : texts) {
            String source = text.replace("''", "\\'");
            Query query = Parser.parse(source);
            assertEquals(query, Parser.parse(query.toString()),
                "round trip of " + query);
        }
        assertEquals("MATCH (a {k: 'v'})-[*1..3]->(b) RETURN a, b;",
            Parser.parse(texts[0]).toString());
    }
}
