package com.grapher.query;

import com.grapher.graph.GraphStore;
import com.grapher.graph.Node;
import com.grapher.graph.NotFoundException;
import com.grapher.graph.PropertyGraph;
import com.grapher.query.ast.IntegerLiteral;
import com.grapher.query.ast.Query;
import com.grapher.query.ast.SingleQuery;
import com.grapher.query.ast.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for QueryExecutor.
 */
public class QueryExecutorTest {

    private PropertyGraph graph;

    @BeforeEach
    public void setUp() {
        // A -> B -> C -> D
        graph = new PropertyGraph("test");
        graph.addNode("A", Set.of("Start"), Map.of("k", "v", "name", "A"));
        graph.addNode("B", Map.of("name", "B", "rank", 2L));
        graph.addNode("C", Map.of("name", "C", "rank", 1L));
        graph.addNode("D", Map.of("name", "D", "rank", 2L));
        graph.addEdge("A", "B", 1.0);
        graph.addEdge("B", "C", 1.0);
        graph.addEdge("C", "D", 1.0);
    }

    private List<ResultRow> run(final String text) throws Exception {
        return QueryExecutor.execute(Parser.parse(text), graph);
    }

    private static List<String> ids(final List<ResultRow> rows,
                                    final String column) {
        return rows.stream()
            .map(row -> ((Node) row.get(column)).id())
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Test variable-length pattern binds every reachable node")
    public void testVariableLength() throws Exception {
        List<ResultRow> rows = run(
            "MATCH (a {k: 'v'})-[*1..3]->(b) RETURN a, b;");

        assertEquals(List.of("B", "C", "D"), ids(rows, "b"));
        assertEquals(List.of("A", "A", "A"), ids(rows, "a"));
        assertEquals(List.of("a", "b"), rows.get(0).columns());
    }

    @Test
    @DisplayName("Test hop window bounds")
    public void testHopWindow() throws Exception {
        assertEquals(List.of("C", "D"),
            ids(run("MATCH (a {k: 'v'})-[*2]->(b) RETURN b"), "b"));
        assertEquals(List.of("B", "C"),
            ids(run("MATCH (a {k: 'v'})-[*..2]->(b) RETURN b"), "b"));
        assertEquals(List.of("A", "B"),
            ids(run("MATCH (a {k: 'v'})-[*0..1]->(b) RETURN b"), "b"));
        assertEquals(List.of("B"),
            ids(run("MATCH (a:Start)-[*..1]->(b) RETURN b"), "b"));
    }

    @Test
    @DisplayName("Test plain edge reaches every downstream node")
    public void testPlainEdgeUnbounded() throws Exception {
        assertEquals(List.of("B", "C", "D"),
            ids(run("MATCH (a {k: 'v'})-->(b) RETURN b;"), "b"));
        assertEquals(List.of("B", "C", "D"),
            ids(run("MATCH (a {k: 'v'})-[]->(b) RETURN b;"), "b"));
        assertEquals(List.of("C", "B", "A"),
            ids(run("MATCH (d {name: 'D'})<--(x) RETURN x"), "x"));
        assertTrue(run("MATCH (d {name: 'D'})-->(x) RETURN x").isEmpty());
    }

    @Test
    @DisplayName("Test incoming and undirected edges")
    public void testDirections() throws Exception {
        assertEquals(List.of("C", "B", "A"),
            ids(run("MATCH (d {name: 'D'})<-[*]-(x) RETURN x"), "x"));
        assertEquals(Set.of("A", "B", "D"),
            Set.copyOf(ids(run("MATCH (c {name: 'C'})--(x) RETURN x"), "x")));
        assertEquals(Set.of("A", "B", "D"),
            Set.copyOf(ids(run("MATCH (c {name: 'C'})<-->(x) RETURN x"), "x")));
        assertEquals(Set.of("B", "D"),
            Set.copyOf(ids(run("MATCH (c {name: 'C'})-[*..1]-(x) RETURN x"),
                "x")));
    }

    @Test
    @DisplayName("Test target node pattern filters end nodes")
    public void testTargetFilter() throws Exception {
        assertEquals(List.of("B", "D"),
            ids(run("MATCH (a {k: 'v'})-[*]->(b {rank: 2}) RETURN b"), "b"));
        assertEquals(List.of("C"),
            ids(run("MATCH (a {k: 'v'})-->(b {rank: 1}) RETURN b"), "b"));
        assertTrue(run("MATCH (a {k: 'v'})-->(b {rank: 9}) RETURN b")
            .isEmpty());
    }

    @Test
    @DisplayName("Test multi-segment chain")
    public void testChain() throws Exception {
        List<ResultRow> rows = run(
            "MATCH (a {k: 'v'})-->(b)-[*1..2]->(c) RETURN b, c");
        assertEquals(List.of("B", "B", "C"), ids(rows, "b"));
        assertEquals(List.of("C", "D", "D"), ids(rows, "c"));
    }

    @Test
    @DisplayName("Test path variable returns the walked nodes")
    public void testPathVariable() throws Exception {
        List<ResultRow> rows = run(
            "MATCH p = (a {k: 'v'})-->(b)-[*2..2]->(c) RETURN p, 'x', 5");
        assertEquals(1, rows.size());
        ResultRow row = rows.get(0);
        assertEquals(List.of("p", "'x'", "5"), row.columns());
        @SuppressWarnings("unchecked")
        List<Node> path = (List<Node>) row.get("p");
        assertEquals(List.of("A", "B", "C", "D"),
            path.stream().map(Node::id).collect(Collectors.toList()));
        assertEquals("x", row.get("'x'"));
        assertEquals(5L, row.get("5"));
    }

    @Test
    @DisplayName("Test OPTIONAL MATCH without matches yields a null row")
    public void testOptionalNullRow() throws Exception {
        List<ResultRow> rows = run(
            "OPTIONAL MATCH (a {k: 'missing'})-->(b) RETURN a, b");
        assertEquals(1, rows.size());
        assertNull(rows.get(0).get("a"));
        assertNull(rows.get(0).get("b"));
        assertEquals(List.of("a", "b"), rows.get(0).columns());

        assertTrue(run("MATCH (a {k: 'missing'}) RETURN a").isEmpty());
        assertEquals(1, run("OPTIONAL MATCH (a {k: 'v'}) RETURN a").size());
    }

    @Test
    @DisplayName("Test DISTINCT collapses equal rows")
    public void testDistinct() throws Exception {
        assertEquals(6, run("MATCH (a)-->(b) RETURN 'x'").size());
        List<ResultRow> rows = run("MATCH (a)-->(b) RETURN DISTINCT 'x'");
        assertEquals(1, rows.size());
        assertEquals("x", rows.get(0).get("'x'"));
    }

    @Test
    @DisplayName("Test ORDER BY, SKIP and LIMIT")
    public void testOrderSkipLimit() throws Exception {
        assertEquals(List.of("D", "C", "B", "A"),
            ids(run("MATCH (n) RETURN n ORDER BY n DESC"), "n"));
        assertEquals(List.of("C", "B"),
            ids(run("MATCH (n) RETURN n ORDER BY n DESC SKIP 1 LIMIT 2"), "n"));
        assertEquals(List.of("A", "B"),
            ids(run("MATCH (n) RETURN n LIMIT 2"), "n"));
        assertTrue(run("MATCH (n) RETURN n SKIP 10").isEmpty());
        assertTrue(run("MATCH (n) RETURN n LIMIT 0").isEmpty());
        assertEquals(4, run("MATCH (n) RETURN n ORDER BY 1").size());
    }

    @Test
    @DisplayName("Test unsupported query shapes are rejected")
    public void testStructureErrors() {
        String[] queries = {
            "MATCH (a) MATCH (b) RETURN a",
            "MATCH (a), (b) RETURN a",
            "MATCH (a) RETURN z",
            "MATCH (a)-[r]->(b) RETURN r",
            "MATCH (a)-->(a) RETURN a",
            "MATCH a = (a)-->(b) RETURN a",
            "MATCH (a)-->(b) RETURN a ORDER BY b",
        };
        for (String text : queries) {
            assertThrows(QueryStructureException.class, () -> run(text), text);
        }

        Query empty = new Query(new SingleQuery(List.of(), false,
            List.of(new IntegerLiteral(1)), List.of(), Optional.empty(),
            Optional.empty()));
        QueryStructureException e = assertThrows(
            QueryStructureException.class,
            () -> QueryExecutor.execute(empty, graph));
        assertEquals("query has no MATCH clause", e.getMessage());
    }

    @Test
    @DisplayName("Test unsupported expressions are rejected")
    public void testExecutionErrors() throws Exception {
        String[] queries = {
            "MATCH (a) WHERE a RETURN a",
            "MATCH (a)-[:KNOWS]->(b) RETURN a",
            "MATCH (a)-[{since: 1}]->(b) RETURN a",
            "MATCH (a {k: x}) RETURN a",
            "MATCH (a) RETURN a SKIP x",
            "MATCH (a) RETURN a LIMIT 'ten'",
        };
        for (String text : queries) {
            assertThrows(QueryExecutionException.class, () -> run(text), text);
        }

        Query negative = new Query(new SingleQuery(
            Parser.parse("MATCH (a) RETURN a").root().reading(), false, List.of(new Variable("a")), List.of(),
            Optional.of(new IntegerLiteral(-1)), Optional.empty()));
        assertThrows(QueryExecutionException.class,
            () -> QueryExecutor.execute(negative, graph));
    }

    @Test
    @DisplayName("Test uncomparable property aborts the query")
    public void testCoercionFailure() {
        graph.addNode("E", Map.of("flag", true));
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
            () -> run("MATCH (a {flag: 1}) RETURN a"));
        assertTrue(e.getMessage().contains("Boolean"));

        graph.addEdge("D", "E", 1.0);
        assertThrows(QueryExecutionException.class,
            () -> run("MATCH (a {k: 'v'})-[*]->(b {flag: 1}) RETURN b"));
    }

    @Test
    @DisplayName("Test each combination of bound nodes yields one row")
    public void testRowPerBinding() throws Exception {
        // Two routes from A to D.
        graph.addEdge("A", "D", 1.0);
        List<ResultRow> rows = run("MATCH (a {k: 'v'})-[*]->(b) RETURN b");
        assertEquals(List.of("B", "C", "D"), ids(rows, "b"));
    }

    @Test
    @DisplayName("Test start nodes removed before traversal are skipped")
    public void testRemovedStartNode() throws Exception {
        GraphStore store = mock(GraphStore.class);
        Node gone = new Node("X", Set.of(), Map.of());
        when(store.allNodes()).thenReturn(List.of(gone));
        when(store.getNode("X")).thenThrow(
            new NotFoundException("node not found: X"));

        List<ResultRow> rows = QueryExecutor.execute(
            Parser.parse("MATCH (a)-->(b) RETURN b"), store);
        assertTrue(rows.isEmpty());
    }
}
