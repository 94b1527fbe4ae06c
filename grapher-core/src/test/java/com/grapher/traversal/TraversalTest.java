package com.grapher.traversal;

import com.grapher.graph.Edge;
import com.grapher.graph.GraphStore;
import com.grapher.graph.Node;
import com.grapher.graph.NotFoundException;
import com.grapher.graph.PropertyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for Traversal and DepthFirstTraverser.
 */
public class TraversalTest {

    private PropertyGraph graph;

    @BeforeEach
    public void setUp() {
        graph = new PropertyGraph("traversal_test");
    }

    private void chain(final String... ids) {
        for (String id : ids) {
            graph.addNode(id, Map.of());
        }
        for (int i = 0; i + 1 < ids.length; i++) {
            graph.addEdge(ids[i], ids[i + 1], 1.0);
        }
    }

    private static List<String> ids(final DepthFirstTraverser traverser) {
        List<String> ids = new ArrayList<>();
        while (traverser.hasNext()) {
            ids.add(traverser.next().endNode().id());
        }
        return ids;
    }

    private static Set<String> idSet(final DepthFirstTraverser traverser) {
        return new HashSet<>(ids(traverser));
    }

    @Test
    @DisplayName("Test unbounded walk along a chain")
    public void testChainUnbounded() {
        chain("A", "B", "C", "D");
        DepthFirstTraverser traverser = Traversal.from(graph, "A").iterator();

        List<Integer> depths = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        while (traverser.hasNext()) {
            TraversalPath path = traverser.next();
            ids.add(path.endNode().id());
            depths.add(path.depth());
        }
        assertEquals(List.of("A", "B", "C", "D"), ids);
        assertEquals(List.of(0, 1, 2, 3), depths);
    }

    @Test
    @DisplayName("Test maxDepth bounds the walk")
    public void testMaxDepth() {
        chain("A", "B", "C", "D");
        assertEquals(List.of("A", "B", "C"),
            ids(Traversal.from(graph, "A").maxDepth(2).iterator()));
        assertEquals(List.of("A"),
            ids(Traversal.from(graph, "A").maxDepth(0).iterator()));
        assertEquals(List.of("A", "B", "C", "D"),
            ids(Traversal.from(graph, "A").maxDepth(-5).iterator()));
    }

    @Test
    @DisplayName("Test incoming direction walks edges backwards")
    public void testIncoming() {
        chain("A", "B", "C", "D");
        assertEquals(List.of("D", "C", "B", "A"),
            ids(Traversal.from(graph, "D")
                .direction(Direction.INCOMING).iterator()));
        assertEquals(List.of("A"),
            ids(Traversal.from(graph, "A")
                .direction(Direction.INCOMING).iterator()));
    }

    @Test
    @DisplayName("Test both directions reach predecessors and successors")
    public void testBothDirections() {
        chain("A", "B", "C");
        assertEquals(Set.of("A", "B", "C"),
            idSet(Traversal.from(graph, "B").direction(Direction.BOTH)
                .maxDepth(1).iterator()));
    }

    @Test
    @DisplayName("Test maxDepth k yields nodes within k hops on a tree")
    public void testTreeWithinDepth() {
        for (String id : List.of("R", "X", "Y", "X1", "X2", "Y1", "Y2")) {
            graph.addNode(id, Map.of());
        }
        graph.addEdge("R", "X", 1.0);
        graph.addEdge("R", "Y", 1.0);
        graph.addEdge("X", "X1", 1.0);
        graph.addEdge("X", "X2", 1.0);
        graph.addEdge("Y", "Y1", 1.0);
        graph.addEdge("Y1", "Y2", 1.0);

        List<String> reached = ids(Traversal.from(graph, "R").maxDepth(2)
            .iterator());
        assertEquals(Set.of("R", "X", "Y", "X1", "X2", "Y1"),
            new HashSet<>(reached));
        assertEquals(reached.size(), new HashSet<>(reached).size());
    }

    @Test
    @DisplayName("Test cycles report every node once")
    public void testCycle() {
        chain("A", "B", "C");
        graph.addEdge("C", "A", 1.0);
        assertEquals(List.of("A", "B", "C"),
            ids(Traversal.from(graph, "A").iterator()));
    }

    @Test
    @DisplayName("Test missing start node fails")
    public void testMissingStart() {
        Traversal traversal = Traversal.from(graph, "missing");
        assertThrows(NotFoundException.class, traversal::iterator);
    }

    @Test
    @DisplayName("Test iterator contract")
    public void testIteratorContract() {
        chain("A", "B");
        DepthFirstTraverser traverser = Traversal.from(graph, "A").iterator();
        assertEquals(0, traverser.currentDepth());
        assertTrue(traverser.hasNext());
        assertTrue(traverser.hasNext());
        assertEquals("A", traverser.next().endNode().id());
        assertEquals("B", traverser.next().endNode().id());
        assertFalse(traverser.hasNext());
        assertEquals(-1, traverser.currentDepth());
        assertThrows(NoSuchElementException.class, traverser::next);
    }

    @Test
    @DisplayName("Test path rebuilds the branch from start to end")
    public void testPathNodes() {
        chain("A", "B", "C", "D");
        DepthFirstTraverser traverser = Traversal.from(graph, "A").iterator();
        TraversalPath last = null;
        while (traverser.hasNext()) {
            last = traverser.next();
        }

        assertNotNull(last);
        assertEquals(List.of("A", "B", "C", "D"),
            last.nodes().stream().map(Node::id).toList());
        assertEquals("C", last.previous().orElseThrow().endNode().id());
        assertEquals("A->B->C->D", last.toString());
        TraversalPath first = last;
        while (first.previous().isPresent()) {
            first = first.previous().get();
        }
        assertEquals(0, first.depth());
    }

    @Test
    @DisplayName("Test iterate propagates the visitor's exception and stops")
    public void testIterateAborts() {
        chain("A", "B", "C", "D");
        DepthFirstTraverser traverser = Traversal.from(graph, "A").iterator();
        List<String> seen = new ArrayList<>();

        Exception e = assertThrows(Exception.class, () ->
            traverser.iterate(path -> {
                seen.add(path.endNode().id());
                if (path.endNode().id().equals("B")) {
                    throw new Exception("stop");
                }
            }));

        assertEquals("stop", e.getMessage());
        assertEquals(List.of("A", "B"), seen);
        assertFalse(traverser.hasNext());
    }

    @Test
    @DisplayName("Test iterate visits everything when the visitor succeeds")
    public void testIterateComplete() {
        chain("A", "B", "C");
        List<String> seen = new ArrayList<>();
        Traversal.from(graph, "A").iterator()
            .<RuntimeException>iterate(path -> seen.add(path.endNode().id()));
        assertEquals(List.of("A", "B", "C"), seen);
    }

    @Test
    @DisplayName("Test range filter reports the window and its closing node")
    public void testRangeFilter() {
        chain("A", "B", "C", "D", "E");
        List<String> reported = ids(Traversal.from(graph, "A")
            .rangeFilter(n -> n.id().equals("B"), n -> n.id().equals("D"))
            .iterator());
        assertEquals(List.of("B", "C", "D"), reported);
    }

    @Test
    @DisplayName("Test range filter always reports nodes matching the end")
    public void testRangeFilterEndOutsideWindow() {
        chain("A", "B", "C");
        List<String> reported = ids(Traversal.from(graph, "A")
            .rangeFilter(n -> false, n -> n.id().equals("C"))
            .iterator());
        assertEquals(List.of("C"), reported);
    }

    @Test
    @DisplayName("Test neighbours removed during the walk are skipped")
    public void testConcurrentRemovalSkipped() {
        GraphStore store = mock(GraphStore.class);
        Node a = new Node("A", null, null);
        Node c = new Node("C", null, null);
        when(store.getNode("A")).thenReturn(a);
        when(store.getNode("B")).thenThrow(new NotFoundException("gone"));
        when(store.getNode("C")).thenReturn(c);
        when(store.getOutEdges("A")).thenReturn(List.of(
            new Edge("A", "B", 1.0), new Edge("A", "C", 1.0)));
        when(store.getOutEdges("C")).thenThrow(new NotFoundException("gone"));

        assertEquals(List.of("A", "C"),
            ids(Traversal.from(store, "A").iterator()));
        verify(store).getOutEdges("C");
    }
}
