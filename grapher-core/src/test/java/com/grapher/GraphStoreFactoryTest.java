package com.grapher;

import com.grapher.graph.GraphStore;
import com.grapher.graph.PropertyGraph;
import com.grapher.tracing.TracedGraphStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GraphStoreFactory.
 */
public class GraphStoreFactoryTest {

    @Test
    @DisplayName("Test builder without tracing returns a plain graph")
    public void testUntracedBuilder() {
        GraphStore store = GraphStoreFactory.builder()
            .graphName("people")
            .tracing(false)
            .build();
        PropertyGraph graph = assertInstanceOf(PropertyGraph.class, store);
        assertEquals("people", graph.getName());
    }

    @Test
    @DisplayName("Test builder with tracing wraps the graph")
    public void testTracedBuilder() {
        GraphStore store = GraphStoreFactory.builder()
            .graphName("people")
            .tracing(true)
            .build();
        TracedGraphStore traced = assertInstanceOf(TracedGraphStore.class,
            store);
        assertInstanceOf(PropertyGraph.class, traced.getDelegate());

        store.addNode("a", Map.of());
        assertTrue(store.containsNode("a"));
    }

    @Test
    @DisplayName("Test createStore returns a working empty store")
    public void testCreateStore() {
        GraphStore store = GraphStoreFactory.createStore("fresh");
        assertEquals(0, store.nodeCount());
        store.addNode("x", Map.of());
        assertEquals(1, store.nodeCount());
    }

    @Test
    @DisplayName("Test createDefaultStore uses the configured name")
    public void testCreateDefaultStore() {
        GraphStore store = GraphStoreFactory.createDefaultStore();
        GraphStore graph = store instanceof TracedGraphStore traced
            ? traced.getDelegate() : store;
        String expected = System.getenv(GraphStoreFactory.ENV_GRAPH_NAME);
        if (expected == null || expected.isEmpty()) {
            expected = PropertyGraph.DEFAULT_NAME;
        }
        assertEquals(expected, ((PropertyGraph) graph).getName());
    }

    @Test
    @DisplayName("Test GraphStoreFactory constructor is private")
    public void testPrivateConstructor() {
        var constructors = GraphStoreFactory.class.getDeclaredConstructors();
        assertEquals(1, constructors.length);
        assertFalse(constructors[0].canAccess(null));
    }
}
