package com.grapher.snapshot;

import com.grapher.graph.GraphStore;
import com.grapher.graph.InvalidInputException;
import com.grapher.graph.PropertyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GraphSnapshots.
 */
public class GraphSnapshotsTest {

    @TempDir
    Path tempDir;

    private PropertyGraph graph;

    @BeforeEach
    public void setUp() {
        graph = new PropertyGraph("saved");
        graph.addNode("a", Set.of("Start"), Map.of("k", "v"));
        graph.addNode("b", Map.of("n", 3));
        graph.addEdge("a", "b", 1.5);
    }

    @Test
    @DisplayName("Test save then load restores the store")
    public void testSaveLoad() throws IOException {
        Path file = tempDir.resolve("nested/dir/graph.json");
        GraphSnapshots.save(graph, file);
        assertTrue(Files.exists(file));

        GraphStore restored = new PropertyGraph("restored");
        restored.addNode("stale", Map.of());
        GraphSnapshots.load(file, restored);

        assertFalse(restored.containsNode("stale"));
        assertEquals(2, restored.nodeCount());
        assertEquals(1, restored.edgeCount());
        assertEquals("v", restored.getNode("a").property("k"));
        assertTrue(restored.getNode("a").hasLabel("Start"));
        assertEquals(1.5, restored.getEdge("a", "b").weight());
    }

    @Test
    @DisplayName("Test saving twice writes identical files")
    public void testDeterministicFile() throws IOException {
        Path first = tempDir.resolve("first.json");
        Path second = tempDir.resolve("second.json");
        GraphSnapshots.save(graph, first);

        PropertyGraph reloaded = new PropertyGraph();
        GraphSnapshots.load(first, reloaded);
        GraphSnapshots.save(reloaded, second);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
    }

    @Test
    @DisplayName("Test failed load leaves the store unchanged")
    public void testFailedLoad() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.write(broken, "{\"nodes\": [".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> GraphSnapshots.load(broken, graph));

        Path invalid = tempDir.resolve("invalid.json");
        Files.write(invalid, "{\"nodes\": [{\"id\": \"x\"}, {\"id\": \"x\"}]}"
            .getBytes(StandardCharsets.UTF_8));
        assertThrows(InvalidInputException.class,
            () -> GraphSnapshots.load(invalid, graph));

        assertThrows(NoSuchFileException.class,
            () -> GraphSnapshots.load(tempDir.resolve("missing.json"), graph));

        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.edgeCount());
    }
}
