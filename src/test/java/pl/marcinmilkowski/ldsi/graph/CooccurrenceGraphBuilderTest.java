package pl.marcinmilkowski.ldsi.graph;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CooccurrenceGraphBuilder and CooccurrenceGraph.
 */
class CooccurrenceGraphBuilderTest {

    @Test
    @DisplayName("Edge weight should be 1/(d+1) for distance d")
    void testInverseDistanceWeights() {
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(List.of("aa", "bb", "cc"));

        assertEquals(3, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        assertEquals(0.5, graph.weight("aa", "bb"));
        assertEquals(0.5, graph.weight("bb", "cc"));
        assertEquals(1.0 / 3.0, graph.weight("aa", "cc"));
        assertEquals(0.0, graph.weight("cc", "aa"));
    }

    @Test
    @DisplayName("Repeated pairs should accumulate and self-pairs should be skipped")
    void testAccumulation() {
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(List.of("aa", "bb", "aa", "bb"));

        assertEquals(2, graph.nodeCount());
        assertEquals(2, graph.edgeCount());
        assertEquals(0.5 + 0.25 + 0.5, graph.weight("aa", "bb"), 1e-12);
        assertEquals(0.5, graph.weight("bb", "aa"), 1e-12);
        assertFalse(graph.hasEdge(0, 0));
    }

    @Test
    @DisplayName("Window should stop at 15 positions")
    void testWindowLimit() {
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            tokens.add("t" + i);
        }
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(tokens);

        assertTrue(graph.hasEdge(0, 15));
        assertFalse(graph.hasEdge(0, 16));
        assertEquals(1.0 / 16.0, graph.weight(0, 15));
        // 5 sources see a full window, then 14, 13, ..., 0
        assertEquals(5 * 15 + (14 * 15) / 2, graph.edgeCount());
    }

    @Test
    @DisplayName("Undirected view should link both endpoints")
    void testNeighbours() {
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(List.of("aa", "bb", "cc"));
        int c = graph.indexOf("cc");
        assertEquals(2, graph.degree(c));
        assertTrue(graph.neighbours(c).contains(graph.indexOf("aa")));
        assertThrows(UnsupportedOperationException.class, () -> graph.neighbours(c).add(7));
    }

    @Test
    @DisplayName("Nodes should be numbered in order of first occurrence")
    void testNodeOrder() {
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(List.of("zz", "aa", "zz", "mm"));
        assertEquals(List.of("zz", "aa", "mm"), graph.labels());
        assertEquals(-1, graph.indexOf("absent"));
    }

    @Test
    @DisplayName("JSON export should list nodes and edges")
    void testToJson() {
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(List.of("aa", "bb", "cc"));
        var json = graph.toJson();
        assertEquals(3, json.getJSONArray("nodes").size());
        assertEquals(3, json.getJSONArray("edges").size());
    }

    @Test
    @DisplayName("Empty and null token lists should be handled")
    void testEmptyAndNull() {
        CooccurrenceGraph empty = CooccurrenceGraphBuilder.build(List.of());
        assertEquals(0, empty.nodeCount());
        assertEquals(0, empty.edgeCount());
        assertThrows(InvalidInputException.class, () -> CooccurrenceGraphBuilder.build(null));
        assertThrows(InvalidInputException.class, () -> CooccurrenceGraphBuilder.build(Arrays.asList("aa", null)));
    }
}
