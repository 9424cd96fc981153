package pl.marcinmilkowski.ldsi.graph;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TopologyAnalyzer.
 */
class TopologyAnalyzerTest {

    @Test
    @DisplayName("Nine distinct tokens should form a complete graph")
    void testCompleteGraph() {
        TopologyMetrics t = TopologyAnalyzer.analyze("La temperature est de vingt-cinq degres aujourd'hui.");

        assertEquals(9, t.nodeCount());
        assertEquals(36, t.edgeCount());
        assertEquals(1, t.components());
        assertEquals(9, t.lccSize());
        assertEquals(0.5, t.density(), 1e-12);
        assertEquals(1.0, t.lccRatio(), 1e-12);
        assertEquals(1.0, t.clustering(), 1e-12);
        assertEquals(1.0, t.avgPathLength(), 1e-12);
        assertEquals(1.0, t.smallWorldIndex(), 1e-12);
        assertEquals(4.0, t.avgDegree(), 1e-12);
        assertEquals(Math.exp(-1.0) * 0.6, t.structuralQuality(), 1e-9);
    }

    @Test
    @DisplayName("Fewer than three nodes should give all-zero ratios")
    void testDegenerate() {
        TopologyMetrics single = TopologyAnalyzer.analyze("Hi.");
        assertEquals(1, single.nodeCount());
        assertTrue(single.isDegenerate());
        assertEquals(0.0, single.density());
        assertEquals(0.0, single.structuralQuality());

        TopologyMetrics pair = TopologyAnalyzer.analyze(List.of("aa", "bb", "aa"));
        assertEquals(2, pair.nodeCount());
        assertEquals(0.0, pair.smallWorldIndex());
        assertEquals(0.0, pair.structuralQuality());

        assertEquals(TopologyMetrics.EMPTY, TopologyAnalyzer.analyze(""));
    }

    @Test
    @DisplayName("Disconnected graph should measure paths in the largest component only")
    void testComponents() {
        CooccurrenceGraph graph = new CooccurrenceGraph();
        for (String label : List.of("a0", "a1", "a2", "b0", "b1", "b2", "b3")) {
            graph.addNode(label);
        }
        // triangle 0-1-2
        graph.accumulateEdge(0, 1, 0.5);
        graph.accumulateEdge(1, 2, 0.5);
        graph.accumulateEdge(0, 2, 0.5);
        // triangle 3-4-5 with a pendant 6 on 3
        graph.accumulateEdge(3, 4, 0.5);
        graph.accumulateEdge(4, 5, 0.5);
        graph.accumulateEdge(3, 5, 0.5);
        graph.accumulateEdge(3, 6, 0.5);

        TopologyMetrics t = TopologyAnalyzer.analyze(graph);

        assertEquals(2, t.components());
        assertEquals(4, t.lccSize());
        assertEquals(4.0 / 7.0, t.lccRatio(), 1e-12);
        assertEquals(7.0 / 42.0, t.density(), 1e-12);
        assertEquals(16.0 / 12.0, t.avgPathLength(), 1e-12);
        // node 6 has degree 1 and is left out of the mean
        assertEquals((5.0 + 1.0 / 3.0) / 6.0, t.clustering(), 1e-12);
        assertEquals(t.clustering() / t.avgPathLength(), t.smallWorldIndex(), 1e-12);
    }

    @Test
    @DisplayName("A path graph should have no triangles")
    void testPathGraph() {
        CooccurrenceGraph graph = new CooccurrenceGraph();
        for (String label : List.of("p0", "p1", "p2", "p3")) {
            graph.addNode(label);
        }
        graph.accumulateEdge(0, 1, 0.5);
        graph.accumulateEdge(1, 2, 0.5);
        graph.accumulateEdge(2, 3, 0.5);

        TopologyMetrics t = TopologyAnalyzer.analyze(graph);

        assertEquals(0.0, t.clustering());
        assertEquals(20.0 / 12.0, t.avgPathLength(), 1e-12);
        assertEquals(0.0, t.smallWorldIndex());
    }

    @Test
    @DisplayName("Repetitive text should be denser than varied prose")
    void testRepetitionDensity() {
        TopologyMetrics loop = TopologyAnalyzer.analyze("le chat le chien le chat le chien le chat le chien");
        TopologyMetrics prose = TopologyAnalyzer.analyze(
            "Les systemes complexes emergent quand des agents simples interagissent localement "
            + "sans coordination centrale, produisant des motifs que personne n'avait planifies "
            + "ni anticipes dans leurs details, mais qui restent stables sur de longues periodes.");

        assertEquals(3, loop.nodeCount());
        assertTrue(loop.density() > prose.density());
    }
}
