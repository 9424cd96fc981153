package pl.marcinmilkowski.ldsi.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.entropy.WordTokenizer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Graph-theoretic metrics of a co-occurrence graph.
 *
 * <p>Density counts directed edges. Components, clustering and path lengths
 * are computed on the undirected view, where an edge in either direction links
 * two tokens. Paths are unweighted hop counts.</p>
 */
public final class TopologyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TopologyAnalyzer.class);

    /** Below this node count no ratio metric is computed. */
    public static final int MIN_NODES = 3;

    private TopologyAnalyzer() {
    }

    public static TopologyMetrics analyze(String text) {
        return analyze(WordTokenizer.tokenize(text));
    }

    /**
     * Builds the graph of {@code tokens} and measures it, structural quality
     * included.
     */
    public static TopologyMetrics analyze(List<String> tokens) {
        return analyze(CooccurrenceGraphBuilder.build(tokens));
    }

    public static TopologyMetrics analyze(CooccurrenceGraph graph) {
        int n = graph.nodeCount();
        int e = graph.edgeCount();
        if (n == 0) {
            return TopologyMetrics.EMPTY;
        }

        int[] componentOf = new int[n];
        List<Integer> componentSizes = labelComponents(graph, componentOf);
        int largest = largestComponent(componentSizes);
        int lccSize = componentSizes.get(largest);

        if (n < MIN_NODES) {
            return new TopologyMetrics(n, e, componentSizes.size(), lccSize,
                0, 0, 0, 0, 0, 0, 0);
        }

        double density = e / ((double) n * (n - 1));
        double lccRatio = lccSize / (double) n;
        double clustering = averageClustering(graph);
        double avgPathLength = averagePathLength(graph, componentOf, largest);
        double smallWorldIndex = avgPathLength > 0.0 ? clustering / avgPathLength : 0.0;
        double avgDegree = e / (double) n;
        double quality = StructuralQualityScorer.score(n, density, smallWorldIndex);

        TopologyMetrics metrics = new TopologyMetrics(n, e, componentSizes.size(), lccSize,
            density, lccRatio, clustering, avgPathLength, smallWorldIndex, avgDegree, quality);
        logger.debug("Topology {}", metrics);
        return metrics;
    }

    /**
     * Assigns a component id to every node (BFS in node order) and returns the
     * size of each component.
     */
    static List<Integer> labelComponents(CooccurrenceGraph graph, int[] componentOf) {
        Arrays.fill(componentOf, -1);
        List<Integer> sizes = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();

        for (int start = 0; start < graph.nodeCount(); start++) {
            if (componentOf[start] >= 0) {
                continue;
            }
            int id = sizes.size();
            int size = 0;
            componentOf[start] = id;
            queue.add(start);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                size++;
                for (int next : graph.neighbours(current)) {
                    if (componentOf[next] < 0) {
                        componentOf[next] = id;
                        queue.add(next);
                    }
                }
            }
            sizes.add(size);
        }
        return sizes;
    }

    private static int largestComponent(List<Integer> sizes) {
        int best = 0;
        for (int i = 1; i < sizes.size(); i++) {
            if (sizes.get(i) > sizes.get(best)) {
                best = i;
            }
        }
        return best;
    }

    /**
     * Mean local clustering over nodes with at least two neighbours; 0 when
     * no node qualifies.
     */
    static double averageClustering(CooccurrenceGraph graph) {
        double sum = 0.0;
        int qualifying = 0;

        for (int node = 0; node < graph.nodeCount(); node++) {
            int k = graph.degree(node);
            if (k < 2) {
                continue;
            }
            int[] nb = graph.neighbours(node).stream().mapToInt(Integer::intValue).toArray();
            int links = 0;
            for (int i = 0; i < nb.length; i++) {
                for (int j = i + 1; j < nb.length; j++) {
                    if (graph.neighbours(nb[i]).contains(nb[j])) {
                        links++;
                    }
                }
            }
            sum += (2.0 * links) / ((double) k * (k - 1));
            qualifying++;
        }
        return qualifying == 0 ? 0.0 : sum / qualifying;
    }

    /**
     * Mean shortest hop count over ordered pairs of the given component.
     */
    static double averagePathLength(CooccurrenceGraph graph, int[] componentOf, int component) {
        int n = graph.nodeCount();
        int[] distance = new int[n];
        Deque<Integer> queue = new ArrayDeque<>();
        long total = 0;
        long pairs = 0;

        for (int source = 0; source < n; source++) {
            if (componentOf[source] != component) {
                continue;
            }
            Arrays.fill(distance, -1);
            distance[source] = 0;
            queue.add(source);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                for (int next : graph.neighbours(current)) {
                    if (distance[next] < 0) {
                        distance[next] = distance[current] + 1;
                        total += distance[next];
                        pairs++;
                        queue.add(next);
                    }
                }
            }
        }
        return pairs == 0 ? 0.0 : total / (double) pairs;
    }
}
