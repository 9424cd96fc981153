package pl.marcinmilkowski.ldsi.graph;

import com.alibaba.fastjson2.JSONObject;

/**
 * Structural description of one co-occurrence graph.
 *
 * <p>With fewer than three nodes every ratio (density through structural
 * quality) is 0.</p>
 *
 * @param nodeCount         distinct tokens
 * @param edgeCount         distinct directed edges
 * @param components        connected components of the undirected view
 * @param lccSize           nodes in the largest component
 * @param density           |E| / (|V|(|V|-1)), directed edge count
 * @param lccRatio          lccSize / |V|
 * @param clustering        mean local transitivity over nodes of degree >= 2
 * @param avgPathLength     mean hop distance between reachable pairs of the largest component
 * @param smallWorldIndex   clustering / avgPathLength
 * @param avgDegree         |E| / |V|
 * @param structuralQuality bounded health score in [0, 1]
 */
public record TopologyMetrics(
    int nodeCount,
    int edgeCount,
    int components,
    int lccSize,
    double density,
    double lccRatio,
    double clustering,
    double avgPathLength,
    double smallWorldIndex,
    double avgDegree,
    double structuralQuality
) {

    public static final TopologyMetrics EMPTY = new TopologyMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    /**
     * Metrics with only density and small-world index set, for scoring
     * hypothetical graphs.
     */
    public static TopologyMetrics of(int nodeCount, double density, double smallWorldIndex) {
        return new TopologyMetrics(nodeCount, 0, 0, 0, density, 0, 0, 0, smallWorldIndex, 0, 0);
    }

    public boolean isDegenerate() {
        return nodeCount < TopologyAnalyzer.MIN_NODES;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("node_count", nodeCount);
        obj.put("edge_count", edgeCount);
        obj.put("components", components);
        obj.put("lcc_size", lccSize);
        obj.put("density", density);
        obj.put("lcc_ratio", lccRatio);
        obj.put("clustering", clustering);
        obj.put("avg_path_length", avgPathLength);
        obj.put("small_world_index", smallWorldIndex);
        obj.put("avg_degree", avgDegree);
        obj.put("structural_quality", structuralQuality);
        return obj;
    }

    @Override
    public String toString() {
        return String.format(
            "nodes=%d edges=%d density=%.4f lcc=%.4f clustering=%.4f path=%.4f swi=%.4f quality=%.4f",
            nodeCount, edgeCount, density, lccRatio, clustering, avgPathLength, smallWorldIndex,
            structuralQuality);
    }
}
