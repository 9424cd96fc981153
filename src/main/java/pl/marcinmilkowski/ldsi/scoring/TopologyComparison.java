package pl.marcinmilkowski.ldsi.scoring;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.graph.StructuralScoring;
import pl.marcinmilkowski.ldsi.graph.TopologyMetrics;

/**
 * Topology of A and B with both structural signals. {@code scoring} names the
 * one that entered lambda.
 */
public record TopologyComparison(
    TopologyMetrics reference,
    TopologyMetrics test,
    double structuralQuality,
    double delta,
    StructuralScoring scoring
) {

    /**
     * The signal weighted by gamma.
     */
    public double signal() {
        return scoring == StructuralScoring.ABSOLUTE_QUALITY ? structuralQuality : delta;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("scoring", scoring.name());
        obj.put("scoring_version", scoring.version());
        obj.put("structural_quality", structuralQuality);
        obj.put("delta", delta);
        obj.put("density_a", reference.density());
        obj.put("density_b", test.density());
        obj.put("lcc_ratio_a", reference.lccRatio());
        obj.put("lcc_ratio_b", test.lccRatio());
        obj.put("clustering_a", reference.clustering());
        obj.put("clustering_b", test.clustering());
        obj.put("avg_path_length_b", test.avgPathLength());
        obj.put("small_world_index_b", test.smallWorldIndex());
        obj.put("node_count_b", test.nodeCount());
        return obj;
    }

    /**
     * Rebuilds the comparison from its serialized form; metrics not in the
     * schema come back as 0.
     */
    public static TopologyComparison fromJson(JSONObject obj) {
        double quality = obj.getDoubleValue("structural_quality");
        TopologyMetrics a = new TopologyMetrics(0, 0, 0, 0,
            obj.getDoubleValue("density_a"), obj.getDoubleValue("lcc_ratio_a"),
            obj.getDoubleValue("clustering_a"), 0, 0, 0, 0);
        TopologyMetrics b = new TopologyMetrics(obj.getIntValue("node_count_b"), 0, 0, 0,
            obj.getDoubleValue("density_b"), obj.getDoubleValue("lcc_ratio_b"),
            obj.getDoubleValue("clustering_b"), obj.getDoubleValue("avg_path_length_b"),
            obj.getDoubleValue("small_world_index_b"), 0, quality);
        String scoring = obj.getString("scoring");
        return new TopologyComparison(a, b, quality, obj.getDoubleValue("delta"),
            scoring == null ? StructuralScoring.ABSOLUTE_QUALITY : StructuralScoring.parse(scoring));
    }
}
