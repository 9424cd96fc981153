package pl.marcinmilkowski.ldsi.entropy;

import com.alibaba.fastjson2.JSONObject;

/**
 * Entropy of the reference and test texts and the term derived from them.
 *
 * @param reference measurement of A
 * @param test      measurement of B
 * @param ratio     H(B)/H(A), clamped to [0, 3]
 * @param term      ratio - 1, clamped to [-1, 2]
 */
public record EntropyComparison(
    EntropyMeasurement reference,
    EntropyMeasurement test,
    double ratio,
    double term
) {

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("shannon_a", reference.shannon());
        obj.put("shannon_b", test.shannon());
        obj.put("ratio", ratio);
        obj.put("term", term);
        obj.put("ttr_a", reference.ttr());
        obj.put("ttr_b", test.ttr());
        obj.put("hapax_ratio_a", reference.hapaxRatio());
        obj.put("hapax_ratio_b", test.hapaxRatio());
        return obj;
    }

    /**
     * Rebuilds a comparison from its serialized form. Token counts are not
     * part of the schema and come back as 0.
     */
    public static EntropyComparison fromJson(JSONObject obj) {
        EntropyMeasurement a = new EntropyMeasurement(
            obj.getDoubleValue("shannon_a"), obj.getDoubleValue("ttr_a"),
            obj.getDoubleValue("hapax_ratio_a"), 0, 0, 0);
        EntropyMeasurement b = new EntropyMeasurement(
            obj.getDoubleValue("shannon_b"), obj.getDoubleValue("ttr_b"),
            obj.getDoubleValue("hapax_ratio_b"), 0, 0, 0);
        return new EntropyComparison(a, b, obj.getDoubleValue("ratio"), obj.getDoubleValue("term"));
    }
}
