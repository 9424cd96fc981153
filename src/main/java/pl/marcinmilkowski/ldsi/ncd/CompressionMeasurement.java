package pl.marcinmilkowski.ldsi.ncd;

import com.alibaba.fastjson2.JSONObject;

/**
 * Audit record of one NCD computation.
 *
 * @param sizeA         compressed size of A in bytes
 * @param sizeB         compressed size of B in bytes
 * @param sizeCombined  compressed size of A followed by B
 * @param rawSizeA      uncompressed size of A
 * @param rawSizeB      uncompressed size of B
 * @param raw           undamped distance
 * @param dampingFactor short-text correction factor in [0, 1]
 * @param corrected     damped distance, always in [0, 1]
 */
public record CompressionMeasurement(
    int sizeA,
    int sizeB,
    int sizeCombined,
    int rawSizeA,
    int rawSizeB,
    double raw,
    double dampingFactor,
    double corrected
) {

    public int combinedLength() {
        return rawSizeA + rawSizeB;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("raw", raw);
        obj.put("damping_factor", dampingFactor);
        obj.put("corrected", corrected);
        obj.put("size_a", sizeA);
        obj.put("size_b", sizeB);
        obj.put("size_combined", sizeCombined);
        obj.put("raw_size_a", rawSizeA);
        obj.put("raw_size_b", rawSizeB);
        return obj;
    }

    public static CompressionMeasurement fromJson(JSONObject obj) {
        return new CompressionMeasurement(
            obj.getIntValue("size_a"),
            obj.getIntValue("size_b"),
            obj.getIntValue("size_combined"),
            obj.getIntValue("raw_size_a"),
            obj.getIntValue("raw_size_b"),
            obj.getDoubleValue("raw"),
            obj.getDoubleValue("damping_factor"),
            obj.getDoubleValue("corrected"));
    }

    @Override
    public String toString() {
        return String.format("NCD raw=%.4f damping=%.4f corrected=%.4f C(A)=%d C(B)=%d C(AB)=%d",
            raw, dampingFactor, corrected, sizeA, sizeB, sizeCombined);
    }
}
