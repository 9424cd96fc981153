package pl.marcinmilkowski.ldsi.scoring;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.config.LdsiCoefficients;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.ncd.CompressionMeasurement;
import pl.marcinmilkowski.ldsi.entropy.EntropyComparison;

/**
 * Score of one (A, B) pair with the full breakdown needed for audit.
 *
 * <p>The JSON form is a stable contract read by audit files and CLI/HTTP
 * clients. Renaming or replacing a field requires a new
 * {@link #SCHEMA_VERSION}.</p>
 */
public record LdsiResult(
    double lambda,
    Verdict verdict,
    CompressionMeasurement ncd,
    EntropyComparison entropy,
    TopologyComparison topology,
    LdsiCoefficients coefficients
) {

    /**
     * 1: reference-relative topology delta only. 2: adds absolute structural
     * quality, keeps the delta.
     */
    public static final String SCHEMA_VERSION = "2";

    public double ncdCorrected() {
        return ncd.corrected();
    }

    public double entropyRatio() {
        return entropy.ratio();
    }

    public double structuralQuality() {
        return topology.structuralQuality();
    }

    public LdsiSignals signals() {
        return new LdsiSignals(ncd.corrected(), entropy.term(), topology.signal());
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("schema_version", SCHEMA_VERSION);
        root.put("lambda", lambda);
        root.put("verdict", verdict.name());
        root.put("ncd", ncd.toJson());
        root.put("entropy", entropy.toJson());
        root.put("topology", topology.toJson());
        root.put("coefficients", coefficients.toJson());
        return root;
    }

    public String toJsonString() {
        return toJson().toJSONString();
    }

    public static LdsiResult fromJson(JSONObject root) {
        if (root == null) {
            throw InvalidInputException.missing("result JSON");
        }
        String schema = root.getString("schema_version");
        if (schema != null && !SCHEMA_VERSION.equals(schema)) {
            throw InvalidInputException.invalidParameter("schema_version", schema, SCHEMA_VERSION);
        }
        return new LdsiResult(
            root.getDoubleValue("lambda"),
            Verdict.parse(root.getString("verdict")),
            CompressionMeasurement.fromJson(root.getJSONObject("ncd")),
            EntropyComparison.fromJson(root.getJSONObject("entropy")),
            TopologyComparison.fromJson(root.getJSONObject("topology")),
            LdsiCoefficients.fromJson(root.getJSONObject("coefficients"), LdsiCoefficients.DEFAULT));
    }

    public static LdsiResult fromJson(String json) {
        return fromJson(JSON.parseObject(json));
    }
}
