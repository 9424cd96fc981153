package pl.marcinmilkowski.ldsi.config;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.graph.StructuralScoring;
import pl.marcinmilkowski.ldsi.scoring.VerdictThresholds;

/**
 * Everything a scoring run is parameterised by. {@link #DEFAULT} is the only
 * default in the code base; the CLI, the HTTP server, batch scoring and
 * calibration all start from it.
 */
public record LdsiConfig(
    LdsiCoefficients coefficients,
    VerdictThresholds thresholds,
    StructuralScoring structuralScoring
) {

    public static final LdsiConfig DEFAULT = new LdsiConfig(
        LdsiCoefficients.DEFAULT, VerdictThresholds.DEFAULT, StructuralScoring.ABSOLUTE_QUALITY);

    public LdsiConfig {
        if (coefficients == null) throw InvalidInputException.missing("coefficients");
        if (thresholds == null) throw InvalidInputException.missing("verdict thresholds");
        if (structuralScoring == null) throw InvalidInputException.missing("structural scoring");
    }

    public LdsiConfig withCoefficients(LdsiCoefficients replacement) {
        return new LdsiConfig(replacement, thresholds, structuralScoring);
    }

    public LdsiConfig withStructuralScoring(StructuralScoring replacement) {
        return new LdsiConfig(coefficients, thresholds, replacement);
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("coefficients", coefficients.toJson());
        root.put("thresholds", thresholds.toJson());
        root.put("structural_scoring", structuralScoring.name());
        return root;
    }

    /**
     * Overlay the fields present in {@code root} on {@code base}.
     */
    public static LdsiConfig fromJson(JSONObject root, LdsiConfig base) {
        if (root == null) {
            return base;
        }
        LdsiCoefficients coefficients = LdsiCoefficients.fromJson(
            root.getJSONObject("coefficients"), base.coefficients());
        VerdictThresholds thresholds = VerdictThresholds.fromJson(
            root.getJSONObject("thresholds"), base.thresholds());
        String scoring = root.getString("structural_scoring");
        StructuralScoring structural = scoring == null || scoring.isBlank()
            ? base.structuralScoring()
            : StructuralScoring.parse(scoring);
        return new LdsiConfig(coefficients, thresholds, structural);
    }
}
