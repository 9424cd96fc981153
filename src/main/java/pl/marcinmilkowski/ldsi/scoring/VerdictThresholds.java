package pl.marcinmilkowski.ldsi.scoring;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

/**
 * Upper bounds (exclusive) of the lambda bands. Anything at or above
 * {@code architect} is {@link Verdict#FOOL}.
 *
 * @param zombie    end of the ZOMBIE band
 * @param rebel     end of the REBEL band
 * @param architect end of the ARCHITECT band
 */
public record VerdictThresholds(double zombie, double rebel, double architect) {

    public static final VerdictThresholds DEFAULT = new VerdictThresholds(0.3, 0.7, 1.2);

    public VerdictThresholds {
        if (!Double.isFinite(zombie) || !Double.isFinite(rebel) || !Double.isFinite(architect)) {
            throw new InvalidInputException("Verdict thresholds must be finite");
        }
        if (!(0.0 < zombie && zombie < rebel && rebel < architect)) {
            throw new InvalidInputException(String.format(
                "Verdict thresholds must be positive and strictly ascending, got %.3f / %.3f / %.3f",
                zombie, rebel, architect));
        }
    }

    public Verdict classify(double lambda) {
        if (lambda < zombie) {
            return Verdict.ZOMBIE;
        }
        if (lambda < rebel) {
            return Verdict.REBEL;
        }
        if (lambda < architect) {
            return Verdict.ARCHITECT;
        }
        return Verdict.FOOL;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("zombie", zombie);
        obj.put("rebel", rebel);
        obj.put("architect", architect);
        return obj;
    }

    public static VerdictThresholds fromJson(JSONObject obj, VerdictThresholds fallback) {
        if (obj == null) {
            return fallback;
        }
        Double z = obj.getDouble("zombie");
        Double r = obj.getDouble("rebel");
        Double a = obj.getDouble("architect");
        return new VerdictThresholds(
            z != null ? z : fallback.zombie(),
            r != null ? r : fallback.rebel(),
            a != null ? a : fallback.architect());
    }
}
