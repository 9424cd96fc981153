package pl.marcinmilkowski.ldsi.config;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.Locale;

/**
 * Weights of the three signals fused into lambda.
 *
 * @param alpha weight of the damped compression distance
 * @param beta  weight of the entropy term
 * @param gamma weight of the structural signal
 */
public record LdsiCoefficients(double alpha, double beta, double gamma) {

    /**
     * Calibrated weights: compression distance leads, entropy guards against
     * noise, structure arbitrates.
     */
    public static final LdsiCoefficients DEFAULT = new LdsiCoefficients(0.50, 0.30, 0.20);

    public LdsiCoefficients {
        requireFinite("alpha", alpha);
        requireFinite("beta", beta);
        requireFinite("gamma", gamma);
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw InvalidInputException.invalidParameter(name, value, "a finite number");
        }
    }

    public double sum() {
        return alpha + beta + gamma;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("alpha", alpha);
        obj.put("beta", beta);
        obj.put("gamma", gamma);
        return obj;
    }

    /**
     * Reads coefficients from JSON, taking missing fields from {@code fallback}.
     */
    public static LdsiCoefficients fromJson(JSONObject obj, LdsiCoefficients fallback) {
        if (obj == null) {
            return fallback;
        }
        return new LdsiCoefficients(
            doubleOr(obj, "alpha", fallback.alpha()),
            doubleOr(obj, "beta", fallback.beta()),
            doubleOr(obj, "gamma", fallback.gamma()));
    }

    static double doubleOr(JSONObject obj, String key, double fallback) {
        Double value = obj.getDouble(key);
        return value != null ? value : fallback;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "alpha=%.2f beta=%.2f gamma=%.2f", alpha, beta, gamma);
    }
}
