package pl.marcinmilkowski.ldsi.calibration;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.config.LdsiCoefficients;

import java.util.List;

/**
 * Outcome of a coefficient search.
 *
 * @param best          coefficients with the smallest summed squared error (first found on ties)
 * @param totalError    that error
 * @param combinations  coefficient triples evaluated
 * @param fits          per-case predicted lambda under {@code best}
 */
public record CalibrationResult(
    LdsiCoefficients best,
    double totalError,
    int combinations,
    List<CaseFit> fits
) {

    public CalibrationResult {
        fits = List.copyOf(fits);
    }

    public record CaseFit(String name, double expectedLambda, double predictedLambda) {

        public double squaredError() {
            double diff = predictedLambda - expectedLambda;
            return diff * diff;
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("name", name);
            obj.put("expected_lambda", expectedLambda);
            obj.put("predicted_lambda", predictedLambda);
            return obj;
        }
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("coefficients", best.toJson());
        obj.put("total_error", totalError);
        obj.put("combinations", combinations);
        JSONArray cases = new JSONArray();
        for (CaseFit fit : fits) {
            cases.add(fit.toJson());
        }
        obj.put("cases", cases);
        return obj;
    }
}
