package pl.marcinmilkowski.ldsi.calibration;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

/**
 * A pair of texts with the lambda a human rater assigned to it.
 */
public record TrainingCase(String name, String textA, String textB, double expectedLambda) {

    public TrainingCase {
        if (textA == null) throw InvalidInputException.missing("text_a of case " + name);
        if (textB == null) throw InvalidInputException.missing("text_b of case " + name);
        if (!Double.isFinite(expectedLambda) || expectedLambda < 0.0) {
            throw InvalidInputException.invalidParameter("expected_lambda", expectedLambda, "a finite value >= 0");
        }
    }

    public static TrainingCase fromJson(JSONObject obj, String defaultName) {
        if (obj == null) {
            throw InvalidInputException.missing("training case " + defaultName);
        }
        Double expected = obj.getDouble("expected_lambda");
        if (expected == null) {
            throw InvalidInputException.missing("expected_lambda of case " + defaultName);
        }
        String name = obj.getString("name");
        return new TrainingCase(name == null ? defaultName : name,
            obj.getString("text_a"), obj.getString("text_b"), expected);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("name", name);
        obj.put("text_a", textA);
        obj.put("text_b", textB);
        obj.put("expected_lambda", expectedLambda);
        return obj;
    }
}
