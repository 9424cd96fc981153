package pl.marcinmilkowski.ldsi.batch;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.scoring.LdsiResult;

/**
 * Result of one pair in a batch: either a {@link LdsiResult} or the message
 * of the error that stopped it.
 */
public record BatchOutcome(int index, String id, LdsiResult result, String error) {

    public static BatchOutcome success(int index, String id, LdsiResult result) {
        return new BatchOutcome(index, id, result, null);
    }

    public static BatchOutcome failure(int index, String id, String error) {
        return new BatchOutcome(index, id, null, error);
    }

    public boolean succeeded() {
        return result != null;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("index", index);
        obj.put("id", id);
        if (succeeded()) {
            obj.put("result", result.toJson());
        } else {
            obj.put("error", error);
        }
        return obj;
    }
}
