package pl.marcinmilkowski.ldsi.batch;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

/**
 * A reference text A and a test text B to be scored together.
 */
public record TextPair(String id, String textA, String textB) {

    public TextPair {
        if (textA == null) throw InvalidInputException.missing("text_a of pair " + id);
        if (textB == null) throw InvalidInputException.missing("text_b of pair " + id);
    }

    /**
     * Reads {@code {"id": ..., "text_a": ..., "text_b": ...}}; {@code id}
     * falls back to {@code defaultId}.
     */
    public static TextPair fromJson(JSONObject obj, String defaultId) {
        if (obj == null) {
            throw InvalidInputException.missing("pair " + defaultId);
        }
        String id = obj.getString("id");
        return new TextPair(id == null ? defaultId : id, obj.getString("text_a"), obj.getString("text_b"));
    }
}
