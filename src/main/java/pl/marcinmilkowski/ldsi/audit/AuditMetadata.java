package pl.marcinmilkowski.ldsi.audit;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Provenance of an audit entry: engine version, wall-clock duration of the
 * run and SHA-256 digests of both responses, so that a stored entry can be
 * checked against the texts it claims to have scored.
 */
public record AuditMetadata(
    String ldsiVersion,
    long durationMs,
    String hashResponseA,
    String hashResponseB
) {

    public AuditMetadata {
        if (durationMs < 0) {
            throw InvalidInputException.invalidParameter("durationMs", durationMs, ">= 0");
        }
    }

    public static AuditMetadata of(String version, long durationMs, String responseA, String responseB) {
        return new AuditMetadata(version, durationMs, sha256(responseA), sha256(responseB));
    }

    /** Lowercase hex SHA-256 of the UTF-8 bytes of {@code text}. */
    public static String sha256(String text) {
        if (text == null) {
            throw InvalidInputException.missing("text to hash");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("ldsi_version", ldsiVersion);
        obj.put("duration_ms", durationMs);
        obj.put("hash_response_a", hashResponseA);
        obj.put("hash_response_b", hashResponseB);
        return obj;
    }

    public static AuditMetadata fromJson(JSONObject obj) {
        if (obj == null) {
            throw InvalidInputException.missing("audit metadata");
        }
        return new AuditMetadata(
            obj.getString("ldsi_version"),
            obj.getLongValue("duration_ms"),
            obj.getString("hash_response_a"),
            obj.getString("hash_response_b"));
    }
}
