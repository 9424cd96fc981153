package pl.marcinmilkowski.ldsi.audit;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.scoring.LdsiResult;
import pl.marcinmilkowski.ldsi.scoring.LdsiScorer;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * One scored test: the prompts sent to the model, the two responses, the
 * full {@link LdsiResult} and provenance metadata.
 */
public record AuditEntry(
    Instant timestamp,
    String testId,
    String modelTarget,
    String promptA,
    String promptB,
    String responseA,
    String responseB,
    LdsiResult result,
    AuditMetadata metadata
) {

    private static final DateTimeFormatter ID_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withLocale(Locale.ROOT).withZone(ZoneOffset.UTC);

    /** {@code LDSI_yyyyMMdd_HHmmss_XXXXXXXX} with eight uppercase hex digits. */
    public static final Pattern TEST_ID_PATTERN = Pattern.compile("LDSI_\\d{8}_\\d{6}_[0-9A-F]{8}");

    public AuditEntry {
        if (timestamp == null) throw InvalidInputException.missing("timestamp");
        if (testId == null) throw InvalidInputException.missing("test id");
        if (result == null) throw InvalidInputException.missing("result");
        if (metadata == null) throw InvalidInputException.missing("metadata");
    }

    /**
     * Builds an entry stamped now, with a fresh test id and hashes of both
     * responses.
     */
    public static AuditEntry create(String model, String promptA, String promptB,
                                    String responseA, String responseB,
                                    LdsiResult result, long durationMs) {
        if (responseA == null) throw InvalidInputException.missing("response A");
        if (responseB == null) throw InvalidInputException.missing("response B");
        Instant now = Instant.now();
        return new AuditEntry(
            now,
            generateTestId(now),
            model,
            promptA,
            promptB,
            responseA,
            responseB,
            result,
            AuditMetadata.of(LdsiScorer.VERSION, durationMs, responseA, responseB));
    }

    public static String generateTestId() {
        return generateTestId(Instant.now());
    }

    static String generateTestId(Instant at) {
        int suffix = ThreadLocalRandom.current().nextInt();
        return String.format(Locale.ROOT, "LDSI_%s_%08X", ID_TIMESTAMP.format(at), suffix);
    }

    /** True when both stored hashes still match the stored responses. */
    public boolean verifyIntegrity() {
        return AuditMetadata.sha256(responseA).equals(metadata.hashResponseA())
            && AuditMetadata.sha256(responseB).equals(metadata.hashResponseB());
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("timestamp", timestamp.toString());
        obj.put("test_id", testId);
        obj.put("model_target", modelTarget);
        obj.put("prompt_a", promptA);
        obj.put("prompt_b", promptB);
        obj.put("response_a", responseA);
        obj.put("response_b", responseB);
        obj.put("ldsi_result", result.toJson());
        obj.put("metadata", metadata.toJson());
        return obj;
    }

    public static AuditEntry fromJson(JSONObject obj) {
        if (obj == null) {
            throw InvalidInputException.missing("audit entry");
        }
        Instant ts;
        try {
            ts = Instant.parse(obj.getString("timestamp"));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new InvalidInputException("Invalid audit timestamp: " + obj.getString("timestamp"), e);
        }
        return new AuditEntry(
            ts,
            obj.getString("test_id"),
            obj.getString("model_target"),
            obj.getString("prompt_a"),
            obj.getString("prompt_b"),
            obj.getString("response_a"),
            obj.getString("response_b"),
            LdsiResult.fromJson(obj.getJSONObject("ldsi_result")),
            AuditMetadata.fromJson(obj.getJSONObject("metadata")));
    }
}
