package pl.marcinmilkowski.ldsi.audit;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.scoring.LdsiResult;

import java.util.Locale;

/**
 * Condensed view of an audit entry for terminal display.
 */
public record SummaryReport(
    String timestamp,
    String model,
    double lambda,
    String verdict,
    double ncd,
    double entropyRatio,
    double structuralQuality,
    double topologyDelta
) {

    public static SummaryReport from(AuditEntry entry) {
        LdsiResult result = entry.result();
        return new SummaryReport(
            entry.timestamp().toString(),
            entry.modelTarget() == null ? "unknown" : entry.modelTarget(),
            result.lambda(),
            result.verdict().getDescription(),
            result.ncdCorrected(),
            result.entropyRatio(),
            result.structuralQuality(),
            result.topology().delta());
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("timestamp", timestamp);
        obj.put("model", model);
        obj.put("lambda", lambda);
        obj.put("verdict", verdict);
        obj.put("ncd", ncd);
        obj.put("entropy_ratio", entropyRatio);
        obj.put("structural_quality", structuralQuality);
        obj.put("topology_delta", topologyDelta);
        return obj;
    }

    /** Multi-line block for the console. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%s  %s%n", timestamp, model));
        sb.append(String.format(Locale.ROOT, "  lambda:             %.4f  (%s)%n", lambda, verdict));
        sb.append(String.format(Locale.ROOT, "  NCD:                %.4f%n", ncd));
        sb.append(String.format(Locale.ROOT, "  entropy ratio:      %.4f%n", entropyRatio));
        sb.append(String.format(Locale.ROOT, "  structural quality: %.4f%n", structuralQuality));
        sb.append(String.format(Locale.ROOT, "  topology delta:     %.4f%n", topologyDelta));
        return sb.toString();
    }
}
