package pl.marcinmilkowski.ldsi.scoring;

import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.Locale;

/**
 * Qualitative reading of a lambda score, ordered by increasing divergence.
 */
public enum Verdict {
    /** The model recites the reference; no real divergence. */
    ZOMBIE("recitation, total smoothing"),
    /** Notable divergence with an enriched vocabulary. */
    REBEL("enriched divergence"),
    /** Strong divergence with the structure preserved. */
    ARCHITECT("optimal divergence, structure preserved"),
    /** Maximal entropy, structure collapsed or hallucinated. */
    FOOL("collapse, structure lost");

    private final String description;

    Verdict(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Classify using the default thresholds.
     */
    public static Verdict fromLambda(double lambda) {
        return VerdictThresholds.DEFAULT.classify(lambda);
    }

    public static Verdict classify(double lambda, VerdictThresholds thresholds) {
        if (thresholds == null) {
            throw InvalidInputException.missing("thresholds");
        }
        return thresholds.classify(lambda);
    }

    /**
     * Parse a verdict name, case-insensitively.
     */
    public static Verdict parse(String name) {
        if (name == null) {
            throw InvalidInputException.missing("verdict");
        }
        try {
            return Verdict.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw InvalidInputException.invalidParameter("verdict", name, "ZOMBIE, REBEL, ARCHITECT or FOOL");
        }
    }

    @Override
    public String toString() {
        return name() + " - " + description;
    }
}
