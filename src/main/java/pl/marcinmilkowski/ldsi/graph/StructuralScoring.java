package pl.marcinmilkowski.ldsi.graph;

import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

/**
 * Available structural signals. Both are computed for every result so they
 * can be compared side by side; the selected one feeds lambda.
 */
public enum StructuralScoring implements StructuralScoringStrategy {

    /** Absolute structural quality of B; A is not consulted. */
    ABSOLUTE_QUALITY("2") {
        @Override
        public double signal(TopologyMetrics reference, TopologyMetrics test) {
            return test.structuralQuality();
        }
    },

    /**
     * Change of structure from A to B, centred on 0.5. Kept for comparison
     * with results produced before the absolute score.
     */
    REFERENCE_DELTA("1") {
        @Override
        public double signal(TopologyMetrics reference, TopologyMetrics test) {
            return referenceDelta(reference, test);
        }
    };

    public static final double FRAGMENTATION_PENALTY = -0.2;

    private final String version;

    StructuralScoring(String version) {
        this.version = version;
    }

    @Override
    public String version() {
        return version;
    }

    /**
     * 0.5 * (LCC ratio change) + 0.3 * (clustering change) + 0.5, minus 0.2
     * when B splits into more than twice as many components as A.
     */
    public static double referenceDelta(TopologyMetrics reference, TopologyMetrics test) {
        double lccScore = test.lccRatio() - reference.lccRatio();
        double clusteringScore = test.clustering() - reference.clustering();
        double penalty = test.components() > reference.components() * 2 ? FRAGMENTATION_PENALTY : 0.0;
        return (lccScore * 0.5) + (clusteringScore * 0.3) + penalty + 0.5;
    }

    /**
     * Parse by name ({@code absolute_quality}) or version tag ({@code 2}).
     */
    public static StructuralScoring parse(String value) {
        if (value == null) {
            throw InvalidInputException.missing("structural scoring");
        }
        String v = value.trim();
        for (StructuralScoring s : values()) {
            if (s.version.equals(v) || s.name().equalsIgnoreCase(v.replace('-', '_'))) {
                return s;
            }
        }
        throw new InvalidInputException("Unknown structural scoring: " + value
            + " (expected ABSOLUTE_QUALITY/2 or REFERENCE_DELTA/1)");
    }
}
