package pl.marcinmilkowski.ldsi.graph;

/**
 * Reference-free health score of a co-occurrence graph.
 *
 * <p>Two opposite failures look alike in topology: verbatim repetition and
 * incoherent hallucination both give a high small-world index and a density
 * away from the healthy centre. A threshold on either metric cannot tell them
 * apart from structured divergence, so the score is non-monotonic:</p>
 *
 * <pre>
 * densityScore = exp(-((density - 0.35) / 0.15)^2)
 * swPenalty    = 1                              if swi &lt;= 0.8
 *              = max(0, 1 - (swi - 0.8) * 2)    otherwise (0 from swi = 1.3)
 * quality      = densityScore * swPenalty
 * </pre>
 */
public final class StructuralQualityScorer {

    public static final double TARGET_DENSITY = 0.35;
    public static final double DENSITY_WIDTH = 0.15;
    public static final double SMALL_WORLD_CEILING = 0.8;
    public static final double SMALL_WORLD_SLOPE = 2.0;

    private StructuralQualityScorer() {
    }

    public static double score(TopologyMetrics metrics) {
        return score(metrics.nodeCount(), metrics.density(), metrics.smallWorldIndex());
    }

    public static double score(int nodeCount, double density, double smallWorldIndex) {
        if (nodeCount < TopologyAnalyzer.MIN_NODES) {
            return 0.0;
        }
        double quality = densityScore(density) * smallWorldPenalty(smallWorldIndex);
        return Math.max(0.0, Math.min(1.0, quality));
    }

    public static double densityScore(double density) {
        double z = (density - TARGET_DENSITY) / DENSITY_WIDTH;
        return Math.exp(-(z * z));
    }

    public static double smallWorldPenalty(double smallWorldIndex) {
        if (smallWorldIndex <= SMALL_WORLD_CEILING) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - (smallWorldIndex - SMALL_WORLD_CEILING) * SMALL_WORLD_SLOPE);
    }
}
