package pl.marcinmilkowski.ldsi.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.config.LdsiCoefficients;
import pl.marcinmilkowski.ldsi.config.LdsiConfig;
import pl.marcinmilkowski.ldsi.entropy.EntropyAnalyzer;
import pl.marcinmilkowski.ldsi.entropy.EntropyComparison;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.graph.StructuralScoring;
import pl.marcinmilkowski.ldsi.graph.TopologyAnalyzer;
import pl.marcinmilkowski.ldsi.graph.TopologyMetrics;
import pl.marcinmilkowski.ldsi.ncd.CompressionMeasurement;
import pl.marcinmilkowski.ldsi.ncd.NcdCalculator;

/**
 * Composite divergence index of a test text B against a reference A.
 *
 * <pre>
 * lambda = max(0, alpha * NCD(A,B) + beta * entropyTerm + gamma * structural)
 * </pre>
 *
 * <p>NCD runs on the raw bytes; entropy and topology run on word tokens.
 * Scoring is a pure function of (A, B, config): nothing is cached or shared,
 * so independent pairs may be scored from any number of threads.</p>
 *
 * <p>Evaluation order is fixed for bit-identical results:
 * {@code ((alpha*ncd) + (beta*term)) + (gamma*structural)}, then the clamp at
 * zero.</p>
 */
public final class LdsiScorer {

    private static final Logger logger = LoggerFactory.getLogger(LdsiScorer.class);

    /** Release of the scoring engine, recorded in audit entries and reported by the CLI. */
    public static final String VERSION = "0.3.0";

    private LdsiScorer() {
    }

    public static LdsiResult score(String textA, String textB) {
        return score(textA, textB, LdsiConfig.DEFAULT);
    }

    public static LdsiResult score(String textA, String textB, LdsiCoefficients coefficients) {
        LdsiConfig config = coefficients == null
            ? LdsiConfig.DEFAULT
            : LdsiConfig.DEFAULT.withCoefficients(coefficients);
        return score(textA, textB, config);
    }

    public static LdsiResult score(String textA, String textB, LdsiConfig config) {
        if (textA == null) throw InvalidInputException.missing("text A");
        if (textB == null) throw InvalidInputException.missing("text B");
        return score(TextSample.of(textA), TextSample.of(textB), config);
    }

    public static LdsiResult score(TextSample a, TextSample b, LdsiConfig config) {
        if (a == null) throw InvalidInputException.missing("sample A");
        if (b == null) throw InvalidInputException.missing("sample B");
        if (config == null) throw InvalidInputException.missing("config");

        CompressionMeasurement ncd = NcdCalculator.compute(a.bytes(), b.bytes());
        EntropyComparison entropy = EntropyAnalyzer.compare(
            EntropyAnalyzer.analyze(a.tokens()), EntropyAnalyzer.analyze(b.tokens()));
        TopologyComparison topology = compareTopology(
            TopologyAnalyzer.analyze(a.tokens()), TopologyAnalyzer.analyze(b.tokens()),
            config.structuralScoring());

        LdsiSignals signals = new LdsiSignals(ncd.corrected(), entropy.term(), topology.signal());
        double lambda = combine(signals, config.coefficients());
        Verdict verdict = Verdict.classify(lambda, config.thresholds());

        logger.debug("LDSI lambda={} verdict={} ncd={} term={} structural={} ({})",
            lambda, verdict, signals.ncd(), signals.entropyTerm(), signals.structural(),
            config.structuralScoring());

        return new LdsiResult(lambda, verdict, ncd, entropy, topology, config.coefficients());
    }

    /**
     * The fusion step alone. Calibration recombines precomputed signals with
     * candidate coefficients through this method so that its lambda is the
     * one {@link #score} would produce.
     */
    public static double combine(LdsiSignals signals, LdsiCoefficients coefficients) {
        double lambda = coefficients.alpha() * signals.ncd();
        lambda = lambda + coefficients.beta() * signals.entropyTerm();
        lambda = lambda + coefficients.gamma() * signals.structural();
        return Math.max(lambda, 0.0);
    }

    static TopologyComparison compareTopology(TopologyMetrics reference, TopologyMetrics test,
                                              StructuralScoring scoring) {
        double quality = StructuralScoring.ABSOLUTE_QUALITY.signal(reference, test);
        double delta = StructuralScoring.REFERENCE_DELTA.signal(reference, test);
        return new TopologyComparison(reference, test, quality, delta, scoring);
    }
}
