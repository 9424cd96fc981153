package pl.marcinmilkowski.ldsi.entropy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shannon entropy and lexical diversity of word-token sequences.
 *
 * <p>Frequencies are kept in first-occurrence order so the floating-point sum
 * runs in the same order for the same input.</p>
 */
public final class EntropyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(EntropyAnalyzer.class);

    private static final double LOG_2 = Math.log(2.0);

    /** Ratio reported when A carries no information but B does. */
    public static final double ZERO_REFERENCE_RATIO = 2.0;
    public static final double MAX_RATIO = 3.0;
    public static final double MIN_TERM = -1.0;
    public static final double MAX_TERM = 2.0;

    private EntropyAnalyzer() {
    }

    public static EntropyMeasurement analyze(String text) {
        return analyze(WordTokenizer.tokenize(text));
    }

    public static EntropyMeasurement analyze(List<String> tokens) {
        Map<String, Integer> frequencies = frequencies(tokens);
        int total = tokens.size();
        if (total == 0) {
            return EntropyMeasurement.EMPTY;
        }

        int unique = frequencies.size();
        int hapax = 0;
        for (int count : frequencies.values()) {
            if (count == 1) {
                hapax++;
            }
        }

        double shannon = shannonEntropy(frequencies, total);
        double ttr = unique / (double) total;
        double hapaxRatio = hapax / (double) unique;

        return new EntropyMeasurement(shannon, ttr, hapaxRatio, total, unique, hapax);
    }

    /**
     * Entropy of A and B and the bounded term used in lambda.
     *
     * <p>H(A) = 0 has no ratio: both empty gives 1 (no change), B informative
     * gives {@link #ZERO_REFERENCE_RATIO}.</p>
     */
    public static EntropyComparison compare(EntropyMeasurement reference, EntropyMeasurement test) {
        double ratio = entropyRatio(reference.shannon(), test.shannon());
        double term = clamp(ratio - 1.0, MIN_TERM, MAX_TERM);
        logger.debug("Entropy H(A)={} H(B)={} ratio={} term={}",
            reference.shannon(), test.shannon(), ratio, term);
        return new EntropyComparison(reference, test, ratio, term);
    }

    public static double entropyRatio(double hA, double hB) {
        double ratio;
        if (hA > 0.0) {
            ratio = hB / hA;
        } else if (hB > 0.0) {
            ratio = ZERO_REFERENCE_RATIO;
        } else {
            ratio = 1.0;
        }
        return clamp(ratio, 0.0, MAX_RATIO);
    }

    /**
     * Shannon entropy over n-grams of the token sequence. Catches repeated
     * phrases that unigram entropy cannot see.
     *
     * @return entropy in bits, 0 when there are fewer than {@code n} tokens
     */
    public static double ngramEntropy(List<String> tokens, int n) {
        if (n < 1) {
            throw InvalidInputException.invalidParameter("n", n, "an n-gram order >= 1");
        }
        requireTokens(tokens);
        if (tokens.size() < n) {
            return 0.0;
        }

        Map<String, Integer> grams = new LinkedHashMap<>();
        for (int i = 0; i + n <= tokens.size(); i++) {
            String gram = String.join(" ", tokens.subList(i, i + n));
            grams.merge(gram, 1, Integer::sum);
        }
        return shannonEntropy(grams, tokens.size() - n + 1);
    }

    static double shannonEntropy(Map<String, Integer> frequencies, int total) {
        if (total == 0) {
            return 0.0;
        }
        double entropy = 0.0;
        for (int count : frequencies.values()) {
            double p = count / (double) total;
            entropy -= p * (Math.log(p) / LOG_2);
        }
        // a single type gives -1 * log2(1) = -0.0
        return entropy == 0.0 ? 0.0 : entropy;
    }

    private static Map<String, Integer> frequencies(List<String> tokens) {
        requireTokens(tokens);
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String token : tokens) {
            if (token == null) {
                throw InvalidInputException.missing("token");
            }
            frequencies.merge(token, 1, Integer::sum);
        }
        return frequencies;
    }

    private static void requireTokens(List<String> tokens) {
        if (tokens == null) {
            throw InvalidInputException.missing("token list");
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
