package pl.marcinmilkowski.ldsi.entropy;

/**
 * Lexical diversity of a single text.
 *
 * @param shannon      Shannon entropy of the token distribution, in bits
 * @param ttr          type-token ratio (unique / total)
 * @param hapaxRatio   share of the vocabulary occurring exactly once
 * @param totalTokens  number of tokens
 * @param uniqueTokens vocabulary size
 * @param hapaxCount   number of tokens with frequency 1
 */
public record EntropyMeasurement(
    double shannon,
    double ttr,
    double hapaxRatio,
    int totalTokens,
    int uniqueTokens,
    int hapaxCount
) {

    public static final EntropyMeasurement EMPTY = new EntropyMeasurement(0.0, 0.0, 0.0, 0, 0, 0);

    public boolean isEmpty() {
        return totalTokens == 0;
    }

    @Override
    public String toString() {
        return String.format("H=%.4f bits, TTR=%.4f, hapax=%d/%d (%.4f), tokens=%d",
            shannon, ttr, hapaxCount, uniqueTokens, hapaxRatio, totalTokens);
    }
}
