package pl.marcinmilkowski.ldsi.scoring;

/**
 * The three inputs of the composite formula, before weighting.
 *
 * @param ncd         damped compression distance in [0, 1]
 * @param entropyTerm H(B)/H(A) - 1 in [-1, 2]
 * @param structural  structural signal of the selected scoring
 */
public record LdsiSignals(double ncd, double entropyTerm, double structural) {
}
