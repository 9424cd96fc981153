package pl.marcinmilkowski.ldsi.scoring;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.ldsi.config.LdsiCoefficients;
import pl.marcinmilkowski.ldsi.config.LdsiConfig;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.graph.StructuralScoring;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the composite index.
 */
class LdsiScorerTest {

    private static final String TEMPERATURE = "La temperature est de vingt-cinq degres aujourd'hui.";
    private static final String TEMPERATURE_DIGITS = "La temperature est de 25 degres ce jour.";

    @Test
    @DisplayName("Identical texts should be a ZOMBIE with lambda from structure alone")
    void testIdenticalTexts() {
        LdsiResult result = LdsiScorer.score(TEMPERATURE, TEMPERATURE);

        assertEquals(0.0, result.ncdCorrected());
        assertEquals(0.0, result.entropy().term());
        assertEquals(Math.exp(-1.0) * 0.6, result.structuralQuality(), 1e-9);
        assertEquals(0.2 * result.structuralQuality(), result.lambda(), 1e-12);
        assertTrue(result.lambda() < 0.1);
        assertEquals(Verdict.ZOMBIE, result.verdict());
    }

    @Test
    @DisplayName("Short paraphrase should carry the damped NCD into lambda")
    void testShortParaphrase() {
        LdsiResult result = LdsiScorer.score(TEMPERATURE, TEMPERATURE_DIGITS);

        assertEquals(0.652, result.ncd().dampingFactor(), 1e-3);
        assertEquals(0.525, result.ncd().raw(), 0.005);
        assertEquals(0.342, result.ncdCorrected(), 0.005);
        assertEquals(result.ncd().raw() * result.ncd().dampingFactor(), result.ncdCorrected(), 1e-12);
        LdsiSignals s = result.signals();
        double expected = Math.max(0.0, 0.5 * s.ncd() + 0.3 * s.entropyTerm() + 0.2 * s.structural());
        assertEquals(expected, result.lambda(), 1e-12);
    }

    @Test
    @DisplayName("A test text under three words should score structure 0 without failing")
    void testTinyTestText() {
        LdsiResult result = LdsiScorer.score(TEMPERATURE, "Hi.");
        assertEquals(0.0, result.structuralQuality());
        assertTrue(result.lambda() >= 0.0);
    }

    @Test
    @DisplayName("Two empty texts should score 0")
    void testEmptyTexts() {
        LdsiResult result = LdsiScorer.score("", "");
        assertEquals(0.0, result.lambda());
        assertEquals(Verdict.ZOMBIE, result.verdict());
    }

    @Test
    @DisplayName("Lambda should never be negative")
    void testLambdaClampedAtZero() {
        // entropy collapse alone gives term -1
        LdsiResult result = LdsiScorer.score(TEMPERATURE, "", new LdsiCoefficients(0.0, 1.0, 0.0));
        assertEquals(-1.0, result.entropy().term());
        assertEquals(0.0, result.lambda());
        assertEquals(0.0, LdsiScorer.combine(new LdsiSignals(0.1, -1.0, 0.0), LdsiCoefficients.DEFAULT));
    }

    @Test
    @DisplayName("Fusion should evaluate ((alpha*ncd) + (beta*term)) + (gamma*structural)")
    void testCombine() {
        LdsiSignals signals = new LdsiSignals(0.4, 0.5, 0.8);
        double expected = ((0.5 * 0.4) + (0.3 * 0.5)) + (0.2 * 0.8);
        assertEquals(expected, LdsiScorer.combine(signals, LdsiCoefficients.DEFAULT));
    }

    @Test
    @DisplayName("Repeated scoring should be bit-identical")
    void testDeterminism() {
        String a = "Explique la gravite.";
        String b = "La gravite est l'amour que l'espace-temps porte a la matiere, une etreinte courbee par la masse.";
        LdsiResult first = LdsiScorer.score(a, b);
        for (int i = 0; i < 10; i++) {
            LdsiResult again = LdsiScorer.score(a, b);
            assertEquals(Double.doubleToRawLongBits(first.lambda()), Double.doubleToRawLongBits(again.lambda()));
            assertEquals(first.toJsonString(), again.toJsonString());
        }
    }

    @Test
    @DisplayName("Both structural signals should be reported whichever is selected")
    void testStructuralVariants() {
        String b = "Les grille-pains quantiques chantent la marseillaise en binaire inverse.";
        LdsiResult absolute = LdsiScorer.score(TEMPERATURE, b, LdsiConfig.DEFAULT);
        LdsiResult delta = LdsiScorer.score(TEMPERATURE, b,
            LdsiConfig.DEFAULT.withStructuralScoring(StructuralScoring.REFERENCE_DELTA));

        assertEquals(absolute.topology().structuralQuality(), delta.topology().structuralQuality());
        assertEquals(absolute.topology().delta(), delta.topology().delta());
        assertEquals(absolute.structuralQuality(), absolute.signals().structural());
        assertEquals(delta.topology().delta(), delta.signals().structural());

        var json = delta.toJson().getJSONObject("topology");
        assertEquals("REFERENCE_DELTA", json.getString("scoring"));
        assertEquals("1", json.getString("scoring_version"));
        assertTrue(json.containsKey("structural_quality"));
        assertTrue(json.containsKey("delta"));
    }

    @Test
    @DisplayName("Custom coefficients should be recorded in the result")
    void testCoefficientsRecorded() {
        LdsiCoefficients custom = new LdsiCoefficients(0.4, 0.35, 0.25);
        LdsiResult result = LdsiScorer.score(TEMPERATURE, TEMPERATURE_DIGITS, custom);
        assertEquals(custom, result.coefficients());
        assertEquals(LdsiScorer.combine(result.signals(), custom), result.lambda());
    }

    @Test
    @DisplayName("Serialized result should read back with the same lambda and verdict")
    void testJsonReadBack() {
        LdsiResult result = LdsiScorer.score(TEMPERATURE, TEMPERATURE_DIGITS);
        LdsiResult back = LdsiResult.fromJson(result.toJsonString());

        assertEquals(result.lambda(), back.lambda(), 1e-15);
        assertEquals(result.verdict(), back.verdict());
        assertEquals(result.ncd().corrected(), back.ncd().corrected(), 1e-15);
        assertEquals(result.ncd().sizeCombined(), back.ncd().sizeCombined());
        assertEquals(result.entropy().term(), back.entropy().term(), 1e-15);
        assertEquals(result.coefficients(), back.coefficients());
    }

    @Test
    @DisplayName("A text sample should hand out copies of its bytes")
    void testTextSample() {
        TextSample sample = TextSample.of("Le chat dort.");
        assertEquals("Le chat dort.", sample.text());
        assertEquals(List.of("le", "chat", "dort"), sample.tokens());

        byte[] bytes = sample.bytes();
        bytes[0] = 'X';
        assertEquals('L', sample.bytes()[0]);
        assertEquals(LdsiScorer.score("Le chat dort.", "Le chien dort.").lambda(),
            LdsiScorer.score(sample, TextSample.of("Le chien dort."), LdsiConfig.DEFAULT).lambda());
    }

    @Test
    @DisplayName("Null texts should be rejected")
    void testNullText() {
        assertThrows(InvalidInputException.class, () -> LdsiScorer.score(null, "b"));
        assertThrows(InvalidInputException.class, () -> LdsiScorer.score("a", null));
    }
}
