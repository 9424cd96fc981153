package pl.marcinmilkowski.ldsi.scoring;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import static org.junit.jupiter.api.Assertions.*;

class VerdictThresholdsTest {

    @Test
    @DisplayName("Band boundaries should belong to the upper band")
    void testBoundaries() {
        VerdictThresholds t = VerdictThresholds.DEFAULT;
        assertEquals(Verdict.ZOMBIE, t.classify(0.0));
        assertEquals(Verdict.ZOMBIE, t.classify(0.2999));
        assertEquals(Verdict.REBEL, t.classify(0.3));
        assertEquals(Verdict.REBEL, t.classify(0.6999));
        assertEquals(Verdict.ARCHITECT, t.classify(0.7));
        assertEquals(Verdict.ARCHITECT, t.classify(1.1999));
        assertEquals(Verdict.FOOL, t.classify(1.2));
        assertEquals(Verdict.FOOL, t.classify(5.0));
    }

    @Test
    @DisplayName("Verdict.fromLambda should use the default thresholds")
    void testFromLambda() {
        assertEquals(Verdict.REBEL, Verdict.fromLambda(0.5));
        assertEquals(Verdict.FOOL, Verdict.fromLambda(1.5));
        assertEquals(Verdict.ZOMBIE, Verdict.classify(0.5, new VerdictThresholds(0.6, 0.8, 1.0)));
    }

    @Test
    @DisplayName("Thresholds should be positive and strictly ascending")
    void testValidation() {
        assertThrows(InvalidInputException.class, () -> new VerdictThresholds(0.0, 0.7, 1.2));
        assertThrows(InvalidInputException.class, () -> new VerdictThresholds(0.3, 0.3, 1.2));
        assertThrows(InvalidInputException.class, () -> new VerdictThresholds(0.3, 0.7, Double.NaN));
    }

    @Test
    @DisplayName("Verdict names should parse case-insensitively")
    void testParse() {
        assertEquals(Verdict.ARCHITECT, Verdict.parse(" architect "));
        assertThrows(InvalidInputException.class, () -> Verdict.parse("oracle"));
        assertThrows(InvalidInputException.class, () -> Verdict.parse(null));
    }
}
