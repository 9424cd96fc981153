package pl.marcinmilkowski.ldsi.entropy;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordTokenizerTest {

    @Test
    @DisplayName("Non-letters should split words and tokens should be lowercased")
    void testSplitAndLowercase() {
        assertEquals(
            List.of("la", "temperature", "est", "de", "vingt", "cinq", "degres", "aujourd", "hui"),
            WordTokenizer.tokenize("La temperature est de vingt-cinq degres aujourd'hui."));
    }

    @Test
    @DisplayName("Single-letter tokens and digits should be dropped")
    void testShortTokensAndDigits() {
        assertEquals(List.of("degres"), WordTokenizer.tokenize("a 25 degres y"));
        assertEquals(List.of("hi"), WordTokenizer.tokenize("Hi."));
        assertTrue(WordTokenizer.tokenize("a b c 1 2 3 !").isEmpty());
    }

    @Test
    @DisplayName("Accented and non-Latin letters should be kept")
    void testUnicodeLetters() {
        assertEquals(List.of("éléphant", "über", "москва"), WordTokenizer.tokenize("Éléphant, Über; Москва"));
    }

    @Test
    @DisplayName("One-letter words should be dropped even when accented or outside the BMP")
    void testOneLetterWords() {
        assertEquals(List.of("il", "va", "paris"), WordTokenizer.tokenize("Il va \u00e0 Paris"));
        assertEquals(List.of("bc"), WordTokenizer.tokenize("\uD835\uDC9C bc"));
    }

    @Test
    @DisplayName("Words longer than the default Lucene token limit should stay whole")
    void testLongWord() {
        String word = "ab".repeat(200);
        assertEquals(List.of(word, "fin"), WordTokenizer.tokenize(word + " fin"));
    }

    @Test
    @DisplayName("Empty text should give no tokens and null should fail")
    void testEmptyAndNull() {
        assertTrue(WordTokenizer.tokenize("").isEmpty());
        assertThrows(InvalidInputException.class, () -> WordTokenizer.tokenize(null));
    }
}
