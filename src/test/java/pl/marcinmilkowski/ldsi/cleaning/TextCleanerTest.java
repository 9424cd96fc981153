package pl.marcinmilkowski.ldsi.cleaning;

import org.apache.lucene.analysis.CharArraySet;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Lucene-based cleaning chain.
 */
class TextCleanerTest {

    private final TextCleaner cleaner = new TextCleaner();

    @Test
    @DisplayName("French stopwords and punctuation should be removed")
    void testFrenchSentence() {
        assertEquals(List.of("chat", "tapis"), cleaner.cleanTokens("Le chat est sur le tapis."));
        assertEquals("chat tapis", cleaner.clean("Le chat est sur le tapis."));
    }

    @Test
    @DisplayName("Elided articles should not survive as tokens")
    void testElision() {
        assertEquals(List.of("homme", "aime"), cleaner.cleanTokens("L'homme qu'il aime"));

        // keep the apostrophes so the elision filter does the work
        CleanerConfig keepPunctuation = new CleanerConfig(true, true, false, true, Language.FRENCH, 2, false, 0.01);
        assertEquals(List.of("homme", "aime"), new TextCleaner(keepPunctuation).cleanTokens("L'homme qu'il aime"));
    }

    @Test
    @DisplayName("Numbers should be dropped when requested")
    void testNumbers() {
        assertEquals(List.of("degres"), cleaner.cleanTokens("Il fait 25 degres"));

        CleanerConfig keepNumbers = new CleanerConfig(true, false, true, true, Language.BOTH, 2, false, 0.01);
        assertEquals(List.of("25", "degres"), new TextCleaner(keepNumbers).cleanTokens("Il fait 25 degres"));
    }

    @Test
    @DisplayName("English stopwords should follow the language setting")
    void testEnglish() {
        String text = "The quick brown fox";
        assertEquals(List.of("quick", "brown", "fox"), cleaner.cleanTokens(text));
        assertEquals(List.of("quick", "brown", "fox"),
            new TextCleaner(CleanerConfig.DEFAULT.withLanguage(Language.ENGLISH)).cleanTokens(text));
        assertEquals(List.of("the", "quick", "brown", "fox"),
            new TextCleaner(CleanerConfig.DEFAULT.withLanguage(Language.FRENCH)).cleanTokens(text));
    }

    @Test
    @DisplayName("Disabled stopwords should keep every word")
    void testStopwordsOff() {
        TextCleaner plain = new TextCleaner(CleanerConfig.DEFAULT.withStopwords(false));
        assertEquals(List.of("le", "chat", "est", "sur", "le", "tapis"), plain.cleanTokens("Le chat est sur le tapis."));
    }

    @Test
    @DisplayName("Minimum length should be counted in code points")
    void testMinLength() {
        TextCleaner longWords = new TextCleaner(CleanerConfig.DEFAULT.withStopwords(false).withMinWordLength(4));
        assertEquals(List.of("chat", "tapis"), longWords.cleanTokens("le chat sur le tapis"));
        assertTrue(longWords.cleanTokens("été").isEmpty());
        TextCleaner three = new TextCleaner(CleanerConfig.DEFAULT.withStopwords(false).withMinWordLength(3));
        assertEquals(List.of("été"), three.cleanTokens("été"));
    }

    @Test
    @DisplayName("Semantic core should keep content words of four or more letters")
    void testSemanticCore() {
        assertEquals("temperature degres aujourd", TextCleaner.extractSemanticCore(
            "La temperature est de 25 degres aujourd'hui."));
    }

    @Test
    @DisplayName("Dynamic filter should drop tokens that dominate the text")
    void testDynamicStopwords() {
        CleanerConfig dynamic = CleanerConfig.DEFAULT.withStopwords(false).withDynamicStopwords(true, 0.01);
        List<String> tokens = new TextCleaner(dynamic)
            .cleanTokens("data processing data analysis data pipeline data");
        assertEquals(List.of("processing", "analysis", "pipeline"), tokens);
    }

    @Test
    @DisplayName("A token seen twice is never dominant")
    void testDynamicMinimumCount() {
        List<String> tokens = List.of("alpha", "beta", "alpha", "gamma");
        assertEquals(tokens, TextCleaner.dropDominantTokens(tokens, 0.01));
        assertEquals(List.of("beta"), TextCleaner.dropDominantTokens(
            List.of("alpha", "beta", "alpha", "alpha"), 0.01));
        assertTrue(TextCleaner.dropDominantTokens(List.of(), 0.5).isEmpty());
    }

    @Test
    @DisplayName("Decomposed accents should be composed before tokenizing")
    void testNfc() {
        assertEquals("caf\u00e9 noir", cleaner.clean("Un cafe\u0301 noir"));
    }

    @Test
    @DisplayName("Stopword sets should merge and ignore case")
    void testStopwordSets() {
        CharArraySet both = TextCleaner.stopwordsFor(Language.BOTH);
        assertTrue(both.contains("le"));
        assertTrue(both.contains("THE"));
        assertFalse(both.contains("#"));
        assertSame(both, TextCleaner.stopwordsFor(Language.BOTH));
        assertFalse(TextCleaner.stopwordsFor(Language.FRENCH).contains("the"));
    }

    @Test
    @DisplayName("Language names should parse")
    void testLanguageParse() {
        assertEquals(Language.FRENCH, Language.parse("fr"));
        assertEquals(Language.ENGLISH, Language.parse("English"));
        assertEquals(Language.BOTH, Language.parse("fr+en"));
        assertThrows(InvalidInputException.class, () -> Language.parse("de"));
        assertThrows(InvalidInputException.class, () -> Language.parse(" "));
    }

    @Test
    @DisplayName("Invalid config and null text should be rejected")
    void testInvalidInput() {
        assertThrows(InvalidInputException.class, () -> cleaner.cleanTokens(null));
        assertThrows(InvalidInputException.class, () -> CleanerConfig.DEFAULT.withMinWordLength(0));
        assertThrows(InvalidInputException.class, () -> CleanerConfig.DEFAULT.withDynamicStopwords(true, 0.0));
        assertTrue(cleaner.cleanTokens("").isEmpty());
    }
}
