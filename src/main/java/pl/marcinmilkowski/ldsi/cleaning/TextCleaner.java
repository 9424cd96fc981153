package pl.marcinmilkowski.ldsi.cleaning;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.WordlistLoader;
import org.apache.lucene.analysis.fr.FrenchAnalyzer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.util.ElisionFilter;
import org.apache.lucene.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Prepares raw model output for scoring.
 *
 * <p>Text goes through NFC normalization and a Lucene analysis chain:</p>
 * <pre>
 * StandardTokenizer -> ElisionFilter (l', d', qu', ...) -> LowerCaseFilter
 *   -> NumericTokenFilter -> StopFilter -> LengthFilter
 * </pre>
 * <p>followed, when enabled, by a per-text Zipf filter that drops every token
 * whose count reaches {@code max(3, ceil(total * threshold))}.</p>
 *
 * <p>Instances are immutable and thread-safe; each call builds its own token
 * stream.</p>
 */
public class TextCleaner {

    private static final Logger logger = LoggerFactory.getLogger(TextCleaner.class);

    /** Token length used by {@link #extractSemanticCore(String)}. */
    public static final int SEMANTIC_CORE_MIN_LENGTH = 4;

    /** A dominant token must occur at least this many times, whatever the threshold. */
    static final int MIN_DYNAMIC_COUNT = 3;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");

    private static final Map<Language, CharArraySet> STOPWORDS = new EnumMap<>(Language.class);

    private final CleanerConfig config;
    private final CharArraySet stopwords;

    public TextCleaner() {
        this(CleanerConfig.DEFAULT);
    }

    public TextCleaner(CleanerConfig config) {
        if (config == null) {
            throw InvalidInputException.missing("cleaner config");
        }
        this.config = config;
        this.stopwords = config.removeStopwords() ? stopwordsFor(config.language()) : CharArraySet.EMPTY_SET;
    }

    public CleanerConfig getConfig() {
        return config;
    }

    /**
     * Runs the full chain and returns the surviving tokens in text order.
     */
    public List<String> cleanTokens(String text) {
        if (text == null) {
            throw InvalidInputException.missing("text");
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFC);
        if (config.removePunctuation()) {
            normalized = NON_WORD.matcher(normalized).replaceAll(" ");
        }

        List<String> tokens = analyze(normalized);
        if (config.dynamicStopwords()) {
            tokens = dropDominantTokens(tokens, config.frequencyThreshold());
        }
        return tokens;
    }

    /**
     * Cleaned text: the tokens of {@link #cleanTokens(String)} joined by single spaces.
     */
    public String clean(String text) {
        return String.join(" ", cleanTokens(text));
    }

    /**
     * Content words only: the default chain with a minimum length of
     * {@value #SEMANTIC_CORE_MIN_LENGTH}.
     */
    public static String extractSemanticCore(String text) {
        return new TextCleaner(CleanerConfig.DEFAULT.withMinWordLength(SEMANTIC_CORE_MIN_LENGTH)).clean(text);
    }

    private List<String> analyze(String text) {
        List<String> tokens = new ArrayList<>();
        Tokenizer source = new StandardTokenizer();
        source.setReader(new StringReader(text));

        TokenStream stream = new ElisionFilter(source, FrenchAnalyzer.DEFAULT_ARTICLES);
        if (config.lowercase()) {
            stream = new LowerCaseFilter(stream);
        }
        if (config.removeNumbers()) {
            stream = new NumericTokenFilter(stream);
        }
        if (config.removeStopwords()) {
            stream = new StopFilter(stream, stopwords);
        }
        // LengthFilter counts UTF-16 units; the code point check below is the authoritative one
        stream = new LengthFilter(stream, config.minWordLength(), Integer.MAX_VALUE);

        try (TokenStream ts = stream) {
            CharTermAttribute termAttr = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                String term = termAttr.toString();
                if (term.codePointCount(0, term.length()) >= config.minWordLength()) {
                    tokens.add(term);
                }
            }
            ts.end();
        } catch (IOException e) {
            // StringReader does not fail; anything here is a broken filter
            throw new UncheckedIOException("Analysis chain failed", e);
        }
        return tokens;
    }

    /**
     * Drops every token whose count in {@code tokens} is at least
     * {@code max(3, ceil(size * threshold))}.
     */
    static List<String> dropDominantTokens(List<String> tokens, double threshold) {
        if (tokens.isEmpty()) {
            return tokens;
        }
        int limit = Math.max(MIN_DYNAMIC_COUNT, (int) Math.ceil(tokens.size() * threshold));

        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        Set<String> dominant = new HashSet<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() >= limit) {
                dominant.add(entry.getKey());
            }
        }
        if (dominant.isEmpty()) {
            return tokens;
        }
        logger.debug("Dropping {} dominant tokens (limit {}): {}", dominant.size(), limit, dominant);

        List<String> kept = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (!dominant.contains(token)) {
                kept.add(token);
            }
        }
        return kept;
    }

    static synchronized CharArraySet stopwordsFor(Language language) {
        CharArraySet cached = STOPWORDS.get(language);
        if (cached != null) {
            return cached;
        }
        CharArraySet merged = new CharArraySet(256, true);
        for (String resource : language.getResources()) {
            merged.addAll(loadWordList(resource));
        }
        CharArraySet result = CharArraySet.unmodifiableSet(merged);
        STOPWORDS.put(language, result);
        logger.debug("Loaded {} stopwords for {}", result.size(), language);
        return result;
    }

    private static CharArraySet loadWordList(String resource) {
        InputStream in = TextCleaner.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Stopword list not found on classpath: " + resource);
        }
        try (Reader reader = IOUtils.getDecodingReader(in, StandardCharsets.UTF_8)) {
            return WordlistLoader.getWordSet(reader, "#");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read stopword list " + resource, e);
        }
    }
}
