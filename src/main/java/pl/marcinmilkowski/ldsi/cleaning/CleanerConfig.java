package pl.marcinmilkowski.ldsi.cleaning;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.Locale;

/**
 * Options of the {@link TextCleaner} analysis chain.
 *
 * @param removeStopwords     drop function words of the configured language(s)
 * @param removeNumbers       drop tokens the tokenizer types as numbers
 * @param removePunctuation   turn every non-letter, non-digit character into a space before tokenizing
 * @param lowercase           lowercase every token
 * @param language            stopword lists to use
 * @param minWordLength       shortest token kept, in code points
 * @param dynamicStopwords    also drop tokens that dominate this particular text
 * @param frequencyThreshold  share of all tokens above which a token counts as dominant
 */
public record CleanerConfig(
    boolean removeStopwords,
    boolean removeNumbers,
    boolean removePunctuation,
    boolean lowercase,
    Language language,
    int minWordLength,
    boolean dynamicStopwords,
    double frequencyThreshold
) {

    public static final CleanerConfig DEFAULT =
        new CleanerConfig(true, true, true, true, Language.BOTH, 2, false, 0.01);

    public CleanerConfig {
        if (language == null) {
            throw InvalidInputException.missing("language");
        }
        if (minWordLength < 1) {
            throw InvalidInputException.invalidParameter("minWordLength", minWordLength, ">= 1");
        }
        if (!(frequencyThreshold > 0.0 && frequencyThreshold <= 1.0)) {
            throw InvalidInputException.invalidParameter("frequencyThreshold", frequencyThreshold, "in (0, 1]");
        }
    }

    public CleanerConfig withMinWordLength(int length) {
        return new CleanerConfig(removeStopwords, removeNumbers, removePunctuation, lowercase,
            language, length, dynamicStopwords, frequencyThreshold);
    }

    public CleanerConfig withLanguage(Language lang) {
        return new CleanerConfig(removeStopwords, removeNumbers, removePunctuation, lowercase,
            lang, minWordLength, dynamicStopwords, frequencyThreshold);
    }

    public CleanerConfig withStopwords(boolean enabled) {
        return new CleanerConfig(enabled, removeNumbers, removePunctuation, lowercase,
            language, minWordLength, dynamicStopwords, frequencyThreshold);
    }

    public CleanerConfig withDynamicStopwords(boolean enabled, double threshold) {
        return new CleanerConfig(removeStopwords, removeNumbers, removePunctuation, lowercase,
            language, minWordLength, enabled, threshold);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("remove_stopwords", removeStopwords);
        obj.put("remove_numbers", removeNumbers);
        obj.put("remove_punctuation", removePunctuation);
        obj.put("lowercase", lowercase);
        obj.put("language", language.name().toLowerCase(Locale.ROOT));
        obj.put("min_word_length", minWordLength);
        obj.put("dynamic_stopwords", dynamicStopwords);
        obj.put("frequency_threshold", frequencyThreshold);
        return obj;
    }

    /** Reads the keys of {@link #toJson()}; absent keys keep the value from {@code fallback}. */
    public static CleanerConfig fromJson(JSONObject obj, CleanerConfig fallback) {
        if (obj == null) {
            return fallback;
        }
        Boolean stop = obj.getBoolean("remove_stopwords");
        Boolean numbers = obj.getBoolean("remove_numbers");
        Boolean punct = obj.getBoolean("remove_punctuation");
        Boolean lower = obj.getBoolean("lowercase");
        String lang = obj.getString("language");
        Integer minLen = obj.getInteger("min_word_length");
        Boolean dynamic = obj.getBoolean("dynamic_stopwords");
        Double threshold = obj.getDouble("frequency_threshold");
        return new CleanerConfig(
            stop != null ? stop : fallback.removeStopwords,
            numbers != null ? numbers : fallback.removeNumbers,
            punct != null ? punct : fallback.removePunctuation,
            lower != null ? lower : fallback.lowercase,
            lang != null ? Language.parse(lang) : fallback.language,
            minLen != null ? minLen : fallback.minWordLength,
            dynamic != null ? dynamic : fallback.dynamicStopwords,
            threshold != null ? threshold : fallback.frequencyThreshold);
    }
}
