package pl.marcinmilkowski.ldsi.cleaning;

import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.List;
import java.util.Locale;

/**
 * Stopword lists the cleaner can load. Each list is a classpath resource
 * in Lucene's word-list format (one word per line, {@code #} comments).
 */
public enum Language {
    FRENCH(List.of("stopwords/french.txt")),
    ENGLISH(List.of("stopwords/english.txt")),
    BOTH(List.of("stopwords/french.txt", "stopwords/english.txt"));

    private final List<String> resources;

    Language(List<String> resources) {
        this.resources = resources;
    }

    public List<String> getResources() {
        return resources;
    }

    public static Language parse(String value) {
        if (value == null || value.isBlank()) {
            throw InvalidInputException.missing("language");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "fr", "french" -> FRENCH;
            case "en", "english" -> ENGLISH;
            case "both", "fr+en", "all" -> BOTH;
            default -> throw InvalidInputException.invalidParameter("language", value, "fr, en or both");
        };
    }
}
