package pl.marcinmilkowski.ldsi.scoring;

import pl.marcinmilkowski.ldsi.entropy.WordTokenizer;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Immutable text together with its UTF-8 bytes and word tokens.
 */
public final class TextSample {

    private final String text;
    private final byte[] bytes;
    private final List<String> tokens;

    private TextSample(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
        this.tokens = List.copyOf(WordTokenizer.tokenize(text));
    }

    public static TextSample of(String text) {
        if (text == null) {
            throw InvalidInputException.missing("text");
        }
        return new TextSample(text);
    }

    public String text() {
        return text;
    }

    /**
     * Copy of the UTF-8 encoding.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    public List<String> tokens() {
        return tokens;
    }

    @Override
    public String toString() {
        return String.format("TextSample[%d bytes, %d tokens]", bytes.length, tokens.size());
    }
}
