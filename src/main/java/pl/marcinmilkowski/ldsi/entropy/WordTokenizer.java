package pl.marcinmilkowski.ldsi.entropy;

import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LetterTokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits text into lowercase word tokens.
 *
 * <pre>
 * LetterTokenizer -> LowerCaseFilter -> LengthFilter(2)
 * </pre>
 *
 * <p>Every code point that is not a letter is a separator, so punctuation,
 * digits and whitespace all break words ("vingt-cinq" gives "vingt" and
 * "cinq"). Tokens shorter than two code points are dropped, accented ones
 * included: "à" and "y" go the same way. No stemming or lemmatization: the
 * output depends on the input characters only.</p>
 */
public final class WordTokenizer {

    public static final int MIN_TOKEN_LENGTH = 2;

    private WordTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null) {
            throw InvalidInputException.missing("text");
        }
        if (text.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> tokens = new ArrayList<>();
        // the default limit of 255 chars would cut long words in two
        Tokenizer source = new LetterTokenizer(TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY,
            StandardTokenizer.MAX_TOKEN_LENGTH_LIMIT);
        source.setReader(new StringReader(text));
        TokenStream stream = new LengthFilter(new LowerCaseFilter(source), MIN_TOKEN_LENGTH, Integer.MAX_VALUE);

        try (TokenStream ts = stream) {
            CharTermAttribute termAttr = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                String term = termAttr.toString();
                // LengthFilter counts UTF-16 units, a surrogate pair would pass as two
                if (term.codePointCount(0, term.length()) >= MIN_TOKEN_LENGTH) {
                    tokens.add(term);
                }
            }
            ts.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Tokenization failed", e);
        }
        return tokens;
    }
}
