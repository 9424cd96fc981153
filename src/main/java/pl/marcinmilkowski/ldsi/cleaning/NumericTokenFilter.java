package pl.marcinmilkowski.ldsi.cleaning;

import org.apache.lucene.analysis.FilteringTokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.TypeAttribute;

/**
 * Drops tokens the {@link StandardTokenizer} typed as {@code <NUM>}.
 */
final class NumericTokenFilter extends FilteringTokenFilter {

    private static final String NUM_TYPE = StandardTokenizer.TOKEN_TYPES[StandardTokenizer.NUM];

    private final TypeAttribute typeAttr = addAttribute(TypeAttribute.class);

    NumericTokenFilter(TokenStream in) {
        super(in);
    }

    @Override
    protected boolean accept() {
        return !NUM_TYPE.equals(typeAttr.type());
    }
}
