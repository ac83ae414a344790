package de.mirkosertic.mcp.papersearch.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.util.CharTokenizer;

/**
 * Analyzer for the {@code search_blob} field.
 * <p>
 * Tokens are maximal runs of letters and digits; underscore and punctuation separate them, so
 * "poster_session" is indexed as "poster" and "session". Tokens are lowercased and folded
 * with ICU4J, so "Müller" is indexed as "muller". Query terms go through
 * {@link #normalize(String, String)}, so prefix terms and indexed terms always share one form.
 *
 * <p><b>Breaking change note:</b> Changing this analyzer invalidates existing indexes;
 * bump {@link PaperIndexSchema#SCHEMA_VERSION} and rebuild.</p>
 */
public class SearchBlobAnalyzer extends Analyzer {

    public static boolean isTokenChar(final int codePoint) {
        return Character.isLetterOrDigit(codePoint);
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new WordCharTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new ICUFoldingFilter(new LowerCaseFilter(in));
    }

    private static final class WordCharTokenizer extends CharTokenizer {

        @Override
        protected boolean isTokenChar(final int c) {
            return SearchBlobAnalyzer.isTokenChar(c);
        }
    }
}
