package de.mirkosertic.mcp.papersearch.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a free-text query into lowercased words: runs of letters, digits and underscore.
 * A word such as {@code poster_session} is matched against the index as its underscore-separated parts.
 */
public final class QueryTokenizer {

    private QueryTokenizer() {
    }

    public static List<String> tokenize(final String query) {
        final List<String> tokens = new ArrayList<>();
        if (query == null) {
            return tokens;
        }
        final StringBuilder current = new StringBuilder();
        int offset = 0;
        while (offset < query.length()) {
            final int codePoint = query.codePointAt(offset);
            if (isWordChar(codePoint)) {
                current.appendCodePoint(codePoint);
            } else if (current.length() > 0) {
                tokens.add(current.toString().toLowerCase(Locale.ROOT));
                current.setLength(0);
            }
            offset += Character.charCount(codePoint);
        }
        if (current.length() > 0) {
            tokens.add(current.toString().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }

    private static boolean isWordChar(final int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }
}
