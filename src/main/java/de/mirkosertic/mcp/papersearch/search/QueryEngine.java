package de.mirkosertic.mcp.papersearch.search;

import de.mirkosertic.mcp.papersearch.model.PaperDocument;
import de.mirkosertic.mcp.papersearch.store.PaperStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes searches against a loaded {@link PaperStore}: full-text prefilter, structured
 * filters, ordering and pagination, in that order. Stateless and thread-safe.
 */
public class QueryEngine {

    public SearchPage search(final PaperStore store, final SearchQuery query) throws IOException {
        final List<PaperDocument> candidates = candidates(store, query);

        final List<PaperDocument> filtered;
        if (query.filters().isEmpty()) {
            filtered = candidates;
        } else {
            filtered = new ArrayList<>();
            for (final PaperDocument document : candidates) {
                if (query.filters().matches(document)) {
                    filtered.add(document);
                }
            }
        }

        final List<PaperDocument> ordered = ResultOrdering.order(filtered, query.sortBy(), query.sortOrder(), query.seed());
        return new SearchPage(ordered.size(), slice(ordered, query.page(), query.pageSize()));
    }

    private List<PaperDocument> candidates(final PaperStore store, final SearchQuery query) throws IOException {
        if (!query.hasFullText()) {
            return store.documents();
        }
        final List<String> tokens = QueryTokenizer.tokenize(query.query());
        if (tokens.isEmpty()) {
            // Text without any word characters matches nothing
            return List.of();
        }
        return store.fullTextMatches(tokens);
    }

    static List<PaperDocument> slice(final List<PaperDocument> ordered, final int page, final int pageSize) {
        final long start = (long) Math.max(page - 1, 0) * pageSize;
        if (start >= ordered.size()) {
            return List.of();
        }
        final int end = (int) Math.min(start + pageSize, ordered.size());
        return ordered.subList((int) start, end);
    }
}
