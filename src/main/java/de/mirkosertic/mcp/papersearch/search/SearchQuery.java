package de.mirkosertic.mcp.papersearch.search;

/**
 * Parameters of one search.
 *
 * @param query     free text; null or blank disables the full-text prefilter
 * @param filters   normalized structured filters
 * @param page      1-based page number
 * @param pageSize  results per page, at least 1
 * @param sortBy    field name, {@code random}, or null for the default order
 * @param sortOrder {@code asc} or {@code desc}
 * @param seed      seed for the {@code random} order
 */
public record SearchQuery(String query, SearchFilters filters, int page, int pageSize,
                          String sortBy, String sortOrder, String seed) {

    public SearchQuery {
        if (filters == null) {
            filters = SearchFilters.none();
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, was " + pageSize);
        }
    }

    public static SearchQuery all(final int pageSize) {
        return new SearchQuery(null, SearchFilters.none(), 1, pageSize, null, null, null);
    }

    public boolean hasFullText() {
        return query != null && !query.isBlank();
    }
}
