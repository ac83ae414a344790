package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.mcp.Description;
import de.mirkosertic.mcp.papersearch.search.SearchFilters;
import de.mirkosertic.mcp.papersearch.search.SearchQuery;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Nullable
        @Description("Free-text query. Every word must prefix-match a word of the paper (title, authors, abstract, keywords, ...). Empty matches all papers.")
        String query,

        @Nullable
        @Description("Field filters, e.g. {\"decision\": \"Accept (oral)\", \"keywords\": [\"nlp\", \"vision\"]}. "
                + "A paper matches a field if any value is a case-insensitive substring of the field value. All fields must match.")
        Map<String, Object> filters,

        @Nullable
        @Description("Page number (1-based). Default is 1.")
        Integer page,

        @Nullable
        @Description("Number of results per page. Default and maximum are configured on the server.")
        Integer pageSize,

        @Nullable
        @Description("Field to sort by, or 'random' for a reproducible shuffle. Default is 'name'.")
        String sortBy,

        @Nullable
        @Description(value = "Sort direction. Default is 'asc'.", allowedValues = {"asc", "desc"})
        String sortOrder,

        @Nullable
        @Description("Seed for sortBy='random'. The same seed always yields the same order.")
        String seed
) {

    @SuppressWarnings("unchecked")
    public static SearchRequest fromMap(final Map<String, Object> args) {
        final Object rawFilters = args.get("filters");
        final Map<String, Object> filters;
        if (rawFilters == null) {
            filters = null;
        } else if (rawFilters instanceof Map<?, ?> map) {
            filters = new LinkedHashMap<>((Map<String, Object>) map);
        } else {
            throw new IllegalArgumentException("filters must be an object mapping field names to values");
        }

        return new SearchRequest(
                ToolArguments.optionalString(args.get("query")),
                filters,
                ToolArguments.optionalInt(args.get("page"), "page"),
                ToolArguments.optionalInt(args.get("pageSize"), "pageSize"),
                ToolArguments.optionalString(args.get("sortBy")),
                ToolArguments.optionalString(args.get("sortOrder")),
                ToolArguments.optionalString(args.get("seed"))
        );
    }

    public int effectivePage() {
        return page != null && page >= 1 ? page : 1;
    }

    public int effectivePageSize(final int defaultPageSize, final int maxPageSize) {
        if (pageSize == null || pageSize < 1) {
            return defaultPageSize;
        }
        return Math.min(pageSize, maxPageSize);
    }

    /**
     * Lowercased sort direction, {@code asc} when absent.
     *
     * @throws IllegalArgumentException for anything other than asc or desc
     */
    public String effectiveSortOrder() {
        if (sortOrder == null || sortOrder.isBlank()) {
            return "asc";
        }
        final String normalized = sortOrder.trim().toLowerCase(Locale.ROOT);
        if (!"asc".equals(normalized) && !"desc".equals(normalized)) {
            throw new IllegalArgumentException("sortOrder must be 'asc' or 'desc', got '" + sortOrder + "'");
        }
        return normalized;
    }

    public SearchQuery toQuery(final int defaultPageSize, final int maxPageSize) {
        return new SearchQuery(query, SearchFilters.of(filters), effectivePage(),
                effectivePageSize(defaultPageSize, maxPageSize), sortBy, effectiveSortOrder(), seed);
    }
}
