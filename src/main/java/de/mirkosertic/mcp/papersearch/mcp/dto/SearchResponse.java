package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.mcp.ToolResponse;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the search tool. {@code total} counts all matches, {@code results} holds one page.
 */
public record SearchResponse(
        boolean success,
        int total,
        int page,
        int pageSize,
        int totalPages,
        List<Map<String, Object>> results,
        long searchTimeMs,
        String error
) implements ToolResponse {

    public static SearchResponse success(final int total, final int page, final int pageSize,
                                         final List<Map<String, Object>> results, final long searchTimeMs) {
        final int totalPages = (int) Math.ceil((double) total / pageSize);
        return new SearchResponse(true, total, page, pageSize, totalPages, results, searchTimeMs, null);
    }

    public static SearchResponse error(final String errorMessage) {
        return new SearchResponse(false, 0, 0, 0, 0, null, 0, errorMessage);
    }
}
