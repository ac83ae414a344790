package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the getPaper tool.
 */
public record GetPaperRequest(
        @Description("Numeric id of the paper, as returned by search")
        Long id
) {
    public static GetPaperRequest fromMap(final Map<String, Object> args) {
        final Object raw = args.get("id");
        if (raw instanceof Number number) {
            return new GetPaperRequest(number.longValue());
        }
        if (raw instanceof String text && text.trim().matches("\\d+")) {
            return new GetPaperRequest(Long.parseLong(text.trim()));
        }
        throw new IllegalArgumentException("id must be a non-negative integer, got '" + raw + "'");
    }
}
