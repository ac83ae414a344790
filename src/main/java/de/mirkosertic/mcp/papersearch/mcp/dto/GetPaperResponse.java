package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.mcp.ToolResponse;

import java.util.Map;

/**
 * Response DTO for the getPaper tool.
 */
public record GetPaperResponse(
        boolean success,
        Map<String, Object> paper,
        String error
) implements ToolResponse {

    public static GetPaperResponse success(final Map<String, Object> paper) {
        return new GetPaperResponse(true, paper, null);
    }

    public static GetPaperResponse error(final String errorMessage) {
        return new GetPaperResponse(false, null, errorMessage);
    }
}
