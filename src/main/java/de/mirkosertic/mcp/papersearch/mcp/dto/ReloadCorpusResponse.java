package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.mcp.ToolResponse;

/**
 * Response DTO for the reloadCorpus tool.
 *
 * @param reloaded true if a new index build was picked up
 */
public record ReloadCorpusResponse(
        boolean success,
        boolean reloaded,
        String buildId,
        int documentCount,
        String message,
        String error
) implements ToolResponse {

    public static ReloadCorpusResponse success(final boolean reloaded, final String buildId, final int documentCount) {
        final String message = reloaded
                ? "Loaded index build " + buildId + " with " + documentCount + " papers"
                : "Index build " + buildId + " is already current";
        return new ReloadCorpusResponse(true, reloaded, buildId, documentCount, message, null);
    }

    public static ReloadCorpusResponse error(final String errorMessage) {
        return new ReloadCorpusResponse(false, false, null, 0, null, errorMessage);
    }
}
