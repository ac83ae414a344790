package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.mcp.ToolResponse;
import de.mirkosertic.mcp.papersearch.service.IndexStats;

import java.util.List;

/**
 * Response DTO for the getIndexStats tool.
 */
public record IndexStatsResponse(
        boolean success,
        int documentCount,
        List<String> columns,
        String indexPath,
        String buildId,
        String builtAt,
        int schemaVersion,
        String softwareVersion,
        String buildTimestamp,
        String error
) implements ToolResponse {

    public static IndexStatsResponse success(final IndexStats stats, final String softwareVersion,
                                             final String buildTimestamp) {
        return new IndexStatsResponse(true, stats.documentCount(), stats.columns(), stats.indexPath(),
                stats.buildId(), stats.builtAt(), stats.schemaVersion(), softwareVersion, buildTimestamp, null);
    }

    public static IndexStatsResponse error(final String errorMessage) {
        return new IndexStatsResponse(false, 0, null, null, null, null, 0, null, null, errorMessage);
    }
}
