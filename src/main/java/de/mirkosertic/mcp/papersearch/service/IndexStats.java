package de.mirkosertic.mcp.papersearch.service;

import java.util.List;

/**
 * Snapshot of the currently loaded corpus.
 */
public record IndexStats(int documentCount, List<String> columns, String indexPath,
                         String buildId, String builtAt, int schemaVersion) {

    public IndexStats {
        columns = List.copyOf(columns);
    }
}
