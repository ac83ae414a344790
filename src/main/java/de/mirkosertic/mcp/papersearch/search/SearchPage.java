package de.mirkosertic.mcp.papersearch.search;

import de.mirkosertic.mcp.papersearch.model.PaperDocument;

import java.util.List;

/**
 * One page of results.
 *
 * @param total   number of matching documents before pagination
 * @param results the documents of the requested page, in order
 */
public record SearchPage(int total, List<PaperDocument> results) {

    public SearchPage {
        results = List.copyOf(results);
    }
}
