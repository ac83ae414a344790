package de.mirkosertic.mcp.papersearch.service;

import de.mirkosertic.mcp.papersearch.catalog.PaperCatalog;
import de.mirkosertic.mcp.papersearch.index.PaperIndexSchema;
import de.mirkosertic.mcp.papersearch.model.PaperDocument;
import de.mirkosertic.mcp.papersearch.schema.SchemaReport;
import de.mirkosertic.mcp.papersearch.search.QueryEngine;
import de.mirkosertic.mcp.papersearch.search.SearchPage;
import de.mirkosertic.mcp.papersearch.search.SearchQuery;
import de.mirkosertic.mcp.papersearch.store.PaperStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for request handlers. Every call works on one consistent corpus snapshot,
 * even when a reload happens concurrently.
 */
public class PaperSearchService {

    private static final Logger logger = LoggerFactory.getLogger(PaperSearchService.class);

    private final PaperCatalog catalog;
    private final QueryEngine queryEngine;

    public PaperSearchService(final PaperCatalog catalog, final QueryEngine queryEngine) {
        this.catalog = catalog;
        this.queryEngine = queryEngine;
    }

    public SearchPage search(final SearchQuery query) throws IOException {
        final long startTime = System.currentTimeMillis();
        final PaperStore store = catalog.acquire();
        try {
            final SearchPage page = queryEngine.search(store, query);
            logger.info("Search query='{}' filters={} page={} pageSize={} sortBy={} sortOrder={} returned {} of {} hits in {}ms",
                    query.query(), query.filters(), query.page(), query.pageSize(), query.sortBy(), query.sortOrder(),
                    page.results().size(), page.total(), System.currentTimeMillis() - startTime);
            return page;
        } finally {
            catalog.release(store);
        }
    }

    public Optional<PaperDocument> get(final long id) throws IOException {
        final PaperStore store = catalog.acquire();
        try {
            return Optional.ofNullable(store.get(id));
        } finally {
            catalog.release(store);
        }
    }

    public SchemaReport schema() throws IOException {
        final PaperStore store = catalog.acquire();
        try {
            return store.schema();
        } finally {
            catalog.release(store);
        }
    }

    public IndexStats stats() throws IOException {
        final PaperStore store = catalog.acquire();
        try {
            return new IndexStats(store.size(), store.columns(), store.indexPath().toAbsolutePath().toString(),
                    store.buildId(), store.builtAt(), PaperIndexSchema.SCHEMA_VERSION);
        } finally {
            catalog.release(store);
        }
    }

    /**
     * Checks the index directory for a newer build and swaps it in.
     *
     * @return true if a different build is now being served
     */
    public boolean reload() throws IOException {
        final String before = currentBuildId();
        catalog.maybeRefreshBlocking();
        final String after = currentBuildId();
        final boolean changed = !Objects.equals(before, after);
        if (changed) {
            logger.info("Corpus reloaded: build {} replaced {}", after, before);
        } else {
            logger.info("Corpus reload requested, build {} is still current", after);
        }
        return changed;
    }

    private String currentBuildId() throws IOException {
        final PaperStore store = catalog.acquire();
        try {
            return store.buildId();
        } finally {
            catalog.release(store);
        }
    }

    public void close() throws IOException {
        catalog.close();
        logger.info("Paper catalog closed");
    }
}
