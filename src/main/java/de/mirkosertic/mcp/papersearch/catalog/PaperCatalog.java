package de.mirkosertic.mcp.papersearch.catalog;

import de.mirkosertic.mcp.papersearch.index.PaperIndexSchema;
import de.mirkosertic.mcp.papersearch.schema.SchemaReporter;
import de.mirkosertic.mcp.papersearch.store.PaperStore;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.search.ReferenceManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Holds the current {@link PaperStore} and swaps it when a new index build appears on disk.
 * <p>
 * Works like Lucene's {@code SearcherManager}: callers {@link #acquire()} a store, use it and
 * {@link #release(Object)} it in a finally block. {@link #maybeRefresh()} opens the new build
 * completely before publishing it, and the previous store is closed once its last user
 * releases it.
 */
public class PaperCatalog extends ReferenceManager<PaperStore> {

    private static final Logger logger = LoggerFactory.getLogger(PaperCatalog.class);

    private final Path indexPath;
    private final SchemaReporter schemaReporter;

    public PaperCatalog(final Path indexPath, final SchemaReporter schemaReporter) throws IOException {
        this.indexPath = indexPath;
        this.schemaReporter = schemaReporter;
        this.current = PaperStore.open(indexPath, schemaReporter);
    }

    public Path getIndexPath() {
        return indexPath;
    }

    @Override
    protected void decRef(final PaperStore reference) throws IOException {
        reference.decRef();
    }

    @Override
    protected PaperStore refreshIfNeeded(final PaperStore referenceToRefresh) throws IOException {
        final String onDiskBuildId = readBuildId();
        if (onDiskBuildId == null || Objects.equals(onDiskBuildId, referenceToRefresh.buildId())) {
            return null;
        }
        logger.info("Detected new index build {} (current {}), reloading corpus",
                onDiskBuildId, referenceToRefresh.buildId());
        return PaperStore.open(indexPath, schemaReporter);
    }

    @Override
    protected boolean tryIncRef(final PaperStore reference) {
        return reference.tryIncRef();
    }

    @Override
    protected int getRefCount(final PaperStore reference) {
        return reference.getRefCount();
    }

    private String readBuildId() throws IOException {
        if (!Files.isDirectory(indexPath)) {
            logger.warn("Index directory {} vanished, keeping the loaded corpus", indexPath.toAbsolutePath());
            return null;
        }
        try (Directory directory = FSDirectory.open(indexPath)) {
            if (!DirectoryReader.indexExists(directory)) {
                return null;
            }
            return SegmentInfos.readLatestCommit(directory).getUserData().get(PaperIndexSchema.COMMIT_BUILD_ID);
        }
    }
}
