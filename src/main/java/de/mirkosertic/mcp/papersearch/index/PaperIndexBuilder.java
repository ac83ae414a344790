package de.mirkosertic.mcp.papersearch.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.papersearch.model.FieldValueJson;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Builds the persisted paper index from a corpus, destructively replacing any previous index.
 * <p>
 * All records are normalized and validated before anything is written. The index is
 * then written into a staging directory next to the target and moved into place only
 * after its commit succeeded, so a failed build leaves the previous index untouched.
 */
public class PaperIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PaperIndexBuilder.class);

    private final RecordNormalizer normalizer;

    public PaperIndexBuilder(final RecordNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public BuildSummary build(final List<ObjectNode> records, final Path target) throws IOException {
        final long startTime = System.currentTimeMillis();

        final List<FlatRow> rows = prepareRows(records);
        final List<String> columns = collectColumns(rows);
        final String buildId = UUID.randomUUID().toString();

        final Path absoluteTarget = target.toAbsolutePath();
        final Path parent = absoluteTarget.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path staging = absoluteTarget.resolveSibling(absoluteTarget.getFileName() + ".staging-" + buildId);

        try {
            writeIndex(staging, rows, columns, buildId);
            replace(staging, absoluteTarget, buildId);
        } finally {
            if (Files.exists(staging)) {
                try {
                    deleteRecursively(staging);
                } catch (final IOException e) {
                    logger.warn("Failed to clean up staging directory: {}", staging, e);
                }
            }
        }

        final long durationMs = System.currentTimeMillis() - startTime;
        logger.info("Index built at {} with {} rows and {} columns in {}ms",
                absoluteTarget, rows.size(), columns.size(), durationMs);

        return new BuildSummary(rows.size(), columns, buildId, absoluteTarget, durationMs);
    }

    List<FlatRow> prepareRows(final List<ObjectNode> records) throws CorpusFormatException {
        final List<FlatRow> rows = new ArrayList<>(records.size());
        final Set<Long> seenIds = new HashSet<>();
        int position = 0;
        for (final ObjectNode record : records) {
            final FlatRow row = normalizer.normalize(record, position);
            if (!seenIds.add(row.id())) {
                throw new CorpusFormatException("Duplicate id " + row.id() + " at record #" + position);
            }
            rows.add(row);
            position++;
        }
        return rows;
    }

    /**
     * Union of all row columns over the whole corpus: {@code id} first, then every other column sorted.
     */
    static List<String> collectColumns(final List<FlatRow> rows) {
        final Set<String> names = new TreeSet<>();
        for (final FlatRow row : rows) {
            names.addAll(row.columns().keySet());
        }
        names.add(PaperIndexSchema.FIELD_SEARCH_BLOB);
        names.add(PaperIndexSchema.FIELD_RAW_JSON);

        final List<String> columns = new ArrayList<>(names.size() + 1);
        columns.add(PaperIndexSchema.FIELD_ID);
        columns.addAll(names);
        return columns;
    }

    private void writeIndex(final Path staging, final List<FlatRow> rows, final List<String> columns,
                            final String buildId) throws IOException {
        Files.createDirectories(staging);

        final IndexWriterConfig config = new IndexWriterConfig(new SearchBlobAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);

        try (final Directory directory = FSDirectory.open(staging);
             final IndexWriter writer = new IndexWriter(directory, config)) {

            for (final FlatRow row : rows) {
                writer.addDocument(createDocument(row));
            }

            final JsonNode columnsJson = FieldValueJson.mapper().valueToTree(columns);
            final Map<String, String> commitData = new LinkedHashMap<>();
            commitData.put(PaperIndexSchema.COMMIT_COLUMNS, FieldValueJson.write(columnsJson));
            commitData.put(PaperIndexSchema.COMMIT_SCHEMA_VERSION, Integer.toString(PaperIndexSchema.SCHEMA_VERSION));
            commitData.put(PaperIndexSchema.COMMIT_DOCUMENT_COUNT, Integer.toString(rows.size()));
            commitData.put(PaperIndexSchema.COMMIT_BUILD_ID, buildId);
            commitData.put(PaperIndexSchema.COMMIT_BUILT_AT, Instant.now().toString());
            writer.setLiveCommitData(commitData.entrySet());

            writer.commit();
        }
    }

    Document createDocument(final FlatRow row) {
        final Document doc = new Document();

        // id - numeric, stored, sortable
        doc.add(new LongPoint(PaperIndexSchema.FIELD_ID, row.id()));
        doc.add(new StoredField(PaperIndexSchema.FIELD_ID, row.id()));
        doc.add(new NumericDocValuesField(PaperIndexSchema.FIELD_ID, row.id()));

        // One stored text column per field; nulls are simply absent
        for (final Map.Entry<String, String> column : row.columns().entrySet()) {
            final String value = column.getValue();
            if (value == null) {
                continue;
            }
            doc.add(new StoredField(column.getKey(), value));
            if (PaperIndexSchema.EQUALITY_INDEXED_FIELDS.contains(column.getKey())) {
                doc.add(new StringField(column.getKey(), value, Field.Store.NO));
            }
        }

        doc.add(new TextField(PaperIndexSchema.FIELD_SEARCH_BLOB, row.searchBlob(), Field.Store.YES));
        doc.add(new StoredField(PaperIndexSchema.FIELD_RAW_JSON, row.rawJson()));
        return doc;
    }

    /**
     * Swaps the staged index in. The previous index is first renamed to a sibling backup,
     * restored if the staged index cannot be moved into place, and deleted only afterwards.
     */
    private void replace(final Path staging, final Path target, final String buildId) throws IOException {
        Path backup = null;
        if (Files.exists(target)) {
            backup = target.resolveSibling(target.getFileName() + ".previous-" + buildId);
            moveIntoPlace(target, backup);
        }
        try {
            moveIntoPlace(staging, target);
        } catch (final IOException e) {
            if (backup != null) {
                logger.warn("Could not move new index into place, restoring previous index at {}", target);
                try {
                    moveIntoPlace(backup, target);
                } catch (final IOException restoreError) {
                    logger.error("Failed to restore previous index, it remains at {}", backup, restoreError);
                    e.addSuppressed(restoreError);
                }
            }
            throw e;
        }
        if (backup != null) {
            logger.info("Removing previous index at {}", backup);
            try {
                deleteRecursively(backup);
            } catch (final IOException e) {
                logger.warn("Failed to remove previous index at {}", backup, e);
            }
        }
    }

    void moveIntoPlace(final Path source, final Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported, falling back to plain move: {}", e.getMessage());
            Files.move(source, destination);
        }
    }

    private static void deleteRecursively(final Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            Files.deleteIfExists(path);
            return;
        }
        try (final Stream<Path> walk = Files.walk(path)) {
            final List<Path> entries = walk.sorted(Comparator.reverseOrder()).toList();
            for (final Path entry : entries) {
                Files.deleteIfExists(entry);
            }
        }
    }

    /**
     * Outcome of a successful build.
     */
    public record BuildSummary(int documentCount, List<String> columns, String buildId, Path indexPath,
                               long durationMs) {
    }
}
