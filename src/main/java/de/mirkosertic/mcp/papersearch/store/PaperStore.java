package de.mirkosertic.mcp.papersearch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import de.mirkosertic.mcp.papersearch.index.PaperIndexSchema;
import de.mirkosertic.mcp.papersearch.index.SearchBlobAnalyzer;
import de.mirkosertic.mcp.papersearch.index.SearchProjections;
import de.mirkosertic.mcp.papersearch.model.FieldValue;
import de.mirkosertic.mcp.papersearch.model.FieldValueJson;
import de.mirkosertic.mcp.papersearch.model.PaperDocument;
import de.mirkosertic.mcp.papersearch.schema.SchemaReport;
import de.mirkosertic.mcp.papersearch.schema.SchemaReporter;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.MultiBits;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.Bits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only, fully materialized view of one persisted paper index.
 * <p>
 * All documents, their id lookup, the column list and the schema/facet report are built
 * once in {@link #open(Path, SchemaReporter)} and never change afterwards, so any number of
 * threads may query a store concurrently. The underlying {@link DirectoryReader} stays open
 * for the full-text prefilter and is reference-counted, which lets {@code PaperCatalog} swap
 * stores while queries are still running on the old one.
 */
public final class PaperStore {

    private static final Logger logger = LoggerFactory.getLogger(PaperStore.class);

    private static final Set<String> LOAD_FIELDS = Set.of(PaperIndexSchema.FIELD_ID, PaperIndexSchema.FIELD_RAW_JSON);

    private final Path indexPath;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final SearchBlobAnalyzer analyzer;
    private final long[] paperIdByDoc;
    private final List<PaperDocument> documents;
    private final Map<Long, PaperDocument> documentsById;
    private final List<String> columns;
    private final SchemaReport schema;
    private final String buildId;
    private final String builtAt;

    private PaperStore(final Path indexPath, final DirectoryReader reader, final long[] paperIdByDoc,
                       final List<PaperDocument> documents, final List<String> columns,
                       final SchemaReport schema, final Map<String, String> commitData) {
        this.indexPath = indexPath;
        this.reader = reader;
        this.searcher = new IndexSearcher(reader);
        this.analyzer = new SearchBlobAnalyzer();
        this.paperIdByDoc = paperIdByDoc;
        this.documents = Collections.unmodifiableList(documents);
        final Map<Long, PaperDocument> byId = new HashMap<>();
        for (final PaperDocument document : documents) {
            byId.put(document.id(), document);
        }
        this.documentsById = Collections.unmodifiableMap(byId);
        this.columns = List.copyOf(columns);
        this.schema = schema;
        this.buildId = commitData.get(PaperIndexSchema.COMMIT_BUILD_ID);
        this.builtAt = commitData.get(PaperIndexSchema.COMMIT_BUILT_AT);
    }

    /**
     * Opens the index read-only and loads every paper into memory, ordered by id.
     *
     * @throws StoreLoadException if there is no readable, compatible index at the path
     */
    public static PaperStore open(final Path indexPath, final SchemaReporter schemaReporter) throws StoreLoadException {
        final long startTime = System.currentTimeMillis();
        if (!Files.isDirectory(indexPath)) {
            throw new StoreLoadException("No paper index found at " + indexPath.toAbsolutePath()
                    + " - build it first with IndexBuilderCommand");
        }

        Directory directory = null;
        DirectoryReader reader = null;
        try {
            directory = FSDirectory.open(indexPath);
            if (!DirectoryReader.indexExists(directory)) {
                throw new StoreLoadException("Directory " + indexPath.toAbsolutePath() + " does not contain a paper index");
            }
            reader = DirectoryReader.open(directory);

            final Map<String, String> commitData = reader.getIndexCommit().getUserData();
            checkSchemaVersion(commitData, indexPath);
            final List<String> columns = readColumns(commitData);

            final long[] paperIdByDoc = new long[reader.maxDoc()];
            Arrays.fill(paperIdByDoc, -1);
            final List<PaperDocument> documents = loadDocuments(reader, paperIdByDoc);
            final SchemaReport schema = schemaReporter.report(documents);

            final PaperStore store = new PaperStore(indexPath, reader, paperIdByDoc, documents, columns, schema, commitData);
            registerCloseListener(reader, directory, store.analyzer);

            logger.info("Loaded {} papers with {} columns from {} in {}ms (build {})",
                    documents.size(), columns.size(), indexPath.toAbsolutePath(),
                    System.currentTimeMillis() - startTime, store.buildId);
            return store;
        } catch (final StoreLoadException e) {
            closeQuietly(reader, directory);
            throw e;
        } catch (final IOException e) {
            closeQuietly(reader, directory);
            throw new StoreLoadException("Failed to read paper index at " + indexPath.toAbsolutePath()
                    + ": " + e.getMessage(), e);
        }
    }

    private static void checkSchemaVersion(final Map<String, String> commitData, final Path indexPath)
            throws StoreLoadException {
        final String version = commitData.get(PaperIndexSchema.COMMIT_SCHEMA_VERSION);
        if (!Integer.toString(PaperIndexSchema.SCHEMA_VERSION).equals(version)) {
            throw new StoreLoadException("Index at " + indexPath.toAbsolutePath() + " has schema version " + version
                    + ", expected " + PaperIndexSchema.SCHEMA_VERSION + " - rebuild the index");
        }
    }

    private static List<String> readColumns(final Map<String, String> commitData) throws StoreLoadException {
        final String json = commitData.get(PaperIndexSchema.COMMIT_COLUMNS);
        if (json == null) {
            throw new StoreLoadException("Index commit carries no column list");
        }
        try {
            return FieldValueJson.mapper().readValue(json, new TypeReference<List<String>>() {
            });
        } catch (final JsonProcessingException e) {
            throw new StoreLoadException("Index commit carries a corrupt column list", e);
        }
    }

    private static List<PaperDocument> loadDocuments(final DirectoryReader reader, final long[] paperIdByDoc)
            throws IOException {
        final StoredFields storedFields = reader.storedFields();
        final Bits liveDocs = MultiBits.getLiveDocs(reader);
        final List<PaperDocument> documents = new ArrayList<>(reader.numDocs());

        for (int doc = 0; doc < reader.maxDoc(); doc++) {
            if (liveDocs != null && !liveDocs.get(doc)) {
                continue;
            }
            final Document stored = storedFields.document(doc, LOAD_FIELDS);
            final IndexableField idField = stored.getField(PaperIndexSchema.FIELD_ID);
            final String rawJson = stored.get(PaperIndexSchema.FIELD_RAW_JSON);
            if (idField == null || idField.numericValue() == null || rawJson == null) {
                throw new StoreLoadException("Index document " + doc + " lacks id or raw_json");
            }
            final long id = idField.numericValue().longValue();
            paperIdByDoc[doc] = id;
            documents.add(toPaperDocument(id, rawJson));
        }

        documents.sort(Comparator.comparingLong(PaperDocument::id));
        return documents;
    }

    /**
     * Deserializes raw_json, injects the id and recomputes the {@code _search} companions.
     */
    static PaperDocument toPaperDocument(final long id, final String rawJson) throws StoreLoadException {
        final Map<String, FieldValue> fields;
        try {
            fields = new LinkedHashMap<>(FieldValueJson.parseObject(rawJson));
        } catch (final JsonProcessingException e) {
            throw new StoreLoadException("Corrupt raw_json for paper " + id, e);
        }
        fields.put(PaperIndexSchema.FIELD_ID, FieldValue.of(id));
        return new PaperDocument(id, SearchProjections.augment(fields));
    }

    private static void registerCloseListener(final DirectoryReader reader, final Directory directory,
                                              final SearchBlobAnalyzer analyzer) {
        final IndexReader.CacheHelper cacheHelper = reader.getReaderCacheHelper();
        if (cacheHelper != null) {
            cacheHelper.addClosedListener(key -> {
                analyzer.close();
                directory.close();
            });
        }
    }

    private static void closeQuietly(final DirectoryReader reader, final Directory directory) {
        try {
            if (reader != null) {
                reader.close();
            }
            if (directory != null) {
                directory.close();
            }
        } catch (final IOException e) {
            logger.warn("Error closing paper index after failed load", e);
        }
    }

    /**
     * Papers whose search_blob matches every query word. A word must match a term starting
     * with it. A word containing underscores matches its parts instead: every part but the
     * last exactly, the last as a prefix. Terms are normalized like indexed terms. Returned
     * documents are in id order.
     */
    public List<PaperDocument> fullTextMatches(final List<String> words) throws IOException {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        int clauses = 0;
        for (final String word : words) {
            final List<String> terms = new ArrayList<>();
            for (final String part : word.split("_")) {
                final String term = analyzer.normalize(PaperIndexSchema.FIELD_SEARCH_BLOB, part).utf8ToString();
                if (!term.isEmpty()) {
                    terms.add(term);
                }
            }
            for (int i = 0; i < terms.size(); i++) {
                final Term term = new Term(PaperIndexSchema.FIELD_SEARCH_BLOB, terms.get(i));
                final Query clause = i == terms.size() - 1 ? new PrefixQuery(term) : new TermQuery(term);
                builder.add(clause, BooleanClause.Occur.MUST);
                clauses++;
            }
        }
        if (clauses == 0) {
            return List.of();
        }

        final TopDocs topDocs = searcher.search(builder.build(), Math.max(1, reader.maxDoc()));
        final long[] ids = new long[topDocs.scoreDocs.length];
        int count = 0;
        for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
            final long id = paperIdByDoc[scoreDoc.doc];
            if (id >= 0) {
                ids[count++] = id;
            }
        }
        Arrays.sort(ids, 0, count);

        final List<PaperDocument> matches = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final PaperDocument document = documentsById.get(ids[i]);
            if (document != null) {
                matches.add(document);
            }
        }
        return matches;
    }

    public List<PaperDocument> documents() {
        return documents;
    }

    public PaperDocument get(final long id) {
        return documentsById.get(id);
    }

    public List<String> columns() {
        return columns;
    }

    public SchemaReport schema() {
        return schema;
    }

    public int size() {
        return documents.size();
    }

    public Path indexPath() {
        return indexPath;
    }

    public String buildId() {
        return buildId;
    }

    public String builtAt() {
        return builtAt;
    }

    // Reference counting, delegated to the reader

    public boolean tryIncRef() {
        return reader.tryIncRef();
    }

    public void decRef() throws IOException {
        reader.decRef();
    }

    public int getRefCount() {
        return reader.getRefCount();
    }
}
