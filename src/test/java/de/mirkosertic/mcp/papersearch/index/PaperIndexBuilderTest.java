package de.mirkosertic.mcp.papersearch.index;

import de.mirkosertic.mcp.papersearch.PaperFixtures;
import de.mirkosertic.mcp.papersearch.store.PaperStore;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static de.mirkosertic.mcp.papersearch.PaperFixtures.records;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PaperIndexBuilder Tests")
class PaperIndexBuilderTest {

    @TempDir
    Path tempDir;

    private final PaperIndexBuilder builder = new PaperIndexBuilder(new RecordNormalizer());

    private Map<String, String> commitData(final Path indexDir) throws IOException {
        try (final FSDirectory directory = FSDirectory.open(indexDir);
             final DirectoryReader reader = DirectoryReader.open(directory)) {
            return reader.getIndexCommit().getUserData();
        }
    }

    @Nested
    @DisplayName("Successful build")
    class SuccessfulBuild {

        @Test
        @DisplayName("Should write one document per record with commit metadata")
        void shouldWriteDocumentsAndMetadata() throws IOException {
            final Path indexDir = tempDir.resolve("index");

            final PaperIndexBuilder.BuildSummary summary = builder.build(PaperFixtures.sampleRecords(), indexDir);

            assertThat(summary.documentCount()).isEqualTo(6);
            assertThat(summary.indexPath()).isEqualTo(indexDir.toAbsolutePath());
            assertThat(summary.columns().get(0)).isEqualTo("id");
            assertThat(summary.columns())
                    .contains("name", "authors", "authors_search", "media_search", "search_blob", "raw_json")
                    .doesNotHaveDuplicates();

            final Map<String, String> userData = commitData(indexDir);
            assertThat(userData)
                    .containsEntry(PaperIndexSchema.COMMIT_DOCUMENT_COUNT, "6")
                    .containsEntry(PaperIndexSchema.COMMIT_SCHEMA_VERSION, String.valueOf(PaperIndexSchema.SCHEMA_VERSION))
                    .containsEntry(PaperIndexSchema.COMMIT_BUILD_ID, summary.buildId())
                    .containsKey(PaperIndexSchema.COMMIT_BUILT_AT);
            assertThat(userData.get(PaperIndexSchema.COMMIT_COLUMNS)).startsWith("[\"id\",");
        }

        @Test
        @DisplayName("Should index facet columns for exact lookups")
        void shouldIndexEqualityColumns() throws IOException {
            final Path indexDir = tempDir.resolve("index");
            builder.build(PaperFixtures.sampleRecords(), indexDir);

            try (final FSDirectory directory = FSDirectory.open(indexDir);
                 final DirectoryReader reader = DirectoryReader.open(directory)) {
                final IndexSearcher searcher = new IndexSearcher(reader);
                assertThat(searcher.count(new TermQuery(new Term("decision", "Reject")))).isEqualTo(1);
                assertThat(searcher.count(new TermQuery(new Term("visible", "false")))).isEqualTo(1);
                assertThat(searcher.count(new TermQuery(new Term("search_blob", "muller")))).isEqualTo(1);
            }
        }

        @Test
        @DisplayName("Should omit null columns from the stored document")
        void shouldOmitNullColumns() throws IOException {
            final FlatRow row = new RecordNormalizer().normalize(PaperFixtures.record("""
                    {"id": 1, "name": "A", "url": null}
                    """), 0);

            final Document document = builder.createDocument(row);

            assertThat(document.get("name")).isEqualTo("A");
            assertThat(document.getField("url")).isNull();
            assertThat(document.get("raw_json")).contains("\"url\":null");
        }

        @Test
        @DisplayName("Should replace an existing index and leave no staging directories")
        void shouldReplaceExistingIndex() throws IOException {
            final Path indexDir = tempDir.resolve("index");
            final PaperIndexBuilder.BuildSummary first = builder.build(records("{\"id\": 1}", "{\"id\": 2}"), indexDir);
            final PaperIndexBuilder.BuildSummary second = builder.build(records("{\"id\": 3}"), indexDir);

            assertThat(second.buildId()).isNotEqualTo(first.buildId());
            assertThat(commitData(indexDir)).containsEntry(PaperIndexSchema.COMMIT_DOCUMENT_COUNT, "1");
            try (final Stream<Path> children = Files.list(tempDir)) {
                assertThat(children.map(p -> p.getFileName().toString()).toList()).containsExactly("index");
            }
        }

        @Test
        @DisplayName("Should build an empty corpus")
        void shouldBuildEmptyCorpus() throws IOException {
            final PaperIndexBuilder.BuildSummary summary = builder.build(List.of(), tempDir.resolve("index"));

            assertThat(summary.documentCount()).isZero();
            assertThat(summary.columns()).containsExactly("id", "raw_json", "search_blob");
        }
    }

    @Nested
    @DisplayName("Failed build")
    class FailedBuild {

        @Test
        @DisplayName("Should reject duplicate ids")
        void shouldRejectDuplicateIds() {
            assertThatThrownBy(() -> builder.build(records("{\"id\": 1}", "{\"id\": \"1\"}"), tempDir.resolve("index")))
                    .isInstanceOf(CorpusFormatException.class)
                    .hasMessageContaining("Duplicate id 1");
        }

        @Test
        @DisplayName("Should restore the previous index when the new one cannot be moved into place")
        void shouldRestorePreviousIndexWhenSwapFails() throws IOException {
            final Path indexDir = tempDir.resolve("index");
            final PaperIndexBuilder.BuildSummary previous = builder.build(records("{\"id\": 1}", "{\"id\": 2}"), indexDir);

            final PaperIndexBuilder failingSwap = new PaperIndexBuilder(new RecordNormalizer()) {
                @Override
                void moveIntoPlace(final Path source, final Path destination) throws IOException {
                    if (source.getFileName().toString().contains(".staging-")) {
                        throw new IOException("Simulated disk failure");
                    }
                    super.moveIntoPlace(source, destination);
                }
            };

            assertThatThrownBy(() -> failingSwap.build(records("{\"id\": 3}"), indexDir))
                    .isInstanceOf(IOException.class)
                    .hasMessage("Simulated disk failure");

            assertThat(commitData(indexDir))
                    .containsEntry(PaperIndexSchema.COMMIT_BUILD_ID, previous.buildId())
                    .containsEntry(PaperIndexSchema.COMMIT_DOCUMENT_COUNT, "2");
            final PaperStore store = PaperFixtures.openStore(indexDir);
            try {
                assertThat(store.size()).isEqualTo(2);
            } finally {
                store.decRef();
            }
            try (final Stream<Path> children = Files.list(tempDir)) {
                assertThat(children.map(p -> p.getFileName().toString()).toList()).containsExactly("index");
            }
        }

        @Test
        @DisplayName("Should leave the previous index untouched")
        void shouldKeepPreviousIndex() throws IOException {
            final Path indexDir = tempDir.resolve("index");
            final PaperIndexBuilder.BuildSummary previous = builder.build(records("{\"id\": 1}"), indexDir);

            assertThatThrownBy(() -> builder.build(records("{\"id\": 2}", "{\"name\": \"no id\"}"), indexDir))
                    .isInstanceOf(CorpusFormatException.class);

            assertThat(commitData(indexDir)).containsEntry(PaperIndexSchema.COMMIT_BUILD_ID, previous.buildId());
            try (final Stream<Path> children = Files.list(tempDir)) {
                assertThat(children).hasSize(1);
            }
        }
    }
}
