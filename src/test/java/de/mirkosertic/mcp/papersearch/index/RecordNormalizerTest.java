package de.mirkosertic.mcp.papersearch.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static de.mirkosertic.mcp.papersearch.PaperFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RecordNormalizer Tests")
class RecordNormalizerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer();

    @Nested
    @DisplayName("Columns")
    class Columns {

        @Test
        @DisplayName("Should store scalars as text and skip the id column")
        void shouldStoreScalarsAsText() throws IOException {
            final FlatRow row = normalizer.normalize(record("""
                    {"id": 7, "name": "Deep Nets", "year": 2024, "score": 4.5, "visible": true}
                    """), 0);

            assertThat(row.id()).isEqualTo(7L);
            assertThat(row.columns())
                    .doesNotContainKey("id")
                    .containsEntry("name", "Deep Nets")
                    .containsEntry("year", "2024")
                    .containsEntry("score", "4.5")
                    .containsEntry("visible", "true");
        }

        @Test
        @DisplayName("Should add a _search column joining list items")
        void shouldProjectLists() throws IOException {
            final FlatRow row = normalizer.normalize(record("""
                    {"id": 1, "tags": ["NLP", null, "", "Vision"]}
                    """), 0);

            assertThat(row.columns().get("tags")).isEqualTo("[\"NLP\",null,\"\",\"Vision\"]");
            assertThat(row.columns()).containsEntry("tags_search", "NLP | Vision");
        }

        @Test
        @DisplayName("Should render objects as JSON in the column and the _search column")
        void shouldProjectObjects() throws IOException {
            final FlatRow row = normalizer.normalize(record("""
                    {"id": 1, "media": {"poster": "p.png"}}
                    """), 0);

            assertThat(row.columns())
                    .containsEntry("media", "{\"poster\":\"p.png\"}")
                    .containsEntry("media_search", "{\"poster\":\"p.png\"}");
        }

        @Test
        @DisplayName("Should keep null fields as null columns without _search companion")
        void shouldKeepNulls() throws IOException {
            final FlatRow row = normalizer.normalize(record("""
                    {"id": 1, "url": null}
                    """), 0);

            assertThat(row.columns()).containsKey("url").doesNotContainKey("url_search");
            assertThat(row.columns().get("url")).isNull();
        }
    }

    @Nested
    @DisplayName("Search blob")
    class SearchBlob {

        @Test
        @DisplayName("Should join non-empty fragments with newlines in field order")
        void shouldJoinFragments() throws IOException {
            final FlatRow row = normalizer.normalize(record("""
                    {"id": 3, "name": "Graph Nets", "abstract": "", "authors": ["Ann", "Ben"], "url": null, "year": 2023}
                    """), 0);

            assertThat(row.searchBlob()).isEqualTo("Graph Nets\nAnn | Ben\n2023");
        }

        @Test
        @DisplayName("Should keep the original record as raw JSON")
        void shouldKeepRawJson() throws IOException {
            final ObjectNode source = record("""
                    {"id": "12", "name": "X", "tags": ["a"]}
                    """);

            final FlatRow row = normalizer.normalize(source, 0);

            assertThat(row.rawJson()).isEqualTo("{\"id\":\"12\",\"name\":\"X\",\"tags\":[\"a\"]}");
            assertThat(row.id()).isEqualTo(12L);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject a record without id")
        void shouldRejectMissingId() {
            assertThatThrownBy(() -> normalizer.normalize(record("{\"name\": \"x\"}"), 4))
                    .isInstanceOf(CorpusFormatException.class)
                    .hasMessageContaining("#4")
                    .hasMessageContaining("no 'id'");
        }

        @ParameterizedTest
        @ValueSource(strings = {"-1", "1.5", "true", "\"abc\"", "\"12a\"", "[1]"})
        @DisplayName("Should reject ids that are not non-negative integers")
        void shouldRejectInvalidIds(final String id) {
            assertThatThrownBy(() -> normalizer.normalize(record("{\"id\": " + id + "}"), 0))
                    .isInstanceOf(CorpusFormatException.class)
                    .hasMessageContaining("invalid id");
        }

        @Test
        @DisplayName("Should reject reserved field names")
        void shouldRejectReservedFields() {
            assertThatThrownBy(() -> normalizer.normalize(record("{\"id\": 1, \"search_blob\": \"x\"}"), 0))
                    .isInstanceOf(CorpusFormatException.class)
                    .hasMessageContaining("reserved");
        }

        @Test
        @DisplayName("Should accept integral floating point and digit string ids")
        void shouldAcceptConvertibleIds() throws IOException {
            assertThat(normalizer.normalize(record("{\"id\": 42.0}"), 0).id()).isEqualTo(42L);
            assertThat(normalizer.normalize(record("{\"id\": \" 0042 \"}"), 0).id()).isEqualTo(42L);
        }
    }
}
