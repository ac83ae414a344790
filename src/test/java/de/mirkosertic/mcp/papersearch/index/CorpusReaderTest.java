package de.mirkosertic.mcp.papersearch.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorpusReader Tests")
class CorpusReaderTest {

    @TempDir
    Path tempDir;

    private final CorpusReader reader = new CorpusReader();

    private static InputStream json(final String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should read the records of the results list")
    void shouldReadResults() throws IOException {
        final List<ObjectNode> records = reader.read(json("""
                {"count": 2, "results": [{"id": 1, "name": "a"}, {"id": 2}]}
                """));

        assertThat(records).hasSize(2);
        assertThat(records.get(0).get("name").asText()).isEqualTo("a");
    }

    @Test
    @DisplayName("Should read a corpus file from disk")
    void shouldReadFile() throws IOException {
        final Path file = tempDir.resolve("corpus.json");
        Files.writeString(file, "{\"results\": []}");

        assertThat(reader.read(file)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a top level without results")
    void shouldRejectMissingResults() {
        assertThatThrownBy(() -> reader.read(json("{\"papers\": []}")))
                .isInstanceOf(CorpusFormatException.class)
                .hasMessageContaining("results");
    }

    @Test
    @DisplayName("Should reject a top-level list")
    void shouldRejectTopLevelList() {
        assertThatThrownBy(() -> reader.read(json("[{\"id\": 1}]")))
                .isInstanceOf(CorpusFormatException.class);
    }

    @Test
    @DisplayName("Should reject results that are not a list of objects")
    void shouldRejectNonObjectRecords() {
        assertThatThrownBy(() -> reader.read(json("{\"results\": {\"id\": 1}}")))
                .isInstanceOf(CorpusFormatException.class)
                .hasMessageContaining("must be a list");
        assertThatThrownBy(() -> reader.read(json("{\"results\": [{\"id\": 1}, 2]}")))
                .isInstanceOf(CorpusFormatException.class)
                .hasMessageContaining("#1");
    }

    @Test
    @DisplayName("Should reject invalid JSON and missing files")
    void shouldRejectBrokenInput() {
        assertThatThrownBy(() -> reader.read(json("{\"results\": [")))
                .isInstanceOf(CorpusFormatException.class)
                .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.json")))
                .isInstanceOf(CorpusFormatException.class)
                .hasMessageContaining("not found");
    }
}
