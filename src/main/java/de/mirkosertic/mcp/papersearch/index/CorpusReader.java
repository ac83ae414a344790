package de.mirkosertic.mcp.papersearch.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.papersearch.model.FieldValueJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the corpus file: a single JSON object whose {@code results} member is the list of paper records.
 */
public class CorpusReader {

    private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);

    private static final String RESULTS = "results";

    public List<ObjectNode> read(final Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new CorpusFormatException("Corpus file not found: " + path.toAbsolutePath());
        }
        try (final InputStream is = Files.newInputStream(path)) {
            final List<ObjectNode> records = read(is);
            logger.info("Loaded {} paper entries from {}", records.size(), path.toAbsolutePath());
            return records;
        }
    }

    public List<ObjectNode> read(final InputStream is) throws IOException {
        final JsonNode payload;
        try {
            payload = FieldValueJson.mapper().readTree(is);
        } catch (final JsonProcessingException e) {
            throw new CorpusFormatException("Corpus is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (payload == null || !payload.isObject() || !payload.has(RESULTS)) {
            throw new CorpusFormatException("Unexpected JSON structure: expected top-level 'results' list");
        }
        final JsonNode results = payload.get(RESULTS);
        if (!results.isArray()) {
            throw new CorpusFormatException("'results' must be a list");
        }

        final List<ObjectNode> records = new ArrayList<>(results.size());
        int position = 0;
        for (final JsonNode item : results) {
            if (!item.isObject()) {
                throw new CorpusFormatException("Record #" + position + " is not a JSON object");
            }
            records.add((ObjectNode) item);
            position++;
        }
        return records;
    }
}
