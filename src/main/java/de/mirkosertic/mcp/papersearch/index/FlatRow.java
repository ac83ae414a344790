package de.mirkosertic.mcp.papersearch.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted form of one paper record.
 *
 * @param id      unique paper id
 * @param columns text value per column; a null value means the column is null for this row.
 *                Includes {@code _search} companions but neither id, search_blob nor raw_json.
 * @param searchBlob newline-joined full-text content
 * @param rawJson  the source record serialized verbatim
 */
public record FlatRow(long id, Map<String, String> columns, String searchBlob, String rawJson) {

    public FlatRow {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }
}
