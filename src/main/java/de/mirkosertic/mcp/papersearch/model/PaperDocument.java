package de.mirkosertic.mcp.papersearch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory form of one paper: the deserialized source record with its id injected and
 * its {@code _search} companion fields recomputed. Immutable once loaded.
 */
public record PaperDocument(long id, Map<String, FieldValue> fields) {

    public PaperDocument {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Returns the value of the field, or {@link FieldValue#NULL} when absent.
     */
    public FieldValue get(final String field) {
        final FieldValue value = fields.get(field);
        return value != null ? value : FieldValue.NULL;
    }

    public Map<String, Object> toPlainMap() {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (final Map.Entry<String, FieldValue> entry : fields.entrySet()) {
            result.put(entry.getKey(), entry.getValue().toPlain());
        }
        return result;
    }
}
