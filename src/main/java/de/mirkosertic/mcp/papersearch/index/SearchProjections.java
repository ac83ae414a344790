package de.mirkosertic.mcp.papersearch.index;

import de.mirkosertic.mcp.papersearch.model.FieldValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the human-readable {@code _search} companions of container-valued fields.
 * <p>
 * The same projection is used when building the index and when re-augmenting records
 * at load time, so filters see identical field names and values in both places.
 */
public final class SearchProjections {

    private SearchProjections() {
    }

    /**
     * Returns the projection of a list or object value, or null for scalars and nulls.
     * Lists join their non-null, non-empty items with {@link PaperIndexSchema#LIST_SEPARATOR};
     * objects render as JSON.
     */
    public static String projectionOf(final FieldValue value) {
        if (value instanceof FieldValue.Array array) {
            final List<String> parts = new ArrayList<>(array.items().size());
            for (final FieldValue item : array.items()) {
                if (item.isNull()) {
                    continue;
                }
                final String text = item.asText();
                if (!text.isEmpty()) {
                    parts.add(text);
                }
            }
            return String.join(PaperIndexSchema.LIST_SEPARATOR, parts);
        }
        if (value instanceof FieldValue.Obj) {
            return value.asText();
        }
        return null;
    }

    /**
     * Returns a copy of the record with a {@code <field>_search} entry added for every
     * list or object field. Applying it twice yields the same map.
     */
    public static Map<String, FieldValue> augment(final Map<String, FieldValue> fields) {
        final Map<String, FieldValue> augmented = new LinkedHashMap<>(fields);
        for (final Map.Entry<String, FieldValue> entry : fields.entrySet()) {
            final String projection = projectionOf(entry.getValue());
            if (projection != null) {
                augmented.put(PaperIndexSchema.searchFieldOf(entry.getKey()), FieldValue.of(projection));
            }
        }
        return augmented;
    }
}
