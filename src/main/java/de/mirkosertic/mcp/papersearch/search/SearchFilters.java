package de.mirkosertic.mcp.papersearch.search;

import de.mirkosertic.mcp.papersearch.index.PaperIndexSchema;
import de.mirkosertic.mcp.papersearch.model.FieldValue;
import de.mirkosertic.mcp.papersearch.model.PaperDocument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Normalized structured filters: field name to the values of which at least one must match.
 * Fields are combined with AND, values of one field with OR.
 */
public final class SearchFilters {

    private static final SearchFilters NONE = new SearchFilters(Map.of());

    private final Map<String, List<String>> valuesByField;

    private SearchFilters(final Map<String, List<String>> valuesByField) {
        this.valuesByField = valuesByField;
    }

    public static SearchFilters none() {
        return NONE;
    }

    /**
     * Normalizes raw filter input. Null values are dropped, single values become one-element
     * lists, values are trimmed and empty strings discarded. A field left without values is
     * removed entirely.
     */
    public static SearchFilters of(final Map<String, ?> rawFilters) {
        if (rawFilters == null || rawFilters.isEmpty()) {
            return NONE;
        }
        final Map<String, List<String>> normalized = new LinkedHashMap<>();
        for (final Map.Entry<String, ?> entry : rawFilters.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            final List<String> values = new ArrayList<>();
            if (entry.getValue() instanceof Collection<?> collection) {
                for (final Object item : collection) {
                    addValue(values, item);
                }
            } else {
                addValue(values, entry.getValue());
            }
            if (!values.isEmpty()) {
                normalized.put(entry.getKey(), Collections.unmodifiableList(values));
            }
        }
        return normalized.isEmpty() ? NONE : new SearchFilters(Collections.unmodifiableMap(normalized));
    }

    private static void addValue(final List<String> values, final Object value) {
        if (value == null) {
            return;
        }
        final String text = String.valueOf(value).trim();
        if (!text.isEmpty()) {
            values.add(text.toLowerCase(Locale.ROOT));
        }
    }

    public boolean isEmpty() {
        return valuesByField.isEmpty();
    }

    /**
     * Lowercased filter values per field.
     */
    public Map<String, List<String>> values() {
        return valuesByField;
    }

    public boolean matches(final PaperDocument document) {
        for (final Map.Entry<String, List<String>> filter : valuesByField.entrySet()) {
            if (!fieldMatches(document, filter.getKey(), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean fieldMatches(final PaperDocument document, final String field, final List<String> wanted) {
        FieldValue value = document.get(field);
        if (value.isNull()) {
            value = document.get(PaperIndexSchema.searchFieldOf(field));
        }
        if (value.isNull()) {
            return false;
        }
        for (final String token : tokensOf(value)) {
            final String lowered = token.toLowerCase(Locale.ROOT);
            for (final String candidate : wanted) {
                if (lowered.contains(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }

    static List<String> tokensOf(final FieldValue value) {
        if (value instanceof FieldValue.Array array) {
            final List<String> tokens = new ArrayList<>(array.items().size());
            for (final FieldValue item : array.items()) {
                tokens.add(item.asText());
            }
            return tokens;
        }
        return List.of(value.asText());
    }

    @Override
    public String toString() {
        return valuesByField.toString();
    }
}
