package de.mirkosertic.mcp.papersearch.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.papersearch.model.FieldValue;
import de.mirkosertic.mcp.papersearch.model.FieldValueJson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Flattens one raw paper record into a {@link FlatRow}.
 * <ul>
 *   <li>Scalars are stored as text and contribute one full-text fragment.</li>
 *   <li>Lists are stored as JSON, with a {@code _search} column joining the items by {@code " | "}.</li>
 *   <li>Objects are stored as JSON, with the same JSON as {@code _search} column and fragment.</li>
 *   <li>Nulls stay null and get no {@code _search} column.</li>
 * </ul>
 */
public class RecordNormalizer {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    public FlatRow normalize(final ObjectNode record, final int position) throws CorpusFormatException {
        final long id = parseId(record.get(PaperIndexSchema.FIELD_ID), position);

        final Map<String, String> columns = new LinkedHashMap<>();
        final List<String> fragments = new ArrayList<>();

        for (final Map.Entry<String, JsonNode> entry : record.properties()) {
            final String key = entry.getKey();
            if (PaperIndexSchema.FIELD_ID.equals(key)) {
                continue;
            }
            if (PaperIndexSchema.FIELD_SEARCH_BLOB.equals(key) || PaperIndexSchema.FIELD_RAW_JSON.equals(key)) {
                throw new CorpusFormatException("Record #" + position + " (id " + id
                        + ") uses reserved field name '" + key + "'");
            }

            final FieldValue value = FieldValueJson.fromJson(entry.getValue());
            if (value.isNull()) {
                columns.put(key, null);
                continue;
            }

            final String projection = SearchProjections.projectionOf(value);
            if (projection != null) {
                columns.put(key, value.asText());
                columns.put(PaperIndexSchema.searchFieldOf(key), projection);
                fragments.add(projection);
            } else {
                final String text = value.asText();
                columns.put(key, text);
                fragments.add(text);
            }
        }

        final String searchBlob = String.join("\n", fragments.stream()
                .filter(fragment -> !fragment.isEmpty())
                .toList());

        return new FlatRow(id, columns, searchBlob, FieldValueJson.write(record));
    }

    /**
     * Accepts integral non-negative numbers and strings of decimal digits.
     */
    static long parseId(final JsonNode idNode, final int position) throws CorpusFormatException {
        if (idNode == null || idNode.isNull()) {
            throw new CorpusFormatException("Record #" + position + " has no 'id'");
        }
        if (idNode.isIntegralNumber() && idNode.canConvertToLong()) {
            final long id = idNode.longValue();
            if (id >= 0) {
                return id;
            }
        } else if (idNode.isFloatingPointNumber()) {
            final double value = idNode.doubleValue();
            if (value >= 0 && value <= Long.MAX_VALUE && value == Math.rint(value)) {
                return (long) value;
            }
        } else if (idNode.isTextual()) {
            final String text = idNode.textValue().trim();
            if (DIGITS.matcher(text).matches()) {
                try {
                    return Long.parseLong(text);
                } catch (final NumberFormatException e) {
                    throw new CorpusFormatException("Record #" + position + " has an out-of-range id: " + text, e);
                }
            }
        }
        throw new CorpusFormatException("Record #" + position + " has an invalid id: " + idNode);
    }
}
