package de.mirkosertic.mcp.papersearch.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between Jackson trees, JSON text and {@link FieldValue}.
 */
public final class FieldValueJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private FieldValueJson() {
    }

    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }

    public static FieldValue fromJson(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldValue.NULL;
        }
        if (node.isBoolean()) {
            return FieldValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            if (node.canConvertToLong()) {
                return FieldValue.of(node.longValue());
            }
            return FieldValue.of(node.doubleValue());
        }
        if (node.isNumber()) {
            return FieldValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return FieldValue.of(node.textValue());
        }
        if (node.isArray()) {
            final List<FieldValue> items = new ArrayList<>(node.size());
            for (final JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new FieldValue.Array(items);
        }
        if (node.isObject()) {
            return new FieldValue.Obj(fieldsOf((ObjectNode) node));
        }
        return FieldValue.of(node.asText());
    }

    /**
     * Converts the members of a JSON object into an insertion-ordered field map.
     */
    public static Map<String, FieldValue> fieldsOf(final ObjectNode node) {
        final Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (final Map.Entry<String, JsonNode> entry : node.properties()) {
            fields.put(entry.getKey(), fromJson(entry.getValue()));
        }
        return fields;
    }

    public static JsonNode toJson(final FieldValue value) {
        final JsonNodeFactory factory = JsonNodeFactory.instance;
        if (value instanceof FieldValue.Bool b) {
            return factory.booleanNode(b.value());
        }
        if (value instanceof FieldValue.Int i) {
            return factory.numberNode(i.value());
        }
        if (value instanceof FieldValue.Float f) {
            return factory.numberNode(f.value());
        }
        if (value instanceof FieldValue.Str s) {
            return factory.textNode(s.value());
        }
        if (value instanceof FieldValue.Array array) {
            final ArrayNode node = factory.arrayNode();
            for (final FieldValue item : array.items()) {
                node.add(toJson(item));
            }
            return node;
        }
        if (value instanceof FieldValue.Obj obj) {
            final ObjectNode node = factory.objectNode();
            for (final Map.Entry<String, FieldValue> entry : obj.fields().entrySet()) {
                node.set(entry.getKey(), toJson(entry.getValue()));
            }
            return node;
        }
        return factory.nullNode();
    }

    public static String write(final FieldValue value) {
        return write(toJson(value));
    }

    public static String write(final JsonNode node) {
        try {
            return OBJECT_MAPPER.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            // Trees built from FieldValues or parsed JSON always serialize
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses a JSON object text into an insertion-ordered field map.
     *
     * @throws JsonProcessingException if the text is not valid JSON or not an object
     */
    public static Map<String, FieldValue> parseObject(final String json) throws JsonProcessingException {
        final JsonNode node = OBJECT_MAPPER.readTree(json);
        if (node == null || !node.isObject()) {
            throw new JsonMappingException(null, "Expected a JSON object");
        }
        return fieldsOf((ObjectNode) node);
    }
}
