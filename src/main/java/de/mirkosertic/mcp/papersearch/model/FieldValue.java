package de.mirkosertic.mcp.papersearch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single JSON-typed field value of a paper record.
 * <p>
 * Records in the corpus are schema-less: any field may carry any JSON type, and the
 * same field may carry different types in different records. Each variant of this
 * interface corresponds to one JSON type.
 */
public sealed interface FieldValue
        permits FieldValue.Null, FieldValue.Bool, FieldValue.Int, FieldValue.Float,
        FieldValue.Str, FieldValue.Array, FieldValue.Obj {

    Null NULL = new Null();

    static FieldValue of(final boolean value) {
        return new Bool(value);
    }

    static FieldValue of(final long value) {
        return new Int(value);
    }

    static FieldValue of(final double value) {
        return new Float(value);
    }

    static FieldValue of(final String value) {
        return value == null ? NULL : new Str(value);
    }

    static FieldValue array(final FieldValue... items) {
        return new Array(List.of(items));
    }

    default boolean isNull() {
        return this instanceof Null;
    }

    /**
     * Plain string form used for sorting, filter matching and full-text fragments.
     * Containers render as compact JSON.
     */
    String asText();

    /**
     * Converts to plain Java objects (null, Boolean, Long, Double, String, List, Map)
     * for serialization in tool responses.
     */
    Object toPlain();

    record Null() implements FieldValue {
        @Override
        public String asText() {
            return "";
        }

        @Override
        public Object toPlain() {
            return null;
        }
    }

    record Bool(boolean value) implements FieldValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Int(long value) implements FieldValue {
        @Override
        public String asText() {
            return Long.toString(value);
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Float(double value) implements FieldValue {
        @Override
        public String asText() {
            return Double.toString(value);
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Str(String value) implements FieldValue {
        @Override
        public String asText() {
            return value;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Array(List<FieldValue> items) implements FieldValue {

        public Array {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public String asText() {
            return FieldValueJson.write(this);
        }

        @Override
        public Object toPlain() {
            final List<Object> result = new ArrayList<>(items.size());
            for (final FieldValue item : items) {
                result.add(item.toPlain());
            }
            return result;
        }
    }

    record Obj(Map<String, FieldValue> fields) implements FieldValue {

        public Obj {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public String asText() {
            return FieldValueJson.write(this);
        }

        @Override
        public Object toPlain() {
            final Map<String, Object> result = new LinkedHashMap<>();
            for (final Map.Entry<String, FieldValue> entry : fields.entrySet()) {
                result.put(entry.getKey(), entry.getValue().toPlain());
            }
            return result;
        }
    }
}
