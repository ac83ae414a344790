package de.mirkosertic.mcp.papersearch.schema;

import de.mirkosertic.mcp.papersearch.model.FieldValue;

/**
 * Type tag reported for a field in the schema. {@link #MIXED} marks fields observed with
 * more than one type across the corpus.
 */
public enum FieldType {
    BOOLEAN("boolean"),
    INTEGER("integer"),
    FLOAT("float"),
    OBJECT("object"),
    ARRAY("array"),
    STRING("string"),
    MIXED("mixed");

    private final String tag;

    FieldType(final String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Classifies a non-null value by its runtime shape.
     */
    public static FieldType of(final FieldValue value) {
        if (value instanceof FieldValue.Bool) {
            return BOOLEAN;
        }
        if (value instanceof FieldValue.Int) {
            return INTEGER;
        }
        if (value instanceof FieldValue.Float) {
            return FLOAT;
        }
        if (value instanceof FieldValue.Obj) {
            return OBJECT;
        }
        if (value instanceof FieldValue.Array) {
            return ARRAY;
        }
        return STRING;
    }
}
