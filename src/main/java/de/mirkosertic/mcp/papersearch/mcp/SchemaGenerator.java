package de.mirkosertic.mcp.papersearch.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the JSON input schema of a tool from its request record.
 * Components annotated with {@link Nullable} are optional, all others are required.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> requestClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : requestClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * jspecify's {@link Nullable} is a type-use annotation, so it sits on the component's type.
     */
    static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    /**
     * Schema for tools without arguments.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        final Type type = component.getGenericType();
        if (type instanceof Class<?> clazz) {
            schema.put("type", jsonType(clazz));
        } else if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && Collection.class.isAssignableFrom(raw)) {
            schema.put("type", "array");
            final Type itemType = parameterized.getActualTypeArguments()[0];
            schema.put("items", Map.of("type", itemType instanceof Class<?> itemClass ? jsonType(itemClass) : "object"));
        } else {
            // Maps and anything else generic are free-form objects
            schema.put("type", "object");
            schema.put("additionalProperties", true);
        }

        if (description != null && description.allowedValues().length > 0) {
            schema.put("enum", List.of(description.allowedValues()));
        }
        return schema;
    }

    private static String jsonType(final Class<?> clazz) {
        if (clazz == String.class) {
            return "string";
        }
        if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            return "integer";
        }
        if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            return "number";
        }
        if (clazz == Boolean.class || clazz == boolean.class) {
            return "boolean";
        }
        return "object";
    }
}
