package de.mirkosertic.mcp.papersearch.mcp;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes a tool argument. Read by {@link SchemaGenerator} when building the tool's input schema.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Description {

    String value();

    /**
     * Allowed values of a string argument, published as the schema's {@code enum}. Empty means unrestricted.
     */
    String[] allowedValues() default {};
}
