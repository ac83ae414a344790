package de.mirkosertic.mcp.papersearch.mcp.dto;

import org.jspecify.annotations.Nullable;

/**
 * Coercion of loosely typed tool arguments. Invalid values raise {@link IllegalArgumentException},
 * which the tool handlers turn into error results.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static @Nullable Integer optionalInt(final Object value, final String name) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer, got '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'");
    }

    static @Nullable String optionalString(final Object value) {
        if (value == null) {
            return null;
        }
        return String.valueOf(value);
    }
}
