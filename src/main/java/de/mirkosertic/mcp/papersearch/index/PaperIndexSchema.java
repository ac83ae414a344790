package de.mirkosertic.mcp.papersearch.index;

import java.util.List;

/**
 * Field names and commit metadata keys of the persisted paper index.
 */
public final class PaperIndexSchema {

    /**
     * Schema version for the index.
     * MUST be incremented whenever the index layout changes (fields added/removed/modified, analyzers changed, etc.).
     * Version 1: Initial layout with stored columns, search_blob, raw_json and equality-indexed facet columns.
     */
    public static final int SCHEMA_VERSION = 2;

    public static final String FIELD_ID = "id";
    public static final String FIELD_SEARCH_BLOB = "search_blob";
    public static final String FIELD_RAW_JSON = "raw_json";

    public static final String SEARCH_SUFFIX = "_search";
    public static final String LIST_SEPARATOR = " | ";

    /**
     * Columns that additionally get an unanalyzed {@code StringField} for exact lookups.
     */
    public static final List<String> EQUALITY_INDEXED_FIELDS = List.of(
            "decision", "event_type", "session", "topic", "visible");

    // Commit user data keys
    public static final String COMMIT_COLUMNS = "columns";
    public static final String COMMIT_SCHEMA_VERSION = "schema_version";
    public static final String COMMIT_DOCUMENT_COUNT = "document_count";
    public static final String COMMIT_BUILD_ID = "build_id";
    public static final String COMMIT_BUILT_AT = "built_at";

    private PaperIndexSchema() {
    }

    public static String searchFieldOf(final String field) {
        return field + SEARCH_SUFFIX;
    }
}
