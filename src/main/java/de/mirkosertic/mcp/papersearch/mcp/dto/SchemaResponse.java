package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.mcp.ToolResponse;
import de.mirkosertic.mcp.papersearch.schema.SchemaReport;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the getSchema tool.
 */
public record SchemaResponse(
        boolean success,
        List<SchemaReport.FieldDescriptor> fields,
        Map<String, List<String>> facets,
        String error
) implements ToolResponse {

    public static SchemaResponse success(final SchemaReport report) {
        return new SchemaResponse(true, report.fields(), report.facets(), null);
    }

    public static SchemaResponse error(final String errorMessage) {
        return new SchemaResponse(false, null, null, errorMessage);
    }
}
