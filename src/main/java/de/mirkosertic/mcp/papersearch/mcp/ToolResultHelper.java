package de.mirkosertic.mcp.papersearch.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Wraps response DTOs into MCP tool results. The DTO is serialized to JSON and returned as text content.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    // Null DTO properties are left out, null fields inside paper maps are kept
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setDefaultPropertyInclusion(JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.ALWAYS))
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final ToolResponse response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!response.success())
                .build();
    }

    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(errorJson(errorMessage))))
                .isError(true)
                .build();
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            logger.error("Failed to serialize tool response", e);
            return errorJson("JSON serialization error: " + e.getOriginalMessage());
        }
    }

    private static String errorJson(final String errorMessage) {
        final ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("success", false);
        node.put("error", errorMessage);
        return node.toString();
    }
}
