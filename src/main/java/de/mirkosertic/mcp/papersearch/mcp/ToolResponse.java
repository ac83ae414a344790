package de.mirkosertic.mcp.papersearch.mcp;

/**
 * Common shape of all tool response DTOs.
 */
public interface ToolResponse {

    boolean success();

    String error();
}
