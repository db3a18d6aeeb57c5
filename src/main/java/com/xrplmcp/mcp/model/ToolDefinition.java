package com.xrplmcp.mcp.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tool entry handed to a protocol server for discovery.
 */
public record ToolDefinition(
    String name,
    String category,
    String description,
    @JsonProperty("inputSchema") Map<String, Object> inputSchema
) {
}
