package com.xrplmcp.mcp.model;

public record ToolSummary(String name, String description) {
}
