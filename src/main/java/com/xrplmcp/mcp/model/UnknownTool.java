package com.xrplmcp.mcp.model;

public record UnknownTool(String toolName) implements Diagnostic {

    @Override
    public String message() {
        return "Unknown tool: " + toolName;
    }
}
