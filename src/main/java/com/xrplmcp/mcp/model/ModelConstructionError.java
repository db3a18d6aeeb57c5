package com.xrplmcp.mcp.model;

/**
 * The model rejected the input. {@code message} is the model's own error text, unchanged.
 */
public record ModelConstructionError(String tool, String message, SchemaReport schema) implements Diagnostic {

    @Override
    public String toDisplayText() {
        return "Failed to create " + schema.model() + " via " + tool + ": " + message + "\n\n" + schema.toDisplayText();
    }
}
