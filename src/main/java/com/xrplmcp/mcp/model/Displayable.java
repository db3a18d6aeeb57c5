package com.xrplmcp.mcp.model;

/**
 * Results that can render themselves as human-readable text, distinct from their JSON form.
 */
public interface Displayable {
    String toDisplayText();
}
