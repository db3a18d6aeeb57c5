package com.xrplmcp.mcp.model;

import java.util.List;

/**
 * Per-field entry of a {@link SchemaReport}. {@code enumValues} and {@code defaultValue} are
 * null when not applicable.
 */
public record FieldReport(
    String type,
    boolean required,
    List<String> enumValues,
    String defaultValue,
    String description
) {
}
