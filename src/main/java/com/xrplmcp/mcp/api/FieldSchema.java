package com.xrplmcp.mcp.api;

/**
 * Runtime definition of a single model field, built from the record component via reflection.
 */
public record FieldSchema(
    String name,           // snake_case name callers use
    String key,            // ledger key, e.g. DestinationTag
    String javaName,       // record component name
    FieldType type,
    boolean required,      // true if no default and not Optional
    String defaultValue,   // declared default, or null
    String description     // from @ModelField.value()
) {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
