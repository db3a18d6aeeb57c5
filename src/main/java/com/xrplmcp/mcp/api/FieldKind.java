package com.xrplmcp.mcp.api;

/**
 * Shape of a model field as seen by validation.
 */
public enum FieldKind {
    PRIMITIVE,
    ENUM,
    MODEL,
    UNION,
    SEQUENCE,
    /** Anything the extractor does not understand; passed through untouched. */
    OPAQUE
}
