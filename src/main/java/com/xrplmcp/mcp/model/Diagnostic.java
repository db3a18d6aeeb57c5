package com.xrplmcp.mcp.model;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structured failure of a tool invocation. Serialized with a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
public sealed interface Diagnostic extends Displayable
        permits UnknownTool, ValidationError, EnumViolation, ModelConstructionError {

    /** One-line summary of what went wrong. */
    String message();

    @Override
    default String toDisplayText() {
        return message();
    }
}
