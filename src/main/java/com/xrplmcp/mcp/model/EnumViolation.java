package com.xrplmcp.mcp.model;

import java.util.List;

/**
 * A value outside the legal set of an enum field. {@code field}, {@code value} and
 * {@code legalValues} describe the first offending field; {@code errors} lists them all.
 */
public record EnumViolation(
    String tool,
    String field,
    Object value,
    List<String> legalValues,
    List<String> errors,
    SchemaReport schema
) implements Diagnostic {

    public EnumViolation {
        legalValues = List.copyOf(legalValues);
        errors = List.copyOf(errors);
    }

    @Override
    public String message() {
        return "Invalid value for " + tool + ": " + String.join("; ", errors);
    }

    @Override
    public String toDisplayText() {
        return message() + "\n\n" + schema.toDisplayText();
    }
}
