package com.xrplmcp.mcp.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Required fields were missing, or values did not fit their field: no union alternative
 * matched, or a number with a fraction was given for an integer field.
 * Nested fields are reported as paths, e.g. {@code limit_amount.issuer} or {@code memos[0]}.
 */
public record ValidationError(
    String tool,
    List<String> missingFields,
    List<String> invalidFields,
    SchemaReport schema
) implements Diagnostic {

    public ValidationError {
        missingFields = List.copyOf(missingFields);
        invalidFields = List.copyOf(invalidFields);
    }

    @Override
    public String message() {
        final List<String> parts = new ArrayList<>(2);
        if (!missingFields.isEmpty()) {
            parts.add("missing required fields " + missingFields);
        }
        if (!invalidFields.isEmpty()) {
            parts.add("invalid values for " + invalidFields);
        }
        return "Invalid input for " + tool + ": " + String.join("; ", parts);
    }

    @Override
    public String toDisplayText() {
        return message() + "\n\n" + schema.toDisplayText();
    }
}
