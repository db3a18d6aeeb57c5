package com.xrplmcp.mcp.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.xrplmcp.models.BaseModel;

/**
 * Outcome of a tool invocation: either a constructed model with its canonical ledger form,
 * or a diagnostic.
 *
 * @param instance   the constructed model, null on failure
 * @param value      canonical ledger representation of {@code instance}, null on failure
 * @param diagnostic why the invocation failed, null on success
 */
public record InvocationResult(
    @JsonIgnore BaseModel instance,
    Map<String, Object> value,
    Diagnostic diagnostic
) implements Displayable {

    public static InvocationResult success(final BaseModel instance, final Map<String, Object> value) {
        return new InvocationResult(instance, value, null);
    }

    public static InvocationResult failure(final Diagnostic diagnostic) {
        return new InvocationResult(null, null, diagnostic);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return diagnostic == null;
    }

    @Override
    public String toDisplayText() {
        return isSuccess() ? String.valueOf(value) : diagnostic.toDisplayText();
    }
}
