package com.xrplmcp.models.requests;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named ledger versions accepted wherever a ledger index is.
 */
public enum LedgerShortcut {
    CURRENT("current"),
    CLOSED("closed"),
    VALIDATED("validated");

    private final String value;

    LedgerShortcut(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
