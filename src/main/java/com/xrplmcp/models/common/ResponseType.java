package com.xrplmcp.models.common;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseType {
    RESPONSE("response"),
    LEDGER_CLOSED("ledgerClosed"),
    TRANSACTION("transaction");

    private final String value;

    ResponseType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
