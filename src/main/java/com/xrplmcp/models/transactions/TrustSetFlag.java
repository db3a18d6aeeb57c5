package com.xrplmcp.models.transactions;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrustSetFlag {
    TF_SETF_AUTH(0x00010000L),
    TF_SET_NO_RIPPLE(0x00020000L),
    TF_CLEAR_NO_RIPPLE(0x00040000L),
    TF_SET_FREEZE(0x00100000L),
    TF_CLEAR_FREEZE(0x00200000L);

    private final long value;

    TrustSetFlag(long value) {
        this.value = value;
    }

    @JsonValue
    public long value() {
        return value;
    }
}
