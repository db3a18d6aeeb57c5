package com.xrplmcp.models.transactions;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentFlag {
    TF_NO_RIPPLE_DIRECT(0x00010000L),
    TF_PARTIAL_PAYMENT(0x00020000L),
    TF_LIMIT_QUALITY(0x00040000L);

    private final long value;

    PaymentFlag(long value) {
        this.value = value;
    }

    @JsonValue
    public long value() {
        return value;
    }
}
