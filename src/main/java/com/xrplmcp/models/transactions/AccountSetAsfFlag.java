package com.xrplmcp.models.transactions;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Account-level settings toggled through the SetFlag and ClearFlag fields of {@link AccountSet}.
 */
public enum AccountSetAsfFlag {
    ASF_REQUIRE_DEST(1),
    ASF_REQUIRE_AUTH(2),
    ASF_DISALLOW_XRP(3),
    ASF_DISABLE_MASTER(4),
    ASF_ACCOUNT_TXN_ID(5),
    ASF_NO_FREEZE(6),
    ASF_GLOBAL_FREEZE(7),
    ASF_DEFAULT_RIPPLE(8),
    ASF_DEPOSIT_AUTH(9),
    ASF_AUTHORIZED_NFTOKEN_MINTER(10),
    ASF_DISALLOW_INCOMING_NFTOKEN_OFFER(12),
    ASF_DISALLOW_INCOMING_CHECK(13),
    ASF_DISALLOW_INCOMING_PAYCHAN(14),
    ASF_DISALLOW_INCOMING_TRUSTLINE(15),
    ASF_ALLOW_TRUSTLINE_CLAWBACK(16);

    private final int value;

    AccountSetAsfFlag(int value) {
        this.value = value;
    }

    @JsonValue
    public int value() {
        return value;
    }
}
