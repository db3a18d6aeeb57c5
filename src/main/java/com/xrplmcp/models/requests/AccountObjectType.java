package com.xrplmcp.models.requests;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccountObjectType {
    CHECK("check"),
    DEPOSIT_PREAUTH("deposit_preauth"),
    ESCROW("escrow"),
    NFT_OFFER("nft_offer"),
    OFFER("offer"),
    PAYMENT_CHANNEL("payment_channel"),
    SIGNER_LIST("signer_list"),
    STATE("state"),
    TICKET("ticket");

    private final String value;

    AccountObjectType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
