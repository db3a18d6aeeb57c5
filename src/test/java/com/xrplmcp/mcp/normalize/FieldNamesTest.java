package com.xrplmcp.mcp.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FieldNamesTest {

    @Test
    void testToLedgerKey_SnakeCase() {
        assertEquals("DestinationTag", FieldNames.toLedgerKey("destination_tag"));
    }

    @Test
    void testToLedgerKey_CamelCase() {
        assertEquals("DestinationTag", FieldNames.toLedgerKey("destinationTag"));
    }

    @Test
    void testToLedgerKey_AlreadyLedgerCased() {
        assertEquals("DestinationTag", FieldNames.toLedgerKey("DestinationTag"));
        assertEquals("NFTokenID", FieldNames.toLedgerKey("NFTokenID"));
    }

    @Test
    void testToLedgerKey_UpperSnake() {
        assertEquals("DestinationTag", FieldNames.toLedgerKey("DESTINATION_TAG"));
    }

    @Test
    void testToLedgerKey_SingleWord() {
        assertEquals("Account", FieldNames.toLedgerKey("account"));
    }

    @ParameterizedTest
    @CsvSource({
        "nftoken_id, NFTokenID",
        "nftokenTaxon, NFTokenTaxon",
        "invoice_id, InvoiceID",
        "uri, URI",
        "xchain_bridge, XChainBridge",
        "amm_account, AMMAccount",
        "lp_token_out, LPTokenOut",
        "did_document, DIDDocument",
        "unl_modify_disabling, UNLModifyDisabling",
        "amount2, Amount2",
        "signing_pub_key, SigningPubKey"
    })
    void testToLedgerKey_Abbreviations(final String caller, final String ledger) {
        assertEquals(ledger, FieldNames.toLedgerKey(caller));
    }

    @ParameterizedTest
    @CsvSource({
        "NFTokenID, nftoken_id",
        "DestinationTag, destination_tag",
        "XChainBridge, xchain_bridge",
        "destinationTag, destination_tag",
        "limit_amount, limit_amount"
    })
    void testToSnakeName(final String name, final String snake) {
        assertEquals(snake, FieldNames.toSnakeName(name));
    }

    @Test
    void testRoundTrip_LedgerKeyThroughSnakeName() {
        for (final String key : new String[] {"NFTokenTaxon", "InvoiceID", "XChainBridge", "LimitAmount", "URI"}) {
            assertEquals(key, FieldNames.toLedgerKey(FieldNames.toSnakeName(key)));
        }
    }
}
