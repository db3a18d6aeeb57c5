package com.xrplmcp.mcp.validate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.xrplmcp.models.amounts.IssuedCurrencyAmount;
import com.xrplmcp.models.requests.AccountInfo;
import com.xrplmcp.models.transactions.AccountSet;
import com.xrplmcp.models.transactions.AccountSetAsfFlag;
import com.xrplmcp.models.transactions.Payment;

class ModelBinderTest {

    @Test
    void testConstruct_FromLedgerKeys() {
        final Payment payment = ModelBinder.construct(Payment.class,
            Map.of("Account", "rA", "Destination", "rB", "Amount", "1000000", "DestinationTag", 7));

        assertEquals("rA", payment.account());
        assertEquals("1000000", payment.amount());
        assertEquals(7L, payment.destinationTag());
    }

    @Test
    void testConstruct_KeepsResolvedUnionInstances() {
        final IssuedCurrencyAmount amount = new IssuedCurrencyAmount("USD", "rI", "5");
        final Payment payment = ModelBinder.construct(Payment.class,
            Map.of("Account", "rA", "Destination", "rB", "Amount", amount));

        assertEquals(amount, payment.amount());
    }

    @Test
    void testConstruct_ConvertsNestedMaps() {
        final Payment payment = ModelBinder.construct(Payment.class, Map.of(
            "Account", "rA", "Destination", "rB", "Amount", "1",
            "Memos", List.of(Map.of("MemoData", "AB"))));

        assertEquals("AB", payment.memos().get(0).memoData());
    }

    @Test
    void testConstruct_AbsentOptionalIsEmpty() {
        final AccountInfo info = ModelBinder.construct(AccountInfo.class, Map.of("Account", "rA"));
        assertEquals(Optional.empty(), info.queue());
    }

    @Test
    void testConstruct_ModelMessageIsVerbatim() {
        final ModelBindingException e = assertThrows(ModelBindingException.class, () ->
            ModelBinder.construct(Payment.class, Map.of("Account", "rA", "Destination", "rA", "Amount", "1")));

        assertEquals("Destination must differ from Account unless the payment is cross-currency", e.getMessage());
    }

    @Test
    void testConstruct_ConversionFailureNamesTheField() {
        final ModelBindingException e = assertThrows(ModelBindingException.class, () ->
            ModelBinder.construct(Payment.class,
                Map.of("Account", "rA", "Destination", "rB", "Amount", "1", "DestinationTag", "abc")));

        assertTrue(e.getMessage().startsWith("DestinationTag: "), e.getMessage());
    }

    @Test
    void testCanonical_TypeFieldFirstAndAbsentFieldsOmitted() {
        final Payment payment = ModelBinder.construct(Payment.class,
            Map.of("Account", "rA", "Destination", "rB", "Amount", "1000000", "FavoriteColor", "blue"));

        final Map<String, Object> canonical = ModelBinder.canonical(payment);

        assertEquals("TransactionType", canonical.keySet().iterator().next());
        assertEquals("Payment", canonical.get("TransactionType"));
        assertEquals("1000000", canonical.get("Amount"));
        assertFalse(canonical.containsKey("Fee"));
        assertFalse(canonical.containsKey("FavoriteColor"));
    }

    @Test
    void testCanonical_LedgerKeysAndWireValues() {
        final AccountSet accountSet = ModelBinder.construct(AccountSet.class, Map.of(
            "Account", "rA",
            "SetFlag", AccountSetAsfFlag.ASF_AUTHORIZED_NFTOKEN_MINTER,
            "NFTokenMinter", "rMinter"));

        final Map<String, Object> canonical = ModelBinder.canonical(accountSet);

        assertEquals(10, canonical.get("SetFlag"));
        assertEquals("rMinter", canonical.get("NFTokenMinter"));
    }

    @Test
    void testCanonical_NestedModelsUseLedgerKeys() {
        final Payment payment = ModelBinder.construct(Payment.class, Map.of(
            "Account", "rA", "Destination", "rB",
            "Amount", new IssuedCurrencyAmount("USD", "rI", "5")));

        final Map<String, Object> canonical = ModelBinder.canonical(payment);

        assertEquals(Map.of("Currency", "USD", "Issuer", "rI", "Value", "5"), canonical.get("Amount"));
    }

    @Test
    void testCanonical_RequestMethodAndOptionals() {
        final AccountInfo info = ModelBinder.construct(AccountInfo.class,
            Map.of("Account", "rA", "SignerLists", true));

        final Map<String, Object> canonical = ModelBinder.canonical(info);

        assertEquals("account_info", canonical.get("Method"));
        assertEquals(true, canonical.get("SignerLists"));
        assertFalse(canonical.containsKey("Queue"));
    }
}
