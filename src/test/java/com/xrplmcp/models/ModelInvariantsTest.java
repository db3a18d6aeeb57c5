package com.xrplmcp.models;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.xrplmcp.models.amounts.IssuedCurrencyAmount;
import com.xrplmcp.models.currencies.IssuedCurrency;
import com.xrplmcp.models.currencies.XRP;
import com.xrplmcp.models.requests.AccountInfo;
import com.xrplmcp.models.requests.ServerInfo;
import com.xrplmcp.models.requests.Tx;
import com.xrplmcp.models.transactions.EscrowCreate;
import com.xrplmcp.models.transactions.Payment;
import com.xrplmcp.models.transactions.PaymentFlag;
import com.xrplmcp.models.transactions.Transactions;

class ModelInvariantsTest {

    private static Payment payment(final String account, final String destination, final Object amount,
                                   final Object sendMax, final Long flags, final Object deliverMin) {
        return new Payment(account, null, null, flags, null, null, null, null, null, null,
            amount, destination, null, null, null, sendMax, deliverMin);
    }

    private static EscrowCreate escrow(final Long cancelAfter, final Long finishAfter, final String condition) {
        return new EscrowCreate("rAlice", null, null, 0L, null, null, null, null, null, null,
            "1000", "rBob", null, cancelAfter, finishAfter, condition);
    }

    @Nested
    class Payments {

        @Test
        void testXrpPayment() {
            final Payment p = assertDoesNotThrow(() -> payment("rAlice", "rBob", "1000000", null, 0L, null));
            assertEquals(Map.of("TransactionType", "Payment"), p.typeFields());
        }

        @Test
        void testSelfPaymentRejected() {
            final ModelValidationException e = assertThrows(ModelValidationException.class,
                () -> payment("rAlice", "rAlice", "10", null, 0L, null));
            assertTrue(e.getMessage().startsWith("Destination must differ"));
        }

        @Test
        void testCrossCurrencySelfPaymentAllowed() {
            final IssuedCurrencyAmount usd = new IssuedCurrencyAmount("USD", "rIssuer", "5");
            assertDoesNotThrow(() -> payment("rAlice", "rAlice", usd, "10", 0L, null));
        }

        @Test
        void testXrpToXrpWithSendMaxRejected() {
            assertThrows(ModelValidationException.class,
                () -> payment("rAlice", "rBob", "10", "20", 0L, null));
        }

        @Test
        void testNonAsciiDigitDropsRejected() {
            assertThrows(ModelValidationException.class,
                () -> payment("rAlice", "rBob", "\uFF11\uFF10", null, 0L, null));
        }

        @Test
        void testFractionalDropsRejected() {
            assertThrows(ModelValidationException.class,
                () -> payment("rAlice", "rBob", "1.5", null, 0L, null));
        }

        @Test
        void testDeliverMinRequiresPartialPayment() {
            assertThrows(ModelValidationException.class,
                () -> payment("rAlice", "rBob", "10", null, 0L, "5"));
            final Payment partial = payment("rAlice", "rBob", "10", null,
                PaymentFlag.TF_PARTIAL_PAYMENT.value(), "5");
            assertTrue(partial.hasFlag(PaymentFlag.TF_PARTIAL_PAYMENT.value()));
        }
    }

    @Test
    void testEscrowTiming() {
        assertDoesNotThrow(() -> escrow(200L, 100L, null));
        assertThrows(ModelValidationException.class, () -> escrow(100L, 200L, null));
        assertThrows(ModelValidationException.class, () -> escrow(null, null, null));
        assertDoesNotThrow(() -> escrow(null, null, "A0258020"));
    }

    @Test
    void testIssuedCurrency() {
        assertDoesNotThrow(() -> new IssuedCurrency("USD", "rIssuer"));
        assertDoesNotThrow(() -> new IssuedCurrency("0158415500000000C1F76FF6ECB0BAC600000000", "rIssuer"));
        assertThrows(ModelValidationException.class, () -> new IssuedCurrency("xrp", "rIssuer"));
        assertThrows(ModelValidationException.class, () -> new IssuedCurrency("DOLLAR", "rIssuer"));
        assertThrows(ModelValidationException.class, () -> new IssuedCurrency("\uFF10".repeat(40), "rIssuer"));
    }

    @Test
    void testIssuedCurrencyAmountValue() {
        assertThrows(ModelValidationException.class, () -> new IssuedCurrencyAmount("USD", "rIssuer", "ten"));
        assertDoesNotThrow(() -> new IssuedCurrencyAmount("USD", "rIssuer", "1e-3"));
    }

    @Test
    void testXrpDefaultsItsCode() {
        assertEquals("XRP", new XRP(null).currency());
        assertThrows(ModelValidationException.class, () -> new XRP("USD"));
    }

    @Test
    void testTxLedgerRange() {
        assertDoesNotThrow(() -> new Tx("ABCD", false, 10L, 20L, null));
        assertThrows(ModelValidationException.class, () -> new Tx("ABCD", false, 10L, null, null));
        assertThrows(ModelValidationException.class, () -> new Tx("ABCD", false, 30L, 20L, null));
    }

    @Test
    void testRequestMethodNames() {
        assertEquals("tx", new Tx("ABCD", false, null, null, 1).method());
        assertEquals("server_info", new ServerInfo(null).method());
        final AccountInfo info = new AccountInfo("rAlice", null, null, null, null, true, null);
        assertEquals("account_info", info.method());
        assertTrue(info.queue().isEmpty());
        assertEquals(Map.of("Method", "account_info"), info.typeFields());
    }

    @Test
    void testModuleDefinitionsAreModelsOrSupportTypes() {
        for (final Class<?> cls : Transactions.DEFINITIONS) {
            assertTrue(BaseModel.class.isAssignableFrom(cls) || cls.isEnum(), cls::getName);
            if (cls.isRecord()) {
                assertTrue(cls.isAnnotationPresent(ModelDoc.class), cls::getName);
            }
        }
    }
}
