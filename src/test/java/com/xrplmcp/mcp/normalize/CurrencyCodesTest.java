package com.xrplmcp.mcp.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CurrencyCodesTest {

    private final CurrencyCodes codes = new CurrencyCodes("XRP", 40);

    @Test
    void testNormalize_EncodesNonStandardCode() {
        assertEquals("5553444300000000000000000000000000000000", codes.normalize("USDC"));
    }

    @Test
    void testNormalize_IsIdempotent() {
        final String once = codes.normalize("USDC");
        assertEquals(once, codes.normalize(once));
    }

    @Test
    void testNormalize_StandardCodeUnchanged() {
        assertEquals("USD", codes.normalize("USD"));
    }

    @Test
    void testNormalize_NativeCodeUnchanged() {
        assertEquals("XRP", codes.normalize("XRP"));
    }

    @Test
    void testNormalize_UpperCaseHex() {
        assertEquals("4555524F" + "0".repeat(32), codes.normalize("EURO"));
    }

    @Test
    void testNormalize_LowerCaseHexOfFullWidthUnchanged() {
        final String code = "0158415500000000c1f76ff6ecb0bac600000000";
        assertEquals(code, codes.normalize(code));
    }

    @Test
    void testNormalize_TooLongPassesThrough() {
        final String code = "ABCDEFGHIJKLMNOPQRSTU";
        assertEquals(code, codes.normalize(code));
    }

    @Test
    void testNormalize_TwentyBytesFillsWidth() {
        final String encoded = codes.normalize("ABCDEFGHIJKLMNOPQRST");
        assertEquals(40, encoded.length());
        assertFalse(encoded.endsWith("0"));
    }

    @Test
    void testNormalize_EmptyAndNull() {
        assertEquals("", codes.normalize(""));
        assertNull(codes.normalize(null));
    }

    @Test
    void testIsEncoded() {
        assertTrue(codes.isEncoded("5553444300000000000000000000000000000000"));
        assertFalse(codes.isEncoded("555344430000000000000000000000000000000Z"));
        assertFalse(codes.isEncoded("55534443"));
    }

    @Test
    void testIsEncoded_RequiresAsciiHexDigits() {
        final String fullwidthZeros = "\uFF10".repeat(40);

        assertFalse(codes.isEncoded(fullwidthZeros));
        assertEquals(fullwidthZeros, codes.normalize(fullwidthZeros));
    }

    @Test
    void testCustomWidth() {
        final CurrencyCodes narrow = new CurrencyCodes("XRP", 8);
        assertEquals("55534443", narrow.normalize("USDC"));
        assertEquals("ABCDE", narrow.normalize("ABCDE"));
    }
}
