package com.xrplmcp.mcp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

class ScalarTypeTest {

    // =========================================================================
    // inferFrom tests
    // =========================================================================

    @Test
    void testInferFrom_String() {
        assertEquals(ScalarType.STRING, ScalarType.inferFrom(String.class));
    }

    @Test
    void testInferFrom_IntAndInteger() {
        assertEquals(ScalarType.INTEGER, ScalarType.inferFrom(int.class));
        assertEquals(ScalarType.INTEGER, ScalarType.inferFrom(Integer.class));
    }

    @Test
    void testInferFrom_LongAndWrapper() {
        assertEquals(ScalarType.LONG, ScalarType.inferFrom(long.class));
        assertEquals(ScalarType.LONG, ScalarType.inferFrom(Long.class));
    }

    @Test
    void testInferFrom_Boolean() {
        assertEquals(ScalarType.BOOLEAN, ScalarType.inferFrom(Boolean.class));
    }

    @Test
    void testInferFrom_Decimal() {
        assertEquals(ScalarType.DECIMAL, ScalarType.inferFrom(BigDecimal.class));
        assertEquals(ScalarType.DECIMAL, ScalarType.inferFrom(double.class));
    }

    @Test
    void testInferFrom_NonScalarIsNull() {
        assertNull(ScalarType.inferFrom(List.class));
        assertNull(ScalarType.inferFrom(Object.class));
    }

    // =========================================================================
    // coerce tests
    // =========================================================================

    @Test
    void testCoerce_Integer() {
        assertEquals(12, ScalarType.INTEGER.coerce("12"));
    }

    @Test
    void testCoerce_IntegerHex() {
        assertEquals(31, ScalarType.INTEGER.coerce("0x1F"));
    }

    @Test
    void testCoerce_IntegerOverflowPassesThrough() {
        assertEquals("99999999999", ScalarType.INTEGER.coerce("99999999999"));
    }

    @Test
    void testCoerce_Long() {
        assertEquals(131072L, ScalarType.LONG.coerce("0x20000"));
        assertEquals(4294967296L, ScalarType.LONG.coerce("4294967296"));
    }

    @Test
    void testCoerce_UnparseablePassesThrough() {
        final String raw = "twelve";
        assertSame(raw, ScalarType.LONG.coerce(raw));
    }

    @Test
    void testCoerce_BooleanSpellings() {
        assertEquals(Boolean.TRUE, ScalarType.BOOLEAN.coerce("true"));
        assertEquals(Boolean.TRUE, ScalarType.BOOLEAN.coerce("YES"));
        assertEquals(Boolean.TRUE, ScalarType.BOOLEAN.coerce("1"));
        assertEquals(Boolean.FALSE, ScalarType.BOOLEAN.coerce("off"));
        assertEquals(Boolean.FALSE, ScalarType.BOOLEAN.coerce("0"));
        assertEquals("maybe", ScalarType.BOOLEAN.coerce("maybe"));
    }

    @Test
    void testCoerce_Decimal() {
        assertEquals(new BigDecimal("1.50"), ScalarType.DECIMAL.coerce("1.50"));
    }

    @Test
    void testCoerce_StringUnchanged() {
        assertEquals("0x1F", ScalarType.STRING.coerce("0x1F"));
    }

    @Test
    void testCoerce_NullAndEmpty() {
        assertNull(ScalarType.INTEGER.coerce(null));
        assertEquals("", ScalarType.INTEGER.coerce(""));
    }

    // =========================================================================
    // accepts tests
    // =========================================================================

    @Test
    void testAccepts_IntegerKinds() {
        assertTrue(ScalarType.LONG.accepts(5));
        assertTrue(ScalarType.LONG.accepts(5L));
        assertTrue(ScalarType.LONG.accepts("12345"));
        assertFalse(ScalarType.LONG.accepts("validated"));
        assertFalse(ScalarType.LONG.accepts(1.5));
    }

    @Test
    void testAccepts_String() {
        assertTrue(ScalarType.STRING.accepts("anything"));
        assertFalse(ScalarType.STRING.accepts(7));
    }

    @Test
    void testAccepts_Boolean() {
        assertTrue(ScalarType.BOOLEAN.accepts(true));
        assertTrue(ScalarType.BOOLEAN.accepts("no"));
        assertFalse(ScalarType.BOOLEAN.accepts("perhaps"));
    }

    @Test
    void testAccepts_Decimal() {
        assertTrue(ScalarType.DECIMAL.accepts(1.5));
        assertTrue(ScalarType.DECIMAL.accepts("2.25"));
    }

    @Test
    void testJsonSchemaType() {
        assertEquals("integer", ScalarType.LONG.jsonSchemaType());
        assertEquals("number", ScalarType.DECIMAL.jsonSchemaType());
    }
}
