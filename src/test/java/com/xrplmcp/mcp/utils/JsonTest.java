package com.xrplmcp.mcp.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class JsonTest {

    record Sample(String toolName, Optional<String> note, Integer count) {
    }

    @Test
    void testSerialize_SnakeCaseAndAbsentValuesOmitted() {
        assertEquals("{\"tool_name\":\"a\"}", Json.serialize(new Sample("a", Optional.empty(), null)));
        assertEquals("{\"tool_name\":\"a\",\"note\":\"n\",\"count\":2}",
            Json.serialize(new Sample("a", Optional.of("n"), 2)));
    }

    @Test
    void testToSnakeCase() {
        assertEquals("last_ledger_sequence", Json.toSnakeCase("lastLedgerSequence"));
    }

    @Test
    void testParseHexLong() {
        assertEquals(65536L, Json.parseHexLong("0x00010000"));
        assertEquals(42L, Json.parseHexLong(" 42 "));
        assertThrows(NumberFormatException.class, () -> Json.parseHexLong("forty"));
    }
}
