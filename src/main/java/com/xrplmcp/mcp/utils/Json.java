package com.xrplmcp.mcp.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Engine-side JSON: tool listings, schema reports and diagnostics are written with snake_case
 * property names, and absent values (null or empty {@code Optional}) are left out.
 * Ledger representations of models use their own naming, see
 * {@link com.xrplmcp.mcp.validate.ModelBinder#canonical}.
 */
public final class Json {
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
        (PropertyNamingStrategies.SnakeCaseStrategy) PropertyNamingStrategies.SNAKE_CASE;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new Jdk8Module())
        .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
        .setPropertyNamingStrategy(SNAKE_CASE);

    private Json() {}

    /** {@code lastLedgerSequence} to {@code last_ledger_sequence}. */
    public static String toSnakeCase(final String name) {
        return SNAKE_CASE.translate(name);
    }

    /**
     * @throws IllegalStateException if Jackson cannot write the value
     */
    public static String serialize(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T convertValue(final Object value, final Class<T> type) {
        return MAPPER.convertValue(value, type);
    }

    /**
     * Parse a decimal or {@code 0x}-prefixed hexadecimal long. Flag values are often written in hex.
     *
     * @throws NumberFormatException if the text is neither
     */
    public static long parseHexLong(final String text) {
        final String trimmed = text.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return Long.parseLong(trimmed.substring(2), 16);
        }
        return Long.parseLong(trimmed);
    }
}
