package com.xrplmcp.mcp.api;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

import com.xrplmcp.mcp.utils.Json;

/**
 * Maps Java scalar component types to JSON Schema types and coerces string input into them.
 */
public enum ScalarType {
    STRING("string"),
    INTEGER("integer"),
    LONG("integer"),
    BOOLEAN("boolean"),
    DECIMAL("number");

    private final String jsonSchemaType;

    ScalarType(String jsonSchemaType) {
        this.jsonSchemaType = jsonSchemaType;
    }

    public String jsonSchemaType() {
        return jsonSchemaType;
    }

    /**
     * Infer ScalarType from a Java reflection Type.
     *
     * @return the scalar type, or null if the type is not a scalar
     */
    public static ScalarType inferFrom(Type javaType) {
        if (javaType == String.class) return STRING;
        if (javaType == int.class || javaType == Integer.class) return INTEGER;
        if (javaType == long.class || javaType == Long.class) return LONG;
        if (javaType == boolean.class || javaType == Boolean.class) return BOOLEAN;
        if (javaType == double.class || javaType == Double.class || javaType == BigDecimal.class) return DECIMAL;
        return null;
    }

    /**
     * Parse a raw string into the appropriate typed value.
     * Never fails: a string that cannot be parsed is returned unchanged.
     */
    public Object coerce(String raw) {
        if (raw == null || raw.isEmpty()) return raw;

        return switch (this) {
            case STRING -> raw;
            case INTEGER -> {
                try {
                    yield Math.toIntExact(Json.parseHexLong(raw));
                } catch (NumberFormatException | ArithmeticException e) {
                    yield raw;
                }
            }
            case LONG -> {
                try {
                    yield Json.parseHexLong(raw);
                } catch (NumberFormatException e) {
                    yield raw;
                }
            }
            case BOOLEAN -> switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "on", "1" -> Boolean.TRUE;
                case "false", "no", "off", "0" -> Boolean.FALSE;
                default -> raw;
            };
            case DECIMAL -> {
                try {
                    yield new BigDecimal(raw.trim());
                } catch (NumberFormatException e) {
                    yield raw;
                }
            }
        };
    }

    /**
     * Whether a value can stand for this scalar, either directly or after {@link #coerce}.
     */
    public boolean accepts(Object value) {
        if (value instanceof String s) {
            return this == STRING || coerce(s) != s;
        }
        return switch (this) {
            case STRING -> false;
            case INTEGER, LONG -> value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger;
            case BOOLEAN -> value instanceof Boolean;
            case DECIMAL -> value instanceof Number;
        };
    }

    /**
     * Example value shown in tool descriptions.
     */
    public Object example() {
        return switch (this) {
            case STRING -> "string";
            case INTEGER, LONG -> 1;
            case BOOLEAN -> true;
            case DECIMAL -> new BigDecimal("1.5");
        };
    }
}
