package com.xrplmcp.mcp.api;

/**
 * One legal value of an enum-constrained field.
 *
 * @param name      constant name callers may supply, e.g. {@code ASF_DEPOSIT_AUTH}
 * @param wireValue serialized value, e.g. {@code 9}; equal to the name for plain enums
 * @param constant  the Java constant bound into the model
 */
public record EnumConstant(String name, String wireValue, Enum<?> constant) {

    public boolean matches(Object value) {
        if (value == null) return false;
        if (value instanceof Enum<?> e) return e == constant;
        final String text = String.valueOf(value);
        return name.equalsIgnoreCase(text) || wireValue.equals(text);
    }
}
