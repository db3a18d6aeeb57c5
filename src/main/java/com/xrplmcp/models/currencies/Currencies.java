package com.xrplmcp.models.currencies;

import java.util.List;

public final class Currencies {

    public static final List<Class<?>> DEFINITIONS = List.of(Currency.class, IssuedCurrency.class, XRP.class);

    private static final int HEX_CODE_LENGTH = 40;

    private Currencies() {}

    /** True for standard 3-character codes and 40-character ASCII hex codes. */
    public static boolean isValidCode(String code) {
        if (code.length() == 3) {
            return true;
        }
        return code.length() == HEX_CODE_LENGTH
            && code.chars().allMatch(c -> (c >= '0' && c <= '9') || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f'));
    }
}
