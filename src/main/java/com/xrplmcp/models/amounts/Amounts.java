package com.xrplmcp.models.amounts;

import java.math.BigDecimal;
import java.util.List;

/**
 * Amount definitions and helpers shared by transaction models.
 * An amount is either a string of XRP drops or an {@link IssuedCurrencyAmount}.
 */
public final class Amounts {

    public static final List<Class<?>> DEFINITIONS = List.of(IssuedCurrencyAmount.class);

    private Amounts() {}

    /** True when the amount is expressed in XRP drops. */
    public static boolean isXrp(Object amount) {
        return amount instanceof String;
    }

    /** True when the string is a whole, non-negative number of drops. */
    public static boolean isDrops(String amount) {
        return !amount.isEmpty() && amount.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    static boolean isDecimal(String value) {
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
