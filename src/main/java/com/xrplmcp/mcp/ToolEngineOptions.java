package com.xrplmcp.mcp;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine configuration. Values come from {@code xrpl-model-tools.properties} on the classpath,
 * overridden by system properties with the same keys.
 *
 * @param nativeCurrency    currency code of the native asset, never hex-encoded
 * @param currencyCodeWidth length of an encoded (hex) currency code
 * @param amountFields      snake_case field names whose values are amounts and kept verbatim
 * @param currencyFields    snake_case field names whose values are currency codes
 */
public record ToolEngineOptions(
    String nativeCurrency,
    int currencyCodeWidth,
    Set<String> amountFields,
    Set<String> currencyFields
) {
    private static final Logger log = LoggerFactory.getLogger(ToolEngineOptions.class);

    public static final String RESOURCE = "xrpl-model-tools.properties";
    public static final String NATIVE_CURRENCY = "xrplmcp.native-currency";
    public static final String CURRENCY_WIDTH = "xrplmcp.currency-width";
    public static final String AMOUNT_FIELDS = "xrplmcp.amount-fields";
    public static final String CURRENCY_FIELDS = "xrplmcp.currency-fields";

    private static final String DEFAULT_NATIVE_CURRENCY = "XRP";
    private static final int DEFAULT_CURRENCY_WIDTH = 40;
    private static final Set<String> DEFAULT_AMOUNT_FIELDS = Set.of(
        "amount", "amount2", "balance", "bid_max", "bid_min", "deliver_max", "deliver_min",
        "delivered_amount", "fee", "limit", "limit_amount", "lp_token_in", "lp_token_out",
        "min_account_create_amount", "send_max", "signature_reward", "taker_gets", "taker_pays",
        "value", "xchain_fee");
    private static final Set<String> DEFAULT_CURRENCY_FIELDS = Set.of("currency");

    public ToolEngineOptions {
        if (nativeCurrency == null || nativeCurrency.isBlank()) {
            throw new IllegalArgumentException("nativeCurrency must not be blank");
        }
        if (currencyCodeWidth <= 0 || currencyCodeWidth % 2 != 0) {
            throw new IllegalArgumentException("currencyCodeWidth must be a positive even number, got " + currencyCodeWidth);
        }
        amountFields = Set.copyOf(amountFields);
        currencyFields = Set.copyOf(currencyFields);
    }

    public static ToolEngineOptions defaults() {
        return new ToolEngineOptions(DEFAULT_NATIVE_CURRENCY, DEFAULT_CURRENCY_WIDTH,
            DEFAULT_AMOUNT_FIELDS, DEFAULT_CURRENCY_FIELDS);
    }

    /**
     * Load options from the classpath resource, then apply system property overrides.
     */
    public static ToolEngineOptions load() {
        final Properties props = new Properties();
        try (InputStream in = ToolEngineOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults", RESOURCE, e);
        }
        for (final String key : new String[] {NATIVE_CURRENCY, CURRENCY_WIDTH, AMOUNT_FIELDS, CURRENCY_FIELDS}) {
            final String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static ToolEngineOptions fromProperties(final Properties props) {
        final String nativeCurrency = props.getProperty(NATIVE_CURRENCY, DEFAULT_NATIVE_CURRENCY).trim();
        int width = DEFAULT_CURRENCY_WIDTH;
        final String rawWidth = props.getProperty(CURRENCY_WIDTH);
        if (rawWidth != null) {
            try {
                width = Integer.parseInt(rawWidth.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed {}='{}', using {}", CURRENCY_WIDTH, rawWidth, DEFAULT_CURRENCY_WIDTH);
            }
        }
        return new ToolEngineOptions(nativeCurrency, width,
            parseNames(props.getProperty(AMOUNT_FIELDS), DEFAULT_AMOUNT_FIELDS),
            parseNames(props.getProperty(CURRENCY_FIELDS), DEFAULT_CURRENCY_FIELDS));
    }

    /** Whether the field carries an amount. */
    public boolean isAmountField(final String snakeName) {
        return amountFields.contains(snakeName);
    }

    /** Whether the field carries a currency code; names ending in {@code _currency} count too. */
    public boolean isCurrencyField(final String snakeName) {
        return currencyFields.contains(snakeName) || snakeName.endsWith("_currency");
    }

    private static Set<String> parseNames(final String raw, final Set<String> fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
