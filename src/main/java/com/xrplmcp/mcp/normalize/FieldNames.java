package com.xrplmcp.mcp.normalize;

import java.util.Locale;
import java.util.Map;

import com.xrplmcp.mcp.utils.Json;

/**
 * Conversions between caller-facing snake_case names and ledger keys.
 */
public final class FieldNames {

    /** Segments the ledger spells with a fixed casing. */
    private static final Map<String, String> ABBREVIATIONS = Map.of(
        "amm", "AMM",
        "did", "DID",
        "id", "ID",
        "lp", "LP",
        "nftoken", "NFToken",
        "unl", "UNL",
        "uri", "URI",
        "xchain", "XChain");

    private FieldNames() {}

    /**
     * Convert any caller spelling ({@code destination_tag}, {@code destinationTag},
     * {@code DestinationTag}) to the ledger key ({@code DestinationTag}).
     */
    public static String toLedgerKey(final String name) {
        if (name == null || name.isEmpty()) return name;
        if (name.indexOf('_') < 0 && Character.isUpperCase(name.charAt(0))) {
            return name;
        }
        final String snake = name.indexOf('_') >= 0 ? name.toLowerCase(Locale.ROOT) : Json.toSnakeCase(name);
        final StringBuilder sb = new StringBuilder(snake.length());
        for (final String segment : snake.split("_")) {
            if (segment.isEmpty()) continue;
            final String fixed = ABBREVIATIONS.get(segment);
            if (fixed != null) {
                sb.append(fixed);
            } else {
                sb.append(Character.toUpperCase(segment.charAt(0))).append(segment, 1, segment.length());
            }
        }
        return sb.toString();
    }

    /**
     * Caller-facing snake_case form of a name, e.g. {@code NFTokenID} becomes {@code nftoken_id}.
     */
    public static String toSnakeName(final String name) {
        if (name.indexOf('_') >= 0) return name.toLowerCase(Locale.ROOT);
        return Json.toSnakeCase(name);
    }
}
