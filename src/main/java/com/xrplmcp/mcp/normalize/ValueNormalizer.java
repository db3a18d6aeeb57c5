package com.xrplmcp.mcp.normalize;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xrplmcp.mcp.ToolEngineOptions;
import com.xrplmcp.mcp.api.FieldKind;
import com.xrplmcp.mcp.api.FieldSchema;
import com.xrplmcp.mcp.api.FieldType;

/**
 * Rewrites caller input into the shape the ledger models expect: ledger-cased keys,
 * verbatim amounts, encoded currency codes and typed scalars. Never fails; values it
 * does not understand are passed through for the validator to judge.
 */
public class ValueNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ValueNormalizer.class);

    private final ToolEngineOptions options;
    private final CurrencyCodes currencyCodes;

    public ValueNormalizer(final ToolEngineOptions options) {
        this.options = options;
        this.currencyCodes = new CurrencyCodes(options.nativeCurrency(), options.currencyCodeWidth());
    }

    /**
     * Normalize a whole invocation input against the top-level fields of a model.
     * When two caller keys map to the same ledger key, the first one supplied wins.
     */
    public NormalizedInput normalizeInput(final Map<String, ?> raw, final List<FieldSchema> fields) {
        final Map<String, Object> values = new LinkedHashMap<>();
        final Map<String, String> callerKeys = new LinkedHashMap<>();
        if (raw == null) return new NormalizedInput(values, callerKeys);

        final Map<String, FieldSchema> byKey = index(fields);
        for (final Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getKey() == null) continue;
            final String ledgerKey = resolveKey(entry.getKey(), byKey);
            if (values.containsKey(ledgerKey)) {
                log.debug("Ignoring '{}': '{}' already supplied {}", entry.getKey(), callerKeys.get(ledgerKey), ledgerKey);
                continue;
            }
            values.put(ledgerKey, normalize(FieldNames.toSnakeName(ledgerKey), entry.getValue(), byKey.get(ledgerKey)));
            callerKeys.put(ledgerKey, entry.getKey());
        }
        return new NormalizedInput(values, callerKeys);
    }

    /**
     * Normalize a single value.
     *
     * @param fieldName snake_case field name, used for the amount and currency rules
     * @param raw       the value as supplied
     * @param schema    the field's schema, or null for keys the model does not know
     */
    public Object normalize(final String fieldName, final Object raw, final FieldSchema schema) {
        return normalizeValue(fieldName, raw, schema == null ? null : schema.type());
    }

    private Object normalizeValue(final String fieldName, final Object raw, final FieldType type) {
        if (raw == null) return null;

        if (raw instanceof Map<?, ?> map) {
            return normalizeMap(map, nestedFields(type, map));
        }
        if (raw instanceof List<?> list) {
            final FieldType element = type != null && type.kind() == FieldKind.SEQUENCE ? type.element() : type;
            final List<Object> out = new ArrayList<>(list.size());
            for (final Object item : list) {
                out.add(normalizeValue(fieldName, item, element));
            }
            return out;
        }
        if (options.isAmountField(fieldName)) {
            return preserveAmount(raw);
        }
        if (raw instanceof String s && options.isCurrencyField(fieldName)) {
            return currencyCodes.normalize(s);
        }
        if (raw instanceof String s && type != null && type.kind() == FieldKind.PRIMITIVE) {
            return type.scalar().coerce(s);
        }
        return raw;
    }

    private Map<String, Object> normalizeMap(final Map<?, ?> map, final List<FieldSchema> fields) {
        final Map<String, FieldSchema> byKey = index(fields);
        final Map<String, Object> out = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) continue;
            final String ledgerKey = resolveKey(String.valueOf(entry.getKey()), byKey);
            if (out.containsKey(ledgerKey)) continue;
            out.put(ledgerKey, normalize(FieldNames.toSnakeName(ledgerKey), entry.getValue(), byKey.get(ledgerKey)));
        }
        return out;
    }

    /**
     * Fields of the nested model a map value stands for. For unions, the first model
     * candidate whose fields cover every supplied key, else the first model candidate.
     */
    private static List<FieldSchema> nestedFields(final FieldType type, final Map<?, ?> map) {
        if (type == null) return List.of();
        return switch (type.kind()) {
            case MODEL -> type.fields();
            case SEQUENCE -> nestedFields(type.element(), map);
            case UNION -> {
                List<FieldSchema> first = null;
                for (final FieldType candidate : type.candidates()) {
                    if (candidate.kind() != FieldKind.MODEL) continue;
                    if (first == null) first = candidate.fields();
                    if (covers(candidate.fields(), map)) yield candidate.fields();
                }
                yield first == null ? List.of() : first;
            }
            default -> List.of();
        };
    }

    private static boolean covers(final List<FieldSchema> fields, final Map<?, ?> map) {
        final Map<String, FieldSchema> byKey = index(fields);
        for (final Object key : map.keySet()) {
            if (!byKey.containsKey(resolveKey(String.valueOf(key), byKey))) return false;
        }
        return true;
    }

    /** Amounts stay verbatim; numbers become their exact plain decimal string. */
    private static Object preserveAmount(final Object raw) {
        if (raw instanceof BigDecimal d) {
            return d.stripTrailingZeros().toPlainString();
        }
        if (raw instanceof Double || raw instanceof Float) {
            final double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return raw.toString();
            return new BigDecimal(raw.toString()).stripTrailingZeros().toPlainString();
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short
                || raw instanceof Byte || raw instanceof BigInteger) {
            return raw.toString();
        }
        return raw;
    }

    /**
     * Ledger key for a caller key. A spelling that differs from a known field only in case
     * ({@code InvoiceId} for {@code InvoiceID}) resolves to that field.
     */
    static String resolveKey(final String callerKey, final Map<String, FieldSchema> byKey) {
        final String ledgerKey = FieldNames.toLedgerKey(callerKey);
        if (byKey.containsKey(ledgerKey)) return ledgerKey;
        for (final String known : byKey.keySet()) {
            if (known.equalsIgnoreCase(ledgerKey)) return known;
        }
        return ledgerKey;
    }

    private static Map<String, FieldSchema> index(final List<FieldSchema> fields) {
        final Map<String, FieldSchema> byKey = new LinkedHashMap<>();
        if (fields != null) {
            for (final FieldSchema f : fields) {
                byKey.put(f.key(), f);
            }
        }
        return byKey;
    }
}
