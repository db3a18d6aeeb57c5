package com.xrplmcp.mcp.validate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.xrplmcp.mcp.api.EnumConstant;
import com.xrplmcp.mcp.api.FieldKind;
import com.xrplmcp.mcp.api.FieldSchema;
import com.xrplmcp.mcp.api.FieldType;
import com.xrplmcp.mcp.api.ScalarType;

/**
 * Checks normalized input against a field schema and binds it into constructor-ready values.
 * Every problem is collected; nothing is thrown.
 */
public final class Validator {

    private Validator() {}

    /**
     * Bind ledger-keyed values to the given fields. Keys without a field are dropped, absent
     * optional fields receive their declared default.
     */
    public static Binding bind(final List<FieldSchema> fields, final Map<String, ?> values) {
        final Problems problems = new Problems();
        final Map<String, Object> bound = bindFields(fields, values, "", problems);
        return new Binding(bound, problems.missing, problems.mismatched, problems.enums);
    }

    /**
     * Construct every nested model held in bound values, leaving other values as they are.
     *
     * @throws ModelBindingException if a nested model rejects its values
     */
    public static Map<String, Object> materialize(final Map<String, Object> values) {
        final Map<String, Object> out = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> e : values.entrySet()) {
            out.put(e.getKey(), materializeValue(e.getValue()));
        }
        return out;
    }

    private static Object materializeValue(final Object value) {
        if (value instanceof BoundModel model) {
            return ModelBinder.construct(model.modelClass(), materialize(model.values()));
        }
        if (value instanceof List<?> list) {
            final List<Object> out = new ArrayList<>(list.size());
            for (final Object item : list) {
                out.add(materializeValue(item));
            }
            return out;
        }
        return value;
    }

    private static Map<String, Object> bindFields(final List<FieldSchema> fields, final Map<String, ?> values,
                                                  final String prefix, final Problems problems) {
        final Map<String, Object> out = new LinkedHashMap<>();
        for (final FieldSchema f : fields) {
            final String path = prefix.isEmpty() ? f.name() : prefix + "." + f.name();
            Object value = values.get(f.key());
            if (value == null) {
                if (f.required()) {
                    problems.missing.add(path);
                    continue;
                }
                if (!f.hasDefault()) continue;
                value = f.defaultValue();
            }
            final Object bound = bindValue(f.type(), value, path, problems);
            if (bound != null) {
                out.put(f.key(), bound);
            }
        }
        return out;
    }

    private static Object bindValue(final FieldType type, final Object value, final String path, final Problems problems) {
        return switch (type.kind()) {
            case PRIMITIVE -> {
                if (value instanceof String s) yield type.scalar().coerce(s);
                if (!isWholeNumberType(type.scalar())) yield value;
                final Object whole = wholeNumber(value, type.scalar());
                if (whole == null) {
                    problems.mismatched.add(path);
                }
                yield whole;
            }
            case ENUM -> {
                final Optional<EnumConstant> match = type.matchEnum(value);
                if (match.isEmpty()) {
                    problems.enums.add(new EnumProblem(path, value, type.enumValues()));
                    yield null;
                }
                yield match.get().constant();
            }
            case MODEL -> value instanceof Map<?, ?> map
                ? new BoundModel(type.javaType(), bindFields(type.fields(), stringKeys(map), path, problems))
                : value;
            case SEQUENCE -> {
                if (!(value instanceof List<?> list)) yield value;
                final List<Object> out = new ArrayList<>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    out.add(bindValue(type.element(), list.get(i), path + "[" + i + "]", problems));
                }
                yield out;
            }
            case UNION -> {
                for (final FieldType candidate : type.candidates()) {
                    if (matches(candidate, value)) {
                        yield bindValue(candidate, value, path, problems);
                    }
                }
                final Optional<FieldType> model = value instanceof Map<?, ?>
                    ? type.candidates().stream().filter(c -> c.kind() == FieldKind.MODEL).findFirst()
                    : Optional.empty();
                if (model.isPresent()) {
                    // the first model alternative reports what it is missing
                    yield bindValue(model.get(), value, path, problems);
                }
                problems.mismatched.add(path);
                yield null;
            }
            case OPAQUE -> value;
        };
    }

    /**
     * Whether a value can stand for a union alternative. A map matches a model when it supplies
     * every required field; keys the model does not declare are dropped later.
     */
    static boolean matches(final FieldType candidate, final Object value) {
        return switch (candidate.kind()) {
            case PRIMITIVE -> candidate.scalar().accepts(value);
            case ENUM -> candidate.matchEnum(value).isPresent();
            case MODEL -> value instanceof Map<?, ?> map && coversModel(candidate.fields(), map);
            case SEQUENCE -> value instanceof List<?>;
            case UNION -> candidate.candidates().stream().anyMatch(c -> matches(c, value));
            case OPAQUE -> true;
        };
    }

    private static boolean coversModel(final List<FieldSchema> fields, final Map<?, ?> map) {
        for (final FieldSchema f : fields) {
            if (f.required() && map.get(f.key()) == null) return false;
        }
        return true;
    }

    private static boolean isWholeNumberType(final ScalarType scalar) {
        return scalar == ScalarType.INTEGER || scalar == ScalarType.LONG;
    }

    /**
     * The value as an {@code Integer} or {@code Long} when it is a number without a fraction
     * that fits the type, otherwise null.
     */
    private static Object wholeNumber(final Object value, final ScalarType scalar) {
        if (!(value instanceof Number n)) return null;
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) return null;
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) return null;
        try {
            final long exact = new BigDecimal(n.toString()).longValueExact();
            return scalar == ScalarType.INTEGER ? (Object) Math.toIntExact(exact) : (Object) exact;
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }

    private static Map<String, Object> stringKeys(final Map<?, ?> map) {
        final Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static final class Problems {
        final List<String> missing = new ArrayList<>();
        final List<String> mismatched = new ArrayList<>();
        final List<EnumProblem> enums = new ArrayList<>();
    }
}
