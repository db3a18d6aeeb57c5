package com.xrplmcp.mcp.api;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.xrplmcp.mcp.normalize.FieldNames;
import com.xrplmcp.mcp.utils.Json;
import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelField;

/**
 * Reads the field schema of a model record via reflection. Results are cached per class.
 */
public class SchemaExtractor {
    private final Map<Class<?>, List<FieldSchema>> cache = new ConcurrentHashMap<>();

    /**
     * Extract the fields of a model in declaration order.
     *
     * @throws SchemaException if the class is not a record or declares no components
     */
    public List<FieldSchema> extract(final Class<?> modelClass) {
        final List<FieldSchema> cached = cache.get(modelClass);
        if (cached != null) return cached;
        // not computeIfAbsent: nested models recurse into the cache
        final List<FieldSchema> fields = extract(modelClass, new ArrayDeque<>());
        final List<FieldSchema> raced = cache.putIfAbsent(modelClass, fields);
        return raced != null ? raced : fields;
    }

    /**
     * Whether a component must be supplied by the caller: {@code Optional} components and
     * components with a declared default (including the empty "no default") are optional.
     */
    public static boolean isRequired(final AnnotatedElement element, final Class<?> rawType) {
        if (rawType == Optional.class) return false;
        final ModelField mf = element.getAnnotation(ModelField.class);
        return mf == null || ModelField.REQUIRED.equals(mf.defaultValue());
    }

    private List<FieldSchema> extract(final Class<?> modelClass, final Deque<Class<?>> inProgress) {
        if (!modelClass.isRecord()) {
            throw new SchemaException(modelClass, "not a record, no fields to expose");
        }
        final RecordComponent[] components = modelClass.getRecordComponents();
        if (components.length == 0) {
            throw new SchemaException(modelClass, "declares no fields");
        }

        inProgress.push(modelClass);
        try {
            final List<FieldSchema> fields = new ArrayList<>(components.length);
            for (final RecordComponent component : components) {
                fields.add(fieldOf(component, inProgress));
            }
            return List.copyOf(fields);
        } finally {
            inProgress.pop();
        }
    }

    private FieldSchema fieldOf(final RecordComponent component, final Deque<Class<?>> inProgress) {
        final String javaName = component.getName();
        final String name = Json.toSnakeCase(javaName);
        final ModelField mf = component.getAnnotation(ModelField.class);
        final boolean required = isRequired(component, component.getType());
        final String defaultValue = required || mf == null || mf.defaultValue().isEmpty() ? null : mf.defaultValue();

        Type valueType = component.getGenericType();
        if (component.getType() == Optional.class) {
            valueType = typeArgument(valueType);
        }
        final AnyOf anyOf = component.getAnnotation(AnyOf.class);
        final FieldType type = anyOf != null
            ? unionOf(anyOf.value(), inProgress)
            : typeOf(valueType, inProgress);

        return new FieldSchema(name, FieldNames.toLedgerKey(name), javaName, type, required, defaultValue,
            mf == null ? "" : mf.value());
    }

    private FieldType unionOf(final Class<?>[] candidates, final Deque<Class<?>> inProgress) {
        final List<FieldType> types = new ArrayList<>(candidates.length);
        for (final Class<?> candidate : candidates) {
            types.add(typeOf(candidate, inProgress));
        }
        return FieldType.union(types);
    }

    private FieldType typeOf(final Type type, final Deque<Class<?>> inProgress) {
        final Class<?> raw = rawClass(type);
        if (raw == null) return FieldType.opaque(Object.class);

        final ScalarType scalar = ScalarType.inferFrom(raw);
        if (scalar != null) return FieldType.primitive(raw, scalar);

        if (raw.isEnum()) return enumOf(raw);

        if (Collection.class.isAssignableFrom(raw)) {
            final Type element = typeArgument(type);
            return FieldType.sequence(raw, element == null ? FieldType.opaque(Object.class) : typeOf(element, inProgress));
        }

        if (raw.isRecord() && BaseModel.class.isAssignableFrom(raw)) {
            if (inProgress.contains(raw)) return FieldType.opaque(raw);
            final List<FieldSchema> cached = cache.get(raw);
            if (cached != null) return FieldType.model(raw, cached);
            try {
                final List<FieldSchema> nested = extract(raw, inProgress);
                cache.putIfAbsent(raw, nested);
                return FieldType.model(raw, nested);
            } catch (SchemaException e) {
                return FieldType.opaque(raw);
            }
        }

        return FieldType.opaque(raw);
    }

    private static FieldType enumOf(final Class<?> enumClass) {
        final List<EnumConstant> constants = new ArrayList<>();
        for (final Object constant : enumClass.getEnumConstants()) {
            final Enum<?> e = (Enum<?>) constant;
            constants.add(new EnumConstant(e.name(), String.valueOf(Json.convertValue(e, Object.class)), e));
        }
        return FieldType.enumOf(enumClass, constants);
    }

    private static Class<?> rawClass(final Type type) {
        if (type instanceof Class<?> c) return c;
        if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> c) return c;
        return null;
    }

    private static Type typeArgument(final Type type) {
        if (type instanceof ParameterizedType p && p.getActualTypeArguments().length > 0) {
            return p.getActualTypeArguments()[0];
        }
        return null;
    }
}
