package com.xrplmcp.mcp.validate;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.xrplmcp.mcp.normalize.FieldNames;
import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelValidationException;

/**
 * Builds model records from ledger-keyed maps and renders them back to their canonical ledger form.
 * Components are converted one by one and passed to the canonical constructor, so values that are
 * already model instances (resolved union alternatives) reach the model unchanged.
 */
public final class ModelBinder {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new Jdk8Module())
        .setPropertyNamingStrategy(new LedgerNamingStrategy())
        .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
        .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private ModelBinder() {}

    /**
     * Construct a model from ledger-keyed values. Keys the model does not declare are ignored.
     *
     * @throws ModelBindingException with the model's own message if the model rejects the values
     */
    public static <T> T construct(final Class<T> modelClass, final Map<String, ?> values) {
        final RecordComponent[] components = modelClass.getRecordComponents();
        if (components == null) {
            throw new ModelBindingException(modelClass.getSimpleName() + " is not a record", null);
        }
        final Class<?>[] types = new Class<?>[components.length];
        final Object[] args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            final RecordComponent c = components[i];
            types[i] = c.getType();
            final String key = FieldNames.toLedgerKey(c.getName());
            try {
                args[i] = adapt(values.get(key), c.getGenericType());
            } catch (IllegalArgumentException e) {
                throw new ModelBindingException(key + ": " + describe(e), e);
            }
        }

        try {
            final Constructor<T> ctor = modelClass.getDeclaredConstructor(types);
            return ctor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new ModelBindingException(describe(e.getCause()), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ModelBindingException("Cannot construct " + modelClass.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Canonical ledger representation: type fields first, then every present field under its ledger key.
     */
    public static Map<String, Object> canonical(final BaseModel instance) {
        final Map<String, Object> out = new LinkedHashMap<>(instance.typeFields());
        out.putAll(MAPPER.convertValue(instance, MAP_TYPE));
        return out;
    }

    private static Object adapt(final Object value, final Type target) {
        final Class<?> raw = rawClass(target);
        if (raw == Optional.class) {
            return Optional.ofNullable(adapt(value, typeArgument(target)));
        }
        if (value == null || raw == null || raw == Object.class) {
            return value;
        }
        if (value instanceof Collection<?> items && Collection.class.isAssignableFrom(raw)) {
            final Type element = typeArgument(target);
            final List<Object> out = new ArrayList<>(items.size());
            for (final Object item : items) {
                out.add(adapt(item, element));
            }
            return Collections.unmodifiableList(out);
        }
        if (raw.isInstance(value)) {
            return value;
        }
        return MAPPER.convertValue(value, MAPPER.getTypeFactory().constructType(target));
    }

    /**
     * The message a caller should see: the model's own validation message if there is one,
     * otherwise Jackson's description of the problem without location noise.
     */
    static String describe(final Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ModelValidationException) return t.getMessage();
        }
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof JsonMappingException jme) return jme.getOriginalMessage();
        }
        return String.valueOf(failure.getMessage());
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
        return Object.class;
    }

    /** Jackson naming strategy producing ledger keys, e.g. {@code nftokenTaxon} to {@code NFTokenTaxon}. */
    static final class LedgerNamingStrategy extends PropertyNamingStrategies.NamingBase {
        private static final long serialVersionUID = 1L;

        @Override
        public String translate(final String propertyName) {
            return FieldNames.toLedgerKey(propertyName);
        }
    }
}
