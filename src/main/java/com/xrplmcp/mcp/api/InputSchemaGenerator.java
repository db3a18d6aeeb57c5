package com.xrplmcp.mcp.api;

import java.lang.reflect.Field;
import java.util.Arrays;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.xrplmcp.mcp.utils.Json;
import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

/**
 * Generates the JSON Schema of a tool's input from its model record using victools/jsonschema-generator.
 * Property names are the caller-facing snake_case names; unions become {@code anyOf}.
 */
public final class InputSchemaGenerator {
    private final SchemaGenerator generator;

    public InputSchemaGenerator() {
        final SchemaGeneratorConfigBuilder configBuilder =
            new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT)
                .with(Option.FLATTENED_OPTIONALS);
        configBuilder.forFields()
            .withPropertyNameOverrideResolver(field -> Json.toSnakeCase(field.getDeclaredName()))
            .withRequiredCheck(field -> {
                final Field raw = field.getRawMember();
                return SchemaExtractor.isRequired(raw, raw.getType());
            })
            .withDescriptionResolver(field -> {
                final ModelField mf = field.getAnnotation(ModelField.class);
                return mf == null || mf.value().isEmpty() ? null : mf.value();
            })
            .withDefaultResolver(field -> {
                final ModelField mf = field.getAnnotation(ModelField.class);
                if (mf == null || mf.defaultValue().isEmpty() || ModelField.REQUIRED.equals(mf.defaultValue())) {
                    return null;
                }
                final ScalarType scalar = ScalarType.inferFrom(field.getRawMember().getType());
                return scalar == null ? mf.defaultValue() : scalar.coerce(mf.defaultValue());
            })
            .withTargetTypeOverridesResolver(field -> {
                final AnyOf anyOf = field.getAnnotation(AnyOf.class);
                if (anyOf == null) return null;
                return Arrays.stream(anyOf.value()).map(c -> field.getContext().resolve(c)).toList();
            });
        configBuilder.forTypesInGeneral()
            .withDescriptionResolver(scope -> {
                final ModelDoc doc = scope.getType().getErasedType().getAnnotation(ModelDoc.class);
                return doc == null ? null : doc.value();
            });
        this.generator = new SchemaGenerator(configBuilder.build());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> generate(final Class<?> modelClass) {
        final ObjectNode schema = generator.generateSchema(modelClass);
        return Json.convertValue(schema, Map.class);
    }
}
