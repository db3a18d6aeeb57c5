package com.xrplmcp.mcp.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xrplmcp.mcp.ToolEngineOptions;
import com.xrplmcp.mcp.model.EnumViolation;
import com.xrplmcp.mcp.model.InvocationResult;
import com.xrplmcp.mcp.model.ModelConstructionError;
import com.xrplmcp.mcp.model.SchemaReport;
import com.xrplmcp.mcp.model.ValidationError;
import com.xrplmcp.mcp.normalize.NormalizedInput;
import com.xrplmcp.mcp.normalize.ValueNormalizer;
import com.xrplmcp.mcp.utils.Json;
import com.xrplmcp.mcp.validate.Binding;
import com.xrplmcp.mcp.validate.EnumProblem;
import com.xrplmcp.mcp.validate.ModelBinder;
import com.xrplmcp.mcp.validate.ModelBindingException;
import com.xrplmcp.mcp.validate.Validator;
import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;

/**
 * Turns a model class into a {@link SynthesizedTool}: name, description, input schema
 * and the normalize/validate/construct closure.
 */
public class ToolSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(ToolSynthesizer.class);

    private static final String AMOUNT_EXAMPLE = "1000000";
    private static final String CURRENCY_EXAMPLE = "USD";

    private final ToolEngineOptions options;
    private final SchemaExtractor extractor;
    private final ValueNormalizer normalizer;
    private final InputSchemaGenerator schemaGenerator;

    public ToolSynthesizer(final ToolEngineOptions options, final SchemaExtractor extractor) {
        this.options = options;
        this.extractor = extractor;
        this.normalizer = new ValueNormalizer(options);
        this.schemaGenerator = new InputSchemaGenerator();
    }

    public static String toolName(final String category, final Class<?> modelClass) {
        return (category + "_" + modelClass.getSimpleName()).toLowerCase(Locale.ROOT);
    }

    /**
     * Build the tool for one model class.
     *
     * @throws SchemaException if the class exposes no fields
     */
    public SynthesizedTool synthesize(final Class<?> modelClass, final String category) {
        final List<FieldSchema> fields = extractor.extract(modelClass);
        final String name = toolName(category, modelClass);
        return new SynthesizedTool(name, category, modelClass, fields,
            buildDescription(modelClass, fields),
            schemaGenerator.generate(modelClass),
            invocation(name, modelClass, fields));
    }

    private Function<Map<String, ?>, InvocationResult> invocation(final String name, final Class<?> modelClass,
                                                                  final List<FieldSchema> fields) {
        return input -> {
            final NormalizedInput normalized = normalizer.normalizeInput(input, fields);
            final Collection<String> provided = normalized.callerKeys().values();
            final Binding binding = Validator.bind(fields, normalized.values());

            if (!binding.isStructurallyValid()) {
                return InvocationResult.failure(new ValidationError(name, binding.missing(), binding.mismatched(),
                    SchemaReport.of(modelClass, fields, provided)));
            }
            if (!binding.enumProblems().isEmpty()) {
                final EnumProblem first = binding.enumProblems().get(0);
                return InvocationResult.failure(new EnumViolation(name, first.path(), first.value(), first.legalValues(),
                    binding.enumProblems().stream().map(EnumProblem::message).toList(),
                    SchemaReport.of(modelClass, fields, provided)));
            }
            if (log.isDebugEnabled()) {
                final List<String> unknown = unknownKeys(normalized, fields);
                if (!unknown.isEmpty()) {
                    log.debug("{}: dropping unknown fields {}", name, unknown);
                }
            }

            try {
                final Object instance = ModelBinder.construct(modelClass, Validator.materialize(binding.values()));
                final BaseModel model = (BaseModel) instance;
                return InvocationResult.success(model, ModelBinder.canonical(model));
            } catch (ModelBindingException e) {
                log.debug("{} rejected input: {}", name, e.getMessage());
                return InvocationResult.failure(new ModelConstructionError(name, e.getMessage(),
                    SchemaReport.of(modelClass, fields, provided)));
            }
        };
    }

    private static List<String> unknownKeys(final NormalizedInput normalized, final List<FieldSchema> fields) {
        final List<String> unknown = new ArrayList<>();
        for (final Map.Entry<String, String> e : normalized.callerKeys().entrySet()) {
            if (fields.stream().noneMatch(f -> f.key().equals(e.getKey()))) {
                unknown.add(e.getValue());
            }
        }
        return unknown;
    }

    private String buildDescription(final Class<?> modelClass, final List<FieldSchema> fields) {
        final StringBuilder sb = new StringBuilder();
        sb.append("Create a ").append(modelClass.getSimpleName())
          .append(" model and return its canonical ledger representation.");
        final ModelDoc doc = modelClass.getAnnotation(ModelDoc.class);
        if (doc != null) {
            sb.append("\n").append(doc.value());
        }

        final List<FieldSchema> required = fields.stream().filter(FieldSchema::required).toList();
        final List<FieldSchema> optional = fields.stream().filter(f -> !f.required()).toList();
        if (!required.isEmpty()) {
            sb.append("\n\n    Required fields:\n");
            required.forEach(f -> appendField(sb, f));
        }
        if (!optional.isEmpty()) {
            sb.append("\n    Optional fields:\n");
            optional.forEach(f -> appendField(sb, f));
        }
        return sb.toString().stripTrailing();
    }

    private void appendField(final StringBuilder sb, final FieldSchema f) {
        sb.append("        ").append(f.name()).append(" (").append(f.type().describe()).append(")");
        if (!f.description().isEmpty()) {
            sb.append(": ").append(f.description());
        }
        if (f.type().kind() == FieldKind.ENUM) {
            sb.append(". Valid values: ").append(f.type().enumValues());
        } else {
            sb.append(". Example: ").append(Json.serialize(exampleValue(f.name(), f.type())));
        }
        if (f.hasDefault()) {
            sb.append(" (default: ").append(f.defaultValue()).append(")");
        }
        sb.append("\n");
    }

    /** One representative value for a field, built from its type and semantic name. */
    private Object exampleValue(final String fieldName, final FieldType type) {
        if (type.kind() == FieldKind.MODEL) {
            final Map<String, Object> example = new LinkedHashMap<>();
            for (final FieldSchema nested : type.fields()) {
                if (nested.required()) {
                    example.put(nested.name(), exampleValue(nested.name(), nested.type()));
                }
            }
            return example;
        }
        if (options.isAmountField(fieldName)) return AMOUNT_EXAMPLE;
        if (options.isCurrencyField(fieldName)) return CURRENCY_EXAMPLE;

        return switch (type.kind()) {
            case PRIMITIVE -> type.scalar().example();
            case ENUM -> type.enumValues().isEmpty() ? "" : type.enumValues().get(0);
            case SEQUENCE -> List.of(exampleValue(fieldName, type.element()));
            case UNION -> exampleValue(fieldName, type.candidates().get(0));
            case MODEL, OPAQUE -> Map.of();
        };
    }
}
