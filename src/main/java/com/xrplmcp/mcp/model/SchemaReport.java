package com.xrplmcp.mcp.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xrplmcp.mcp.api.FieldKind;
import com.xrplmcp.mcp.api.FieldSchema;

/**
 * Description of a model's fields, attached to every diagnostic so the caller can fix the input.
 */
public record SchemaReport(
    String model,
    List<String> requiredFields,
    List<String> optionalFields,
    List<String> providedFields,
    Map<String, FieldReport> fields
) implements Displayable {

    public static SchemaReport of(final Class<?> modelClass, final List<FieldSchema> schema,
                                  final Collection<String> provided) {
        final Map<String, FieldReport> fields = new LinkedHashMap<>();
        for (final FieldSchema f : schema) {
            fields.put(f.name(), new FieldReport(
                f.type().describe(),
                f.required(),
                f.type().kind() == FieldKind.ENUM ? f.type().enumValues() : null,
                f.defaultValue(),
                f.description()));
        }
        return new SchemaReport(
            modelClass.getSimpleName(),
            schema.stream().filter(FieldSchema::required).map(FieldSchema::name).toList(),
            schema.stream().filter(f -> !f.required()).map(FieldSchema::name).toList(),
            List.copyOf(provided),
            Collections.unmodifiableMap(fields));
    }

    @Override
    public String toDisplayText() {
        final StringBuilder sb = new StringBuilder();
        sb.append(model).append(" fields:\n");
        for (final Map.Entry<String, FieldReport> e : fields.entrySet()) {
            final FieldReport f = e.getValue();
            sb.append("    ").append(e.getKey()).append(" (").append(f.type())
              .append(f.required() ? ", required" : ", optional").append(")");
            if (f.description() != null && !f.description().isEmpty()) {
                sb.append(": ").append(f.description());
            }
            if (f.enumValues() != null) {
                sb.append(" Valid values: ").append(f.enumValues());
            }
            if (f.defaultValue() != null) {
                sb.append(" (default: ").append(f.defaultValue()).append(")");
            }
            sb.append("\n");
        }
        if (!providedFields.isEmpty()) {
            sb.append("Provided: ").append(providedFields);
        }
        return sb.toString().stripTrailing();
    }
}
