package com.xrplmcp.mcp.api;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.xrplmcp.mcp.model.InvocationResult;
import com.xrplmcp.mcp.model.ToolDefinition;
import com.xrplmcp.mcp.model.ToolSummary;

/**
 * Runtime tool built from a model class. Immutable; safe to invoke from any thread.
 */
public class SynthesizedTool {
    private final String name;              // <category>_<model>, lower-cased
    private final String category;
    private final Class<?> modelClass;
    private final List<FieldSchema> fields;
    private final String description;       // includes generated field listing
    private final Map<String, Object> inputSchema;
    private final Function<Map<String, ?>, InvocationResult> invoker;

    SynthesizedTool(final String name, final String category, final Class<?> modelClass,
                    final List<FieldSchema> fields, final String description,
                    final Map<String, Object> inputSchema,
                    final Function<Map<String, ?>, InvocationResult> invoker) {
        this.name = name;
        this.category = category;
        this.modelClass = modelClass;
        this.fields = List.copyOf(fields);
        this.description = description;
        this.inputSchema = inputSchema;
        this.invoker = invoker;
    }

    /**
     * Normalize, validate and construct. Never throws for bad input; failures come back as diagnostics.
     */
    public InvocationResult invoke(final Map<String, ?> input) {
        return invoker.apply(input == null ? Map.of() : input);
    }

    public ToolSummary toSummary() {
        return new ToolSummary(name, description);
    }

    public ToolDefinition toDefinition() {
        return new ToolDefinition(name, category, description, inputSchema);
    }

    public String getName() { return name; }
    public String getCategory() { return category; }
    public Class<?> getModelClass() { return modelClass; }
    public List<FieldSchema> getFields() { return fields; }
    public String getDescription() { return description; }
    public Map<String, Object> getInputSchema() { return inputSchema; }
}
