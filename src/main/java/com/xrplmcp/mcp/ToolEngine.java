package com.xrplmcp.mcp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xrplmcp.mcp.api.LedgerModules;
import com.xrplmcp.mcp.api.ModelModule;
import com.xrplmcp.mcp.api.SchemaExtractor;
import com.xrplmcp.mcp.api.SynthesizedTool;
import com.xrplmcp.mcp.api.ToolRegistry;
import com.xrplmcp.mcp.api.ToolSynthesizer;
import com.xrplmcp.mcp.model.CatalogSummary;
import com.xrplmcp.mcp.model.CatalogSummary.CategorySummary;
import com.xrplmcp.mcp.model.CatalogSummary.ModelSummary;
import com.xrplmcp.mcp.model.InvocationResult;
import com.xrplmcp.mcp.model.ModelConstructionError;
import com.xrplmcp.mcp.model.SchemaReport;
import com.xrplmcp.mcp.model.ToolDefinition;
import com.xrplmcp.mcp.model.ToolSummary;
import com.xrplmcp.mcp.model.UnknownTool;
import com.xrplmcp.mcp.utils.Json;
import com.xrplmcp.models.ModelDoc;

/**
 * Entry point for protocol servers: lists the synthesized model tools and invokes them.
 * The registry is built completely before the engine is returned, so every method is safe
 * to call from any number of threads.
 */
public final class ToolEngine {
    private static final Logger log = LoggerFactory.getLogger(ToolEngine.class);

    private final ToolRegistry registry;

    private ToolEngine(final ToolRegistry registry) {
        this.registry = registry;
    }

    /**
     * Build an engine over the given modules.
     *
     * @throws com.xrplmcp.mcp.api.RegistryConflictException if two models claim the same tool name
     */
    public static ToolEngine create(final ToolEngineOptions options, final List<? extends ModelModule> modules) {
        final ToolSynthesizer synthesizer = new ToolSynthesizer(options, new SchemaExtractor());
        return new ToolEngine(ToolRegistry.build(modules, synthesizer));
    }

    /** Engine over the ledger model library with options from the classpath and system properties. */
    public static ToolEngine create() {
        return create(ToolEngineOptions.load(), LedgerModules.all());
    }

    /** Process-wide engine, built on first use. */
    public static ToolEngine getDefault() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        static final ToolEngine INSTANCE = create();
    }

    public ToolRegistry registry() {
        return registry;
    }

    public List<ToolSummary> listTools() {
        return registry.listTools();
    }

    /**
     * Invoke a tool by name. Never throws: unknown names and unexpected failures are returned
     * as diagnostics.
     */
    public InvocationResult invoke(final String name, final Map<String, ?> input) {
        final Optional<SynthesizedTool> tool = registry.find(name);
        if (tool.isEmpty()) {
            return InvocationResult.failure(new UnknownTool(name));
        }
        try {
            return tool.get().invoke(input);
        } catch (RuntimeException e) {
            log.warn("Tool {} failed unexpectedly", name, e);
            final SynthesizedTool t = tool.get();
            final List<String> provided = input == null ? List.of() : List.copyOf(input.keySet());
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return InvocationResult.failure(new ModelConstructionError(name, message,
                SchemaReport.of(t.getModelClass(), t.getFields(), provided)));
        }
    }

    public List<ToolDefinition> toolDefinitions() {
        return registry.tools().stream().map(SynthesizedTool::toDefinition).toList();
    }

    /** Tool definitions as the JSON document served for discovery: {@code {"tools": [...]}}. */
    public String toolsJson() {
        return Json.serialize(Map.of("tools", toolDefinitions()));
    }

    /**
     * Tools grouped by category, in registration order.
     */
    public CatalogSummary listAvailableModelTools() {
        final Map<String, List<ModelSummary>> byCategory = new LinkedHashMap<>();
        for (final SynthesizedTool tool : registry.tools()) {
            byCategory.computeIfAbsent(tool.getCategory(), k -> new ArrayList<>())
                .add(new ModelSummary(tool.getModelClass().getSimpleName(), tool.getName(),
                    summaryOf(tool), tool.getFields().size()));
        }
        final Map<String, CategorySummary> categories = new LinkedHashMap<>();
        byCategory.forEach((category, models) ->
            categories.put(category, new CategorySummary(models.size(), List.copyOf(models))));
        return new CatalogSummary(registry.size(), categories);
    }

    /**
     * Field report of a registered model, looked up by class name ignoring case.
     */
    public Optional<SchemaReport> getModelSchema(final String modelName) {
        if (modelName == null) return Optional.empty();
        final String wanted = modelName.trim().toLowerCase(Locale.ROOT);
        return registry.tools().stream()
            .filter(t -> t.getModelClass().getSimpleName().toLowerCase(Locale.ROOT).equals(wanted))
            .findFirst()
            .map(t -> SchemaReport.of(t.getModelClass(), t.getFields(), List.of()));
    }

    private static String summaryOf(final SynthesizedTool tool) {
        final ModelDoc doc = tool.getModelClass().getAnnotation(ModelDoc.class);
        if (doc != null) return doc.value();
        final String description = tool.getDescription();
        final int newline = description.indexOf('\n');
        return newline < 0 ? description : description.substring(0, newline);
    }
}
