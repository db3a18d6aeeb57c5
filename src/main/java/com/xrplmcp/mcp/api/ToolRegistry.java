package com.xrplmcp.mcp.api;

import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xrplmcp.mcp.model.ToolSummary;
import com.xrplmcp.models.BaseModel;

/**
 * Catalogue of synthesized tools, built once from a fixed module list and read-only afterwards.
 */
public class ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, SynthesizedTool> tools;

    private ToolRegistry(final Map<String, SynthesizedTool> tools) {
        this.tools = tools;
    }

    /**
     * Scan every module and register one tool per model definition.
     *
     * @throws RegistryConflictException if two definitions produce the same tool name
     */
    public static ToolRegistry build(final List<? extends ModelModule> modules, final ToolSynthesizer synthesizer) {
        final Map<String, SynthesizedTool> tools = new LinkedHashMap<>();

        for (final ModelModule module : modules) {
            int registered = 0;
            for (final Class<?> definition : module.definitions()) {
                if (!isModelDefinition(definition)) {
                    log.debug("Skipping non-model definition {}", definition.getName());
                    continue;
                }

                final SynthesizedTool tool;
                try {
                    tool = synthesizer.synthesize(definition, module.category());
                } catch (SchemaException e) {
                    log.warn("Skipping model {}: {}", definition.getName(), e.getMessage());
                    continue;
                }

                final SynthesizedTool existing = tools.putIfAbsent(tool.getName(), tool);
                if (existing != null) {
                    throw new RegistryConflictException(tool.getName(), existing.getModelClass(), definition);
                }
                log.debug("Registered tool {} ({} fields)", tool.getName(), tool.getFields().size());
                registered++;
            }
            log.info("Discovered {} {} models", registered, module.category());
        }

        log.info("Registered {} model tools", tools.size());
        return new ToolRegistry(Collections.unmodifiableMap(tools));
    }

    /**
     * Whether a definition is a concrete, public model: interfaces, abstract bases, enums,
     * annotations, flag holders and classes outside the {@link BaseModel} hierarchy are not.
     */
    public static boolean isModelDefinition(final Class<?> definition) {
        final int modifiers = definition.getModifiers();
        final String simpleName = definition.getSimpleName();
        return !definition.isInterface()
            && !definition.isAnnotation()
            && !definition.isEnum()
            && !Modifier.isAbstract(modifiers)
            && Modifier.isPublic(modifiers)
            && BaseModel.class.isAssignableFrom(definition)
            && !simpleName.endsWith("Flag")
            && !simpleName.endsWith("Interface");
    }

    public Optional<SynthesizedTool> find(final String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    /** All tools in registration order. */
    public Collection<SynthesizedTool> tools() {
        return tools.values();
    }

    public List<ToolSummary> listTools() {
        return tools.values().stream().map(SynthesizedTool::toSummary).toList();
    }

    public int size() {
        return tools.size();
    }
}
