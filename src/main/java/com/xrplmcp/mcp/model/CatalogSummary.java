package com.xrplmcp.mcp.model;

import java.util.List;
import java.util.Map;

/**
 * Registered tools grouped by category.
 */
public record CatalogSummary(int totalTools, Map<String, CategorySummary> categories) implements Displayable {

    public record CategorySummary(int count, List<ModelSummary> models) {
    }

    public record ModelSummary(String model, String tool, String description, int fieldCount) {
    }

    @Override
    public String toDisplayText() {
        final StringBuilder sb = new StringBuilder();
        sb.append(totalTools).append(" model tools available\n");
        for (final Map.Entry<String, CategorySummary> e : categories.entrySet()) {
            sb.append("\n").append(e.getKey()).append(" (").append(e.getValue().count()).append("):\n");
            for (final ModelSummary m : e.getValue().models()) {
                sb.append("    ").append(m.tool()).append(" - ").append(m.model())
                  .append(", ").append(m.fieldCount()).append(" fields\n");
            }
        }
        return sb.toString().stripTrailing();
    }
}
