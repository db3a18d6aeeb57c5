package com.xrplmcp.mcp.api;

/**
 * Two model definitions synthesize to the same tool name. Fatal at startup.
 */
public class RegistryConflictException extends RuntimeException {
    private final String toolName;

    public RegistryConflictException(final String toolName, final Class<?> first, final Class<?> second) {
        super("Tool name '" + toolName + "' is claimed by both " + first.getName() + " and " + second.getName());
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
