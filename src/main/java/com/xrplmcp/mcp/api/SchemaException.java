package com.xrplmcp.mcp.api;

/**
 * A model definition that cannot be turned into a field schema.
 * The registry skips the class instead of aborting.
 */
public class SchemaException extends RuntimeException {
    private final Class<?> modelClass;

    public SchemaException(Class<?> modelClass, String message) {
        super(modelClass.getName() + ": " + message);
        this.modelClass = modelClass;
    }

    public Class<?> getModelClass() {
        return modelClass;
    }
}
