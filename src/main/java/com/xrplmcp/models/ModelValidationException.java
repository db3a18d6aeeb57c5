package com.xrplmcp.models;

/**
 * Raised by a model constructor when a combination of component values is not allowed.
 */
public class ModelValidationException extends RuntimeException {

    public ModelValidationException(String message) {
        super(message);
    }

    /**
     * Throws a {@code ModelValidationException} with the given message unless the condition holds.
     */
    public static void check(boolean condition, String message) {
        if (!condition) {
            throw new ModelValidationException(message);
        }
    }
}
