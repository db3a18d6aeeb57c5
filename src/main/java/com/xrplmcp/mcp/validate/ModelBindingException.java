package com.xrplmcp.mcp.validate;

/**
 * A model refused the values it was constructed from.
 */
public class ModelBindingException extends RuntimeException {

    public ModelBindingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
