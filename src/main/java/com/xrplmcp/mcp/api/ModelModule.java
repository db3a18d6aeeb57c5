package com.xrplmcp.mcp.api;

import java.util.List;

/**
 * A source of model definitions sharing one tool category.
 */
public interface ModelModule {

    /** Category label used as the tool name prefix, e.g. {@code transaction}. */
    String category();

    /** Every class-like definition the module exports, models and supporting types alike. */
    List<Class<?>> definitions();

    static ModelModule of(final String category, final List<Class<?>> definitions) {
        return new Fixed(category, List.copyOf(definitions));
    }

    record Fixed(String category, List<Class<?>> definitions) implements ModelModule {
    }
}
