package com.xrplmcp.models;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes one component of a ledger model: its documentation and, for optional
 * components, the default value applied when a caller leaves it out.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
public @interface ModelField {
    /** Sentinel value indicating the component is required (no default). */
    String REQUIRED = "\0__REQUIRED__";

    /** Component description shown to callers. */
    String value() default "";

    /**
     * Default value as a string, or {@link #REQUIRED} if the component is required.
     * An empty string marks an optional component without a default.
     */
    String defaultValue() default REQUIRED;
}
