package com.xrplmcp.models;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares an {@code Object} component as a union of candidate shapes.
 * Candidates are tried left to right; the first one that accepts the value wins.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
public @interface AnyOf {
    Class<?>[] value();
}
