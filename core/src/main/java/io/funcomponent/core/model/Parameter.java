package io.funcomponent.core.model;

import java.util.Objects;

/**
 * A single declared function parameter.
 *
 * <p>{@code hasDefault} distinguishes "no default" from "default is {@code None}": the latter has
 * {@code hasDefault == true} and a {@code null} {@code defaultValue}.
 */
public record Parameter(String name, TypeAnnotation annotation, boolean hasDefault, Object defaultValue) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        annotation = annotation == null ? TypeAnnotation.EMPTY : annotation;
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("defaultValue given for parameter '" + name + "' without hasDefault");
        }
    }

    /** A parameter without a default value. */
    public static Parameter required(String name, TypeAnnotation annotation) {
        return new Parameter(name, annotation, false, null);
    }

    /** A parameter with a default value, which may be {@code null}. */
    public static Parameter withDefault(String name, TypeAnnotation annotation, Object defaultValue) {
        return new Parameter(name, annotation, true, defaultValue);
    }
}
