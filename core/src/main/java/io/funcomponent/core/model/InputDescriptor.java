package io.funcomponent.core.model;

import java.util.Objects;

/**
 * A component input produced by signature analysis.
 *
 * @param name                externally visible, unique input name
 * @param type                canonical type name, {@code null} when untyped
 * @param optional            {@code true} if the parameter declared a default
 * @param defaultValue        serialized default, {@code null} unless optional with a non-null default
 * @param passingStyle        one of the input passing styles
 * @param sourceParameterName the original parameter name, used for generated variable names
 */
public record InputDescriptor(
        String name,
        String type,
        boolean optional,
        String defaultValue,
        PassingStyle passingStyle,
        String sourceParameterName) {

    public InputDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(passingStyle, "passingStyle must not be null");
        Objects.requireNonNull(sourceParameterName, "sourceParameterName must not be null");
        if (passingStyle.isOutput()) {
            throw new IllegalArgumentException("Input '" + name + "' cannot use output passing style " + passingStyle);
        }
        if (optional && passingStyle.isFileStyle()) {
            throw new IllegalArgumentException("File input '" + name + "' cannot be optional");
        }
        if (!optional && defaultValue != null) {
            throw new IllegalArgumentException("Required input '" + name + "' cannot carry a default");
        }
    }
}
