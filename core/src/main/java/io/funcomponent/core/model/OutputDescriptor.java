package io.funcomponent.core.model;

import java.util.Objects;

/**
 * A component output produced by signature analysis.
 *
 * @param name                externally visible, unique output name
 * @param type                canonical type name, {@code null} when untyped
 * @param passingStyle        one of the output passing styles
 * @param sourceParameterName the original parameter name for file-style outputs, else null
 * @param returnFieldName     the named-tuple field this output was derived from, else null
 */
public record OutputDescriptor(
        String name, String type, PassingStyle passingStyle, String sourceParameterName, String returnFieldName) {

    public OutputDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(passingStyle, "passingStyle must not be null");
        if (!passingStyle.isOutput()) {
            throw new IllegalArgumentException("Output '" + name + "' cannot use input passing style " + passingStyle);
        }
        if (passingStyle.isFileStyle() && sourceParameterName == null) {
            throw new IllegalArgumentException("File output '" + name + "' requires a source parameter");
        }
    }

    /** {@code true} if the value is produced by the function's return value. */
    public boolean isReturnValue() {
        return passingStyle == PassingStyle.BY_RETURN_VALUE;
    }
}
