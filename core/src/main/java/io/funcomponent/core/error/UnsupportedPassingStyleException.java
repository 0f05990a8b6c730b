package io.funcomponent.core.error;

import io.funcomponent.core.model.PassingStyle;

/**
 * Thrown when a descriptor reaches the argument scaffold with a passing style the scaffold cannot
 * handle for its direction. Indicates a broken contract between analysis and generation.
 */
public final class UnsupportedPassingStyleException extends ComponentException {

    private static final long serialVersionUID = 1L;

    private final PassingStyle passingStyle;

    public UnsupportedPassingStyleException(PassingStyle passingStyle, String functionName) {
        super("Unexpected data passing style: '" + passingStyle + "'", functionName, Phase.ASSEMBLY);
        this.passingStyle = passingStyle;
    }

    /** The offending passing style. */
    public PassingStyle passingStyle() {
        return passingStyle;
    }
}
