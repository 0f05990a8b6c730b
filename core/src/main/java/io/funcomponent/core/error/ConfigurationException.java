package io.funcomponent.core.error;

/**
 * Thrown when a function or its call-site options describe a component that cannot be built: a
 * default value on a file or stream parameter, or a call-site image that conflicts with the
 * image attached to the function.
 */
public final class ConfigurationException extends ComponentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message, String functionName, Phase phase) {
        super(message, functionName, phase);
    }
}
