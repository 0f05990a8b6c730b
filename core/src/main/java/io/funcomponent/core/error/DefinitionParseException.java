package io.funcomponent.core.error;

/**
 * Thrown when a function definition YAML file has invalid syntax or missing required fields.
 * Carries the file or resource that caused the error.
 */
public final class DefinitionParseException extends ComponentException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public DefinitionParseException(String message, String functionName, String source) {
        super(message, functionName, Phase.ANALYSIS);
        this.source = source;
    }

    public DefinitionParseException(String message, Throwable cause, String functionName, String source) {
        super(message, cause, functionName, Phase.ANALYSIS);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
