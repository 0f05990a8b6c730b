package io.funcomponent.core.error;

/** Thrown when a parameter default cannot be serialized to its declared type. */
public final class ValueSerializationException extends ComponentException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    public ValueSerializationException(String message, Throwable cause, String typeName) {
        super(message, cause, null, Phase.ANALYSIS);
        this.typeName = typeName;
    }

    public ValueSerializationException(String message, Throwable cause, String functionName, String typeName) {
        super(message, cause, functionName, Phase.ANALYSIS);
        this.typeName = typeName;
    }

    public ValueSerializationException(String message, String typeName) {
        super(message, null, Phase.ANALYSIS);
        this.typeName = typeName;
    }

    /** The type the value was serialized to. */
    public String typeName() {
        return typeName;
    }
}
