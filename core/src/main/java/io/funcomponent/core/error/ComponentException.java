package io.funcomponent.core.error;

/**
 * Abstract base for all compilation errors. Never thrown directly; use one of the concrete
 * subclasses. Every compile-time error aborts the whole compilation, there is no partial
 * specification.
 */
public abstract class ComponentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /** Reading a function definition or analyzing its signature. */
        ANALYSIS,
        /** Generating the program and assembling the specification. */
        ASSEMBLY
    }

    private final String functionName;
    private final Phase phase;

    protected ComponentException(String message, String functionName, Phase phase) {
        super(message);
        this.functionName = functionName;
        this.phase = phase;
    }

    protected ComponentException(String message, Throwable cause, String functionName, Phase phase) {
        super(message, cause);
        this.functionName = functionName;
        this.phase = phase;
    }

    /** The function being compiled, or {@code null} if not yet identified. */
    public String functionName() {
        return functionName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
