package io.funcomponent.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declarative, serializable description of a compiled component. Immutable.
 *
 * <p>Signature analysis produces a specification without {@code implementation}; the compiler
 * attaches the container implementation via {@link #withImplementation(ContainerImplementation)}.
 */
public record ComponentSpecification(
        String name,
        String description,
        List<InputDescriptor> inputs,
        List<OutputDescriptor> outputs,
        ContainerImplementation implementation) {

    public ComponentSpecification {
        Objects.requireNonNull(name, "name must not be null");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /** Returns a copy carrying the given container implementation. */
    public ComponentSpecification withImplementation(ContainerImplementation containerImplementation) {
        return new ComponentSpecification(name, description, inputs, outputs, containerImplementation);
    }

    /** Outputs written through function parameters, in declaration order. */
    public List<OutputDescriptor> fileOutputs() {
        return outputs.stream().filter(o -> !o.isReturnValue()).toList();
    }

    /** Outputs produced by the function's return value, in descriptor order. */
    public List<OutputDescriptor> returnOutputs() {
        return outputs.stream().filter(OutputDescriptor::isReturnValue).toList();
    }
}
