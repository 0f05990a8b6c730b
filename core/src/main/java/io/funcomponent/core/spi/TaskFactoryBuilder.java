package io.funcomponent.core.spi;

import io.funcomponent.core.model.ComponentSpecification;

/**
 * Turns a compiled component into a factory for pipeline tasks. Provided by the orchestration
 * layer.
 *
 * @param <F> the factory type
 */
@FunctionalInterface
public interface TaskFactoryBuilder<F> {

    /**
     * Builds a task factory from a component specification.
     *
     * @param specification the compiled component
     * @return a factory producing pipeline tasks
     */
    F build(ComponentSpecification specification);
}
