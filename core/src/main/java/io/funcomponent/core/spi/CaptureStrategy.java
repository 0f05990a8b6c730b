package io.funcomponent.core.spi;

import io.funcomponent.core.model.CompileOptions;
import io.funcomponent.core.model.FunctionDefinition;

/**
 * Embeds a function's executable body into the generated program.
 *
 * <p>Every implementation produces a Python fragment that, once executed, leaves the callable
 * bound under {@link FunctionDefinition#name()}.
 */
public interface CaptureStrategy {

    /**
     * Produces the program fragment defining the function.
     *
     * @param function the function to capture
     * @param options  call-site options (modules to capture and similar)
     * @return Python source text
     */
    String capture(FunctionDefinition function, CompileOptions options);
}
