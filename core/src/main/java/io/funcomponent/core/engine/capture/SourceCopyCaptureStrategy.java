package io.funcomponent.core.engine.capture;

import io.funcomponent.core.error.ComponentException;
import io.funcomponent.core.error.ConfigurationException;
import io.funcomponent.core.model.CompileOptions;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.model.TypeAnnotation;
import io.funcomponent.core.spi.CaptureStrategy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Captures a function by copying its literal source.
 *
 * <p>Leading decorator lines are dropped and the remaining lines are dedented by the indentation
 * of the {@code def} line, so functions nested in another scope become top-level definitions.
 * Named-tuple return annotations need {@code NamedTuple} in scope, so its import is prepended.
 */
public final class SourceCopyCaptureStrategy implements CaptureStrategy {

    static final String NAMED_TUPLE_IMPORT = "from typing import NamedTuple\n";

    @Override
    public String capture(FunctionDefinition function, CompileOptions options) {
        String source = function.source();
        if (source == null || source.isBlank()) {
            throw new ConfigurationException(
                    "Source code of function '" + function.name() + "' is not available",
                    function.name(),
                    ComponentException.Phase.ASSEMBLY);
        }
        List<String> lines = new ArrayList<>(Arrays.asList(source.split("(?<=\n)")));
        while (!lines.isEmpty() && lines.get(0).stripLeading().startsWith("@")) {
            lines.remove(0);
        }
        if (lines.isEmpty()) {
            throw new ConfigurationException(
                    "Source code of function '" + function.name() + "' has no definition after its decorators",
                    function.name(),
                    ComponentException.Phase.ASSEMBLY);
        }

        String firstLine = lines.get(0);
        int indent = firstLine.length() - firstLine.stripLeading().length();
        StringBuilder code = new StringBuilder();
        if (function.returnAnnotation() instanceof TypeAnnotation.NamedTuple) {
            code.append(NAMED_TUPLE_IMPORT).append('\n');
        }
        for (String line : lines) {
            code.append(dedent(line, indent));
        }
        return code.toString();
    }

    /** Removes up to {@code indent} leading whitespace characters; line endings are kept. */
    private static String dedent(String line, int indent) {
        int i = 0;
        while (i < indent && i < line.length() && line.charAt(i) != '\n' && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(i);
    }
}
