package io.funcomponent.core.engine;

import io.funcomponent.core.model.PlaceholderNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Reference binder: resolves a command template into concrete command-line tokens for one set of
 * argument values.
 *
 * <p>Presence guards are evaluated against the supplied arguments, so an optional input without a
 * value contributes no tokens at all. Input and output paths come from the supplied path
 * resolvers, which receive the input or output name.
 */
public final class CommandLineResolver {

    private final UnaryOperator<String> inputPathResolver;
    private final UnaryOperator<String> outputPathResolver;

    public CommandLineResolver(UnaryOperator<String> inputPathResolver, UnaryOperator<String> outputPathResolver) {
        this.inputPathResolver = Objects.requireNonNull(inputPathResolver, "inputPathResolver must not be null");
        this.outputPathResolver = Objects.requireNonNull(outputPathResolver, "outputPathResolver must not be null");
    }

    /**
     * Resolves a template.
     *
     * @param template  the command or args template
     * @param arguments argument values keyed by input name; null values count as absent
     * @return the resolved tokens
     * @throws IllegalArgumentException if a required input has no argument
     */
    public List<String> resolve(List<PlaceholderNode> template, Map<String, String> arguments) {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        List<String> tokens = new ArrayList<>();
        for (PlaceholderNode node : template) {
            expand(node, arguments, tokens);
        }
        return List.copyOf(tokens);
    }

    private void expand(PlaceholderNode node, Map<String, String> arguments, List<String> tokens) {
        if (node instanceof PlaceholderNode.Literal literal) {
            tokens.add(literal.text());
        } else if (node instanceof PlaceholderNode.InputValue inputValue) {
            tokens.add(requireArgument(inputValue.inputName(), arguments));
        } else if (node instanceof PlaceholderNode.InputPath inputPath) {
            requireArgument(inputPath.inputName(), arguments);
            tokens.add(inputPathResolver.apply(inputPath.inputName()));
        } else if (node instanceof PlaceholderNode.OutputPath outputPath) {
            tokens.add(outputPathResolver.apply(outputPath.outputName()));
        } else if (node instanceof PlaceholderNode.IfThen ifThen) {
            if (evaluate(ifThen.condition(), arguments)) {
                for (PlaceholderNode child : ifThen.thenBranch()) {
                    expand(child, arguments, tokens);
                }
            }
        } else {
            throw new IllegalArgumentException("Placeholder cannot be used as a value: " + node);
        }
    }

    private static boolean evaluate(PlaceholderNode condition, Map<String, String> arguments) {
        if (condition instanceof PlaceholderNode.IsPresent isPresent) {
            return arguments.get(isPresent.inputName()) != null;
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition);
    }

    private static String requireArgument(String inputName, Map<String, String> arguments) {
        String value = arguments.get(inputName);
        if (value == null) {
            throw new IllegalArgumentException("No argument was passed for required input '" + inputName + "'");
        }
        return value;
    }
}
