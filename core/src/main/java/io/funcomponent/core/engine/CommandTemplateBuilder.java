package io.funcomponent.core.engine;

import io.funcomponent.core.model.InputDescriptor;
import io.funcomponent.core.model.OutputDescriptor;
import io.funcomponent.core.model.PlaceholderNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the container {@code args} template from input and output descriptors.
 *
 * <p>Order: every input in declaration order, then every file-style output, then the shared
 * {@value #OUTPUT_PATHS_FLAG} block listing the paths of all return-value outputs. Optional
 * inputs are wrapped in a presence guard so the binder omits the flag entirely when no value is
 * bound.
 *
 * <p>Stateless and thread-safe.
 */
public final class CommandTemplateBuilder {

    /** Multi-valued flag receiving the destination paths of return-value outputs. */
    public static final String OUTPUT_PATHS_FLAG = "----output-paths";

    /**
     * Builds the argument template.
     *
     * @param inputs  input descriptors in declaration order
     * @param outputs all output descriptors; file-style and return-value ones are split here
     * @return the ordered template
     */
    public List<PlaceholderNode> build(List<InputDescriptor> inputs, List<OutputDescriptor> outputs) {
        List<PlaceholderNode> args = new ArrayList<>();
        for (InputDescriptor input : inputs) {
            PlaceholderNode valueNode = input.passingStyle().isFileStyle()
                    ? new PlaceholderNode.InputPath(input.name())
                    : new PlaceholderNode.InputValue(input.name());
            List<PlaceholderNode> pair = List.of(PlaceholderNode.literal(flagFor(input.name())), valueNode);
            if (input.optional()) {
                args.add(new PlaceholderNode.IfThen(new PlaceholderNode.IsPresent(input.name()), pair));
            } else {
                args.addAll(pair);
            }
        }

        List<OutputDescriptor> returnOutputs = new ArrayList<>();
        for (OutputDescriptor output : outputs) {
            if (output.isReturnValue()) {
                returnOutputs.add(output);
                continue;
            }
            args.add(PlaceholderNode.literal(flagFor(output.name())));
            args.add(new PlaceholderNode.OutputPath(output.name()));
        }

        if (!returnOutputs.isEmpty()) {
            args.add(PlaceholderNode.literal(OUTPUT_PATHS_FLAG));
            for (OutputDescriptor output : returnOutputs) {
                args.add(new PlaceholderNode.OutputPath(output.name()));
            }
        }
        return List.copyOf(args);
    }

    /** Command-line flag for a descriptor name: {@code model_uri} becomes {@code --model-uri}. */
    public static String flagFor(String name) {
        return "--" + name.replace('_', '-');
    }
}
