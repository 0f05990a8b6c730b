package io.funcomponent.core.engine;

import io.funcomponent.core.error.ComponentException;
import io.funcomponent.core.error.ConfigurationException;
import io.funcomponent.core.error.UnsupportedPassingStyleException;
import io.funcomponent.core.model.ComponentSpecification;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.model.InputDescriptor;
import io.funcomponent.core.model.OutputDescriptor;
import io.funcomponent.core.model.PassingStyle;
import io.funcomponent.core.model.TypeAnnotation;
import io.funcomponent.core.spi.TypeRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Generates the Python program executed inside the container.
 *
 * <p>The program parses the command line produced by {@link CommandTemplateBuilder}, calls the
 * captured function with the parsed arguments as keyword bindings and writes every return-value
 * output to the path given for it. Helper definitions requested by several parameters are
 * emitted once, in first-request order.
 *
 * <p>Stateless and thread-safe; each call collects its own definitions.
 */
public final class ShimGenerator {

    static final String MAKE_PARENT_DIRS_AND_RETURN_PATH = "_make_parent_dirs_and_return_path";
    static final String PARENT_DIRS_MAKER_THAT_RETURNS_OPEN_FILE = "_parent_dirs_maker_that_returns_open_file";

    private static final String MAKE_PARENT_DIRS_AND_RETURN_PATH_SOURCE = """
            def _make_parent_dirs_and_return_path(file_path: str):
                import os
                os.makedirs(os.path.dirname(file_path), exist_ok=True)
                return file_path
            """;

    private static final String PARENT_DIRS_MAKER_THAT_RETURNS_OPEN_FILE_SOURCE = """
            def _parent_dirs_maker_that_returns_open_file(mode: str, encoding: str = None):

                def make_parent_dirs_and_return_path(file_path: str):
                    import os
                    os.makedirs(os.path.dirname(file_path), exist_ok=True)
                    return open(file_path, mode=mode, encoding=encoding)

                return make_parent_dirs_and_return_path
            """;

    private static final String OUTPUT_PATHS_DEST = "_output_paths";

    private static final String EPILOGUE = """
            import os
            for idx, output_file in enumerate(_output_files):
                try:
                    os.makedirs(os.path.dirname(output_file))
                except OSError:
                    pass
                with open(output_file, 'w') as f:
                    f.write(_output_serializers[idx](_outputs[idx]))
            """;

    private final TypeRegistry typeRegistry;

    public ShimGenerator(TypeRegistry typeRegistry) {
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "typeRegistry must not be null");
    }

    /**
     * Generates the program.
     *
     * @param function     the compiled function, bound by {@code functionCode} under its name
     * @param component    the analyzed component interface
     * @param functionCode program fragment produced by a capture strategy
     * @param extraCode    caller-supplied code placed before the function code
     * @return the program, block by block
     * @throws UnsupportedPassingStyleException if a descriptor carries a passing style that does
     *     not belong to its direction
     * @throws ConfigurationException           if an input and a file output map to the same flag
     */
    public ShimProgram generate(
            FunctionDefinition function, ComponentSpecification component, String functionCode, String extraCode) {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(component, "component must not be null");
        Set<String> definitions = new LinkedHashSet<>();
        List<OutputDescriptor> returnOutputs = component.returnOutputs();

        String argumentParser = argumentParser(function, component, returnOutputs, definitions);
        String serializers = outputSerializers(returnOutputs, definitions);

        Map<ShimProgram.Block, String> blocks = new EnumMap<>(ShimProgram.Block.class);
        blocks.put(ShimProgram.Block.SUPPORT_DEFINITIONS, String.join("\n", definitions));
        blocks.put(ShimProgram.Block.EXTRA_CODE, extraCode == null ? "" : extraCode);
        blocks.put(ShimProgram.Block.FUNCTION_BODY, functionCode == null ? "" : functionCode);
        blocks.put(ShimProgram.Block.ARGUMENT_PARSER, argumentParser);
        blocks.put(ShimProgram.Block.INVOCATION, invocation(function, returnOutputs));
        blocks.put(ShimProgram.Block.OUTPUT_SERIALIZERS, serializers);
        blocks.put(ShimProgram.Block.EPILOGUE, EPILOGUE);
        return new ShimProgram(blocks);
    }

    private String argumentParser(
            FunctionDefinition function,
            ComponentSpecification component,
            List<OutputDescriptor> returnOutputs,
            Set<String> definitions) {
        List<String> lines = new ArrayList<>();
        lines.add("import argparse");
        lines.add("_parser = argparse.ArgumentParser(prog=" + PythonLiterals.repr(nullToEmpty(component.name()))
                + ", description=" + PythonLiterals.repr(nullToEmpty(component.description())) + ")");

        Set<String> flags = new HashSet<>();
        for (InputDescriptor input : component.inputs()) {
            claimFlag(flags, input.name(), function);
            String argumentType = input.passingStyle() == PassingStyle.BY_VALUE
                    ? deserializer(input.type(), definitions)
                    : fileArgumentType(input.passingStyle(), function, definitions);
            lines.add(addArgument(input.name(), input.sourceParameterName(), argumentType, !input.optional()));
        }
        for (OutputDescriptor output : component.outputs()) {
            if (output.isReturnValue()) {
                continue;
            }
            claimFlag(flags, output.name(), function);
            String argumentType = fileArgumentType(output.passingStyle(), function, definitions);
            lines.add(addArgument(output.name(), output.sourceParameterName(), argumentType, true));
        }
        if (!returnOutputs.isEmpty()) {
            lines.add("_parser.add_argument(\"" + CommandTemplateBuilder.OUTPUT_PATHS_FLAG + "\", dest=\""
                    + OUTPUT_PATHS_DEST + "\", type=str, nargs=" + returnOutputs.size() + ")");
        }
        lines.add("_parsed_args = vars(_parser.parse_args())");
        lines.add("_output_files = _parsed_args.pop(\"" + OUTPUT_PATHS_DEST + "\", [])");
        return String.join("\n", lines);
    }

    /** Inputs and outputs have separate name spaces but share one argparse parser. */
    private static void claimFlag(Set<String> flags, String name, FunctionDefinition function) {
        String flag = CommandTemplateBuilder.flagFor(name);
        if (!flags.add(flag)) {
            throw new ConfigurationException(
                    "Input and output '" + name + "' would both be passed as " + flag
                            + "; rename one of the parameters",
                    function.name(),
                    ComponentException.Phase.ASSEMBLY);
        }
    }

    private static String addArgument(String name, String dest, String argumentType, boolean required) {
        return "_parser.add_argument(\"" + CommandTemplateBuilder.flagFor(name) + "\", dest=\"" + dest
                + "\", type=" + argumentType + ", required=" + PythonLiterals.bool(required)
                + ", default=argparse.SUPPRESS)";
    }

    /**
     * Returns the argparse {@code type=} expression for a file or stream parameter and registers
     * the definitions it depends on. Output files go through helpers because argparse's own
     * {@code FileType} does not create parent directories.
     */
    private static String fileArgumentType(PassingStyle style, FunctionDefinition function, Set<String> definitions) {
        switch (style) {
            case INPUT_PATH:
                definitions.add(markerClass(style));
                return "str";
            case INPUT_TEXT_STREAM:
            case INPUT_BINARY_STREAM:
                definitions.add(markerClass(style));
                return "argparse.FileType('" + style.fileMode() + "')";
            case OUTPUT_PATH:
                definitions.add(markerClass(style));
                definitions.add(MAKE_PARENT_DIRS_AND_RETURN_PATH_SOURCE);
                return MAKE_PARENT_DIRS_AND_RETURN_PATH;
            case OUTPUT_TEXT_STREAM:
            case OUTPUT_BINARY_STREAM:
                definitions.add(markerClass(style));
                definitions.add(PARENT_DIRS_MAKER_THAT_RETURNS_OPEN_FILE_SOURCE);
                return PARENT_DIRS_MAKER_THAT_RETURNS_OPEN_FILE + "('" + style.fileMode() + "')";
            default:
                throw new UnsupportedPassingStyleException(style, function.name());
        }
    }

    /** Class definition of a passing-style marker, needed when the copied source annotates with it. */
    private static String markerClass(PassingStyle style) {
        return "class " + style.markerName() + ":\n"
                + "    def __init__(self, type=None):\n"
                + "        self.type = type\n";
    }

    private String deserializer(String typeName, Set<String> definitions) {
        return typeRegistry
                .deserializer(typeName)
                .map(deserializer -> {
                    if (deserializer.definition() != null && !deserializer.definition().isEmpty()) {
                        definitions.add(deserializer.definition());
                    }
                    return deserializer.expression();
                })
                .orElse("str");
    }

    private String outputSerializers(List<OutputDescriptor> returnOutputs, Set<String> definitions) {
        StringBuilder sb = new StringBuilder("_output_serializers = [\n");
        for (OutputDescriptor output : returnOutputs) {
            String serializer = typeRegistry
                    .serializer(output.type())
                    .map(s -> {
                        if (s.definition() != null && !s.definition().isEmpty()) {
                            definitions.add(s.definition());
                        }
                        return s.functionName();
                    })
                    .orElse("str");
            sb.append("    ").append(serializer).append(",\n");
        }
        return sb.append("]").toString();
    }

    private static String invocation(FunctionDefinition function, List<OutputDescriptor> returnOutputs) {
        String call = "_outputs = " + function.name() + "(**_parsed_args)\n\n";
        boolean singleValue = returnOutputs.size() == 1
                && !(function.returnAnnotation() instanceof TypeAnnotation.NamedTuple);
        if (singleValue) {
            // A single return value may itself be indexable (a list or a string)
            return call + "_outputs = [_outputs]\n";
        }
        return call
                + "if not hasattr(_outputs, '__getitem__') or isinstance(_outputs, str):\n"
                + "    _outputs = [_outputs]\n";
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
