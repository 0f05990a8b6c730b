package io.funcomponent.cli;

import io.funcomponent.cli.config.CompilerConfig;
import io.funcomponent.cli.config.ConfigLoadException;
import io.funcomponent.cli.config.ConfigLoader;
import io.funcomponent.core.engine.BuiltinTypeRegistry;
import io.funcomponent.core.engine.ComponentCompiler;
import io.funcomponent.core.model.ComponentSpecification;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.spec.ComponentSpecWriter;
import io.funcomponent.core.spec.FunctionDefinitionParser;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line compilation sequence: parse arguments, load configuration, configure logging,
 * parse the function definition, compile it and emit the component YAML.
 *
 * <p>Arguments: {@code --function <fn.yaml>} (required), {@code --config <compiler.yaml>} and
 * {@code --output <component.yaml>}. Without {@code --output} the YAML goes to stdout. Without
 * {@code --config}, {@value ConfigLoader#DEFAULT_CONFIG_FILE} in the working directory is used
 * if present, otherwise the defaults.
 */
public final class CompilerApp {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerApp.class);

    private CompilerApp() {
        // utility class
    }

    /** Runs with the real environment, writing to {@link System#out}. */
    public static ComponentSpecification run(String[] args) {
        return run(args, System::getenv, System.out);
    }

    /**
     * Runs one compilation.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup
     * @param stdout    destination of the YAML when no output file is given
     * @return the compiled specification
     * @throws ConfigLoadException on invalid arguments or configuration
     */
    public static ComponentSpecification run(String[] args, Function<String, String> envLookup, PrintStream stdout) {
        Arguments arguments = Arguments.parse(args);

        CompilerConfig config;
        if (arguments.configPath() != null) {
            config = ConfigLoader.load(arguments.configPath(), envLookup);
        } else if (Files.exists(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE))) {
            config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE), envLookup);
        } else {
            config = ConfigLoader.defaults(envLookup);
        }
        LogbackConfigurator.configure(config);

        FunctionDefinition function = new FunctionDefinitionParser().parse(arguments.functionPath());
        LOG.info("function.loaded name={} path={} parameters={}",
                function.name(), arguments.functionPath(), function.parameters().size());

        ComponentCompiler compiler = new ComponentCompiler(
                BuiltinTypeRegistry.standard(),
                BuiltinTypeRegistry.standard(),
                null,
                config.baseImage() != null ? config::baseImage : null);

        String outputFile = arguments.outputPath() != null ? arguments.outputPath().toString() : null;
        ComponentSpecification specification;
        if (outputFile != null) {
            specification = compiler.compileToFile(function, arguments.outputPath(), config.toCompileOptions(outputFile));
        } else {
            specification = compiler.compile(function, config.toCompileOptions(null));
            stdout.print(new ComponentSpecWriter().write(specification));
            stdout.flush();
        }
        return specification;
    }

    /** Parsed command-line arguments. */
    record Arguments(Path functionPath, Path configPath, Path outputPath) {

        static Arguments parse(String[] args) {
            Path function = null;
            Path config = null;
            Path output = null;
            for (int i = 0; i < args.length; i++) {
                String flag = args[i];
                switch (flag) {
                    case "--function" -> function = Path.of(value(args, ++i, flag));
                    case "--config" -> config = Path.of(value(args, ++i, flag));
                    case "--output" -> output = Path.of(value(args, ++i, flag));
                    default -> throw new ConfigLoadException("Unknown argument: " + flag
                            + ". Usage: --function <fn.yaml> [--config <compiler.yaml>] [--output <component.yaml>]");
                }
            }
            if (function == null) {
                throw new ConfigLoadException("Missing required argument --function <fn.yaml>");
            }
            return new Arguments(function, config, output);
        }

        private static String value(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new ConfigLoadException("Missing value for " + flag);
            }
            return args[index];
        }
    }
}
