package io.funcomponent.core.engine;

import io.funcomponent.core.engine.capture.ClosureCaptureStrategy;
import io.funcomponent.core.engine.capture.SourceCopyCaptureStrategy;
import io.funcomponent.core.error.ComponentException;
import io.funcomponent.core.error.ConfigurationException;
import io.funcomponent.core.model.CaptureMode;
import io.funcomponent.core.model.CompileOptions;
import io.funcomponent.core.model.ComponentSpecification;
import io.funcomponent.core.model.ContainerImplementation;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.model.PlaceholderNode;
import io.funcomponent.core.spec.ComponentSpecWriter;
import io.funcomponent.core.spi.CaptureStrategy;
import io.funcomponent.core.spi.ClosureSerializer;
import io.funcomponent.core.spi.TaskFactoryBuilder;
import io.funcomponent.core.spi.TypeRegistry;
import io.funcomponent.core.spi.ValueCodec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a Python function into a container component specification.
 *
 * <p>Runs signature analysis, captures the function body, generates the in-container program and
 * the argument template, and assembles them with the container image and command into one
 * {@link ComponentSpecification}. Any error aborts the compilation; no partial specification is
 * ever returned.
 *
 * <p>Thread-safe, except for the process-wide default image described in {@link BaseImages}.
 */
public final class ComponentCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ComponentCompiler.class);

    private static final String PIP_INSTALL =
            "PIP_DISABLE_PIP_VERSION_CHECK=1 python3 -m pip install --quiet --no-warn-script-location ";

    private final SignatureAnalyzer signatureAnalyzer;
    private final CommandTemplateBuilder templateBuilder;
    private final ShimGenerator shimGenerator;
    private final CaptureStrategy sourceCopy;
    private final CaptureStrategy closureCapture;
    private final Supplier<String> defaultBaseImage;
    private final ComponentSpecWriter specWriter;

    /** Creates a compiler with the built-in types, source capture only and the process default image. */
    public ComponentCompiler() {
        this(BuiltinTypeRegistry.standard(), BuiltinTypeRegistry.standard(), null, null);
    }

    /**
     * Creates a compiler.
     *
     * @param typeRegistry      type names and in-container codecs
     * @param valueCodec        serializer for parameter defaults
     * @param closureSerializer serializer enabling {@link CaptureMode#CLOSURE_SERIALIZATION}, may be null
     * @param defaultBaseImage  default image factory, or null to use {@link BaseImages#currentDefault()}
     */
    public ComponentCompiler(
            TypeRegistry typeRegistry,
            ValueCodec valueCodec,
            ClosureSerializer closureSerializer,
            Supplier<String> defaultBaseImage) {
        Objects.requireNonNull(typeRegistry, "typeRegistry must not be null");
        Objects.requireNonNull(valueCodec, "valueCodec must not be null");
        this.signatureAnalyzer = new SignatureAnalyzer(new TypeMapper(typeRegistry), valueCodec);
        this.templateBuilder = new CommandTemplateBuilder();
        this.shimGenerator = new ShimGenerator(typeRegistry);
        this.sourceCopy = new SourceCopyCaptureStrategy();
        this.closureCapture = closureSerializer != null ? new ClosureCaptureStrategy(closureSerializer) : null;
        this.defaultBaseImage = defaultBaseImage != null ? defaultBaseImage : BaseImages::currentDefault;
        this.specWriter = new ComponentSpecWriter();
    }

    /**
     * Compiles a function.
     *
     * @param function the function to compile
     * @param options  call-site options
     * @return the complete component specification
     * @throws ConfigurationException if the call-site image conflicts with the function's image,
     *     a file parameter declares a default, the requested capture mode is unavailable, or an
     *     input and an output map to the same command-line flag
     */
    public ComponentSpecification compile(FunctionDefinition function, CompileOptions options) {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(options, "options must not be null");

        String image = resolveBaseImage(function, options);
        ComponentSpecification component = signatureAnalyzer.analyze(function);

        String functionCode = captureStrategy(function, options.captureMode()).capture(function, options);
        ShimProgram program = shimGenerator.generate(function, component, functionCode, options.extraCode());
        List<PlaceholderNode> args = templateBuilder.build(component.inputs(), component.outputs());

        List<PlaceholderNode> command = new ArrayList<>();
        packagePreinstallationCommand(options.packagesToInstall()).forEach(t -> command.add(PlaceholderNode.literal(t)));
        for (String token : List.of("python3", "-u", "-c", program.text())) {
            command.add(PlaceholderNode.literal(token));
        }

        ComponentSpecification compiled =
                component.withImplementation(new ContainerImplementation(image, command, args));
        LOG.info(
                "component.compiled function={} name={} inputs={} outputs={} image={} capture_mode={} packages={}",
                function.name(),
                compiled.name(),
                compiled.inputs().size(),
                compiled.outputs().size(),
                image,
                options.captureMode(),
                options.packagesToInstall().size());
        return compiled;
    }

    /** Compiles a function and dumps the specification as YAML. */
    public String compileToText(FunctionDefinition function, CompileOptions options) {
        return specWriter.write(compile(function, options));
    }

    /**
     * Compiles a function and writes the specification YAML to a file.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public ComponentSpecification compileToFile(FunctionDefinition function, Path target, CompileOptions options) {
        Objects.requireNonNull(target, "target must not be null");
        ComponentSpecification specification = compile(function, options);
        writeComponentFile(specification, target);
        return specification;
    }

    /**
     * Compiles a function and hands the specification to the orchestrator's task factory builder.
     * The specification is also written to the component file named by the options, or by the
     * function's metadata when the options name none.
     */
    public <F> F compileToTaskFactory(
            FunctionDefinition function, CompileOptions options, TaskFactoryBuilder<F> taskFactoryBuilder) {
        Objects.requireNonNull(taskFactoryBuilder, "taskFactoryBuilder must not be null");
        ComponentSpecification specification = compile(function, options);
        String componentFile = options.outputComponentFile() != null
                ? options.outputComponentFile()
                : function.metadata().targetComponentFile();
        if (componentFile != null) {
            writeComponentFile(specification, Path.of(componentFile));
        }
        return taskFactoryBuilder.build(specification);
    }

    private void writeComponentFile(ComponentSpecification specification, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, specWriter.write(specification), StandardCharsets.UTF_8);
            LOG.info("Component file written: name={} path={}", specification.name(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write component file: " + target, e);
        }
    }

    /** Call-site image, else the image attached to the function, else the configured default. */
    String resolveBaseImage(FunctionDefinition function, CompileOptions options) {
        String attached = function.metadata().baseImage();
        String requested = options.baseImage();
        if (attached != null) {
            if (requested != null && !requested.equals(attached)) {
                throw new ConfigurationException(
                        "base_image (" + requested + ") conflicts with the image attached to the function ("
                                + attached + ")",
                        function.name(),
                        ComponentException.Phase.ASSEMBLY);
            }
            return attached;
        }
        if (requested != null) {
            return requested;
        }
        String image = defaultBaseImage.get();
        if (image == null || image.isBlank()) {
            throw new ConfigurationException(
                    "No container image configured for function '" + function.name() + "'",
                    function.name(),
                    ComponentException.Phase.ASSEMBLY);
        }
        return image;
    }

    private CaptureStrategy captureStrategy(FunctionDefinition function, CaptureMode mode) {
        if (mode == CaptureMode.CLOSURE_SERIALIZATION) {
            if (closureCapture == null) {
                throw new ConfigurationException(
                        "Closure serialization requested but no ClosureSerializer is configured",
                        function.name(),
                        ComponentException.Phase.ASSEMBLY);
            }
            return closureCapture;
        }
        return sourceCopy;
    }

    /**
     * Shell wrapper that pip-installs packages before running the program, retrying as a user
     * install when the global install fails. Empty when no packages are requested.
     */
    static List<String> packagePreinstallationCommand(List<String> packages) {
        if (packages.isEmpty()) {
            return List.of();
        }
        String installLine = PIP_INSTALL
                + packages.stream().map(PythonLiterals::repr).collect(Collectors.joining(" "));
        return List.of("sh", "-c", "(" + installLine + " || " + installLine + " --user) && \"$0\" \"$@\"");
    }
}
