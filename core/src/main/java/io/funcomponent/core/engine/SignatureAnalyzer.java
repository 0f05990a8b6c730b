package io.funcomponent.core.engine;

import io.funcomponent.core.error.ComponentException;
import io.funcomponent.core.error.ConfigurationException;
import io.funcomponent.core.error.ValueSerializationException;
import io.funcomponent.core.model.ComponentSpecification;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.model.InputDescriptor;
import io.funcomponent.core.model.OutputDescriptor;
import io.funcomponent.core.model.Parameter;
import io.funcomponent.core.model.PassingStyle;
import io.funcomponent.core.model.TypeAnnotation;
import io.funcomponent.core.spi.ValueCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the component interface (name, description, inputs and outputs) from a function
 * signature.
 *
 * <p>Parameters are classified by passing style, renamed to their externally visible data name
 * ({@code model_file_path: InputPath()} becomes input {@code model}) and de-duplicated. Input and
 * output names live in separate namespaces. Outputs produced by the return value follow the
 * parameter-declared outputs: one per named-tuple field, or a single {@code Output}.
 *
 * <p>Stateless and thread-safe.
 */
public final class SignatureAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureAnalyzer.class);

    /** Name of the output produced by a plain, non-tuple return value. */
    public static final String SINGLE_OUTPUT_NAME = "Output";

    private static final String PATH_SUFFIX = "_path";
    private static final String FILE_SUFFIX = "_file";

    private final TypeMapper typeMapper;
    private final ValueCodec valueCodec;

    public SignatureAnalyzer(TypeMapper typeMapper, ValueCodec valueCodec) {
        this.typeMapper = Objects.requireNonNull(typeMapper, "typeMapper must not be null");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec must not be null");
    }

    /**
     * Analyzes a function signature.
     *
     * @param function the function to analyze
     * @return the component interface, without container implementation
     * @throws ConfigurationException      if a file or stream parameter declares a default value
     * @throws ValueSerializationException if a default value does not match its declared type
     */
    public ComponentSpecification analyze(FunctionDefinition function) {
        Objects.requireNonNull(function, "function must not be null");
        List<InputDescriptor> inputs = new ArrayList<>();
        List<OutputDescriptor> outputs = new ArrayList<>();
        NameCollisionResolver inputNames = new NameCollisionResolver();
        NameCollisionResolver outputNames = new NameCollisionResolver();

        for (Parameter parameter : function.parameters()) {
            TypeAnnotation annotation = parameter.annotation();
            PassingStyle style = PassingStyle.BY_VALUE;
            String ioName = parameter.name();
            if (annotation instanceof TypeAnnotation.Marker marker) {
                style = marker.style();
                annotation = marker.inner();
                if (parameter.hasDefault()) {
                    throw new ConfigurationException(
                            "Default values for file inputs/outputs are not supported: parameter '"
                                    + parameter.name() + "'",
                            function.name(),
                            ComponentException.Phase.ANALYSIS);
                }
                ioName = externalName(ioName, style);
            }
            String type = typeMapper.resolve(annotation).orElse(null);

            if (style.isOutput()) {
                String name = outputNames.claim(ioName);
                outputs.add(new OutputDescriptor(name, type, style, parameter.name(), null));
                LOG.debug("Output '{}' from parameter '{}': type={} style={}", name, parameter.name(), type, style);
            } else {
                String name = inputNames.claim(ioName);
                boolean optional = parameter.hasDefault();
                String serializedDefault = null;
                if (optional && parameter.defaultValue() != null) {
                    serializedDefault = serializeDefault(function, parameter, type);
                }
                inputs.add(new InputDescriptor(name, type, optional, serializedDefault, style, parameter.name()));
                LOG.debug(
                        "Input '{}' from parameter '{}': type={} style={} optional={}",
                        name,
                        parameter.name(),
                        type,
                        style,
                        optional);
            }
        }

        TypeAnnotation returnAnnotation = function.returnAnnotation();
        if (returnAnnotation instanceof TypeAnnotation.NamedTuple tuple) {
            for (TypeAnnotation.NamedTuple.Field field : tuple.fields()) {
                String name = outputNames.claim(field.name());
                String type = typeMapper.resolve(field.annotation()).orElse(null);
                outputs.add(new OutputDescriptor(name, type, PassingStyle.BY_RETURN_VALUE, null, field.name()));
            }
        } else if (!returnAnnotation.isEmpty()) {
            // An output parameter may already be called "Output"
            String name = outputNames.claim(SINGLE_OUTPUT_NAME);
            String type = typeMapper.resolve(returnAnnotation).orElse(null);
            outputs.add(new OutputDescriptor(name, type, PassingStyle.BY_RETURN_VALUE, null, null));
        }

        return new ComponentSpecification(componentName(function), description(function), inputs, outputs, null);
    }

    /**
     * Strips the {@code _path} suffix (path styles only) and then the {@code _file} suffix, so that
     * callers pass {@code number=42} rather than {@code number_file_path=42}.
     */
    static String externalName(String parameterName, PassingStyle style) {
        String name = parameterName;
        if (style.isPath() && name.endsWith(PATH_SUFFIX)) {
            name = name.substring(0, name.length() - PATH_SUFFIX.length());
        }
        if (name.endsWith(FILE_SUFFIX)) {
            name = name.substring(0, name.length() - FILE_SUFFIX.length());
        }
        return name;
    }

    /** {@code add_two__numbers} becomes {@code Add two numbers}. */
    static String humanize(String identifier) {
        String spaced = identifier.replace('_', ' ').replaceAll(" +", " ");
        String trimmed = stripSpaces(spaced);
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String stripSpaces(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == ' ') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == ' ') {
            end--;
        }
        return text.substring(start, end);
    }

    private static String componentName(FunctionDefinition function) {
        String override = function.metadata().humanName();
        return override != null && !override.isEmpty() ? override : humanize(function.name());
    }

    private static String description(FunctionDefinition function) {
        String description = function.metadata().description();
        if (description == null || description.isEmpty()) {
            description = function.docstring();
        }
        if (description == null || description.isEmpty()) {
            return null;
        }
        return description.strip() + "\n";
    }

    private String serializeDefault(FunctionDefinition function, Parameter parameter, String type) {
        try {
            return valueCodec.serialize(parameter.defaultValue(), type);
        } catch (ValueSerializationException e) {
            throw new ValueSerializationException(
                    "Default value of parameter '" + parameter.name() + "' in function '" + function.name()
                            + "' cannot be serialized: " + e.getMessage(),
                    e,
                    function.name(),
                    type);
        }
    }
}
