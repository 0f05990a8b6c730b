package io.funcomponent.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.funcomponent.core.error.DefinitionParseException;
import io.funcomponent.core.model.ComponentMetadata;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.model.Parameter;
import io.funcomponent.core.model.PassingStyle;
import io.funcomponent.core.model.TypeAnnotation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses function definition YAML files into {@link FunctionDefinition} instances.
 *
 * <p>A definition names the function, its parameters and return annotation, and carries the
 * function source either inline ({@code source}) or in a file next to the definition
 * ({@code sourceFile}). Annotations are written as:
 *
 * <ul>
 *   <li>a plain string: a native type, e.g. {@code float};
 *   <li>{@code {forwardRef: Name}} or {@code {raw: "typing.List[int]"}};
 *   <li>{@code {inputPath: <annotation>}} and the other five passing-style markers;
 *   <li>{@code {namedTuple: Outputs, fields: [{name: sum, type: float}]}}.
 * </ul>
 *
 * <p>Unknown keys are rejected so typos surface at load time. Thread-safe.
 */
public final class FunctionDefinitionParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS =
            Set.of("name", "module", "parameters", "returns", "source", "sourceFile", "docstring", "metadata");
    private static final Set<String> KNOWN_PARAMETER_KEYS = Set.of("name", "type", "default");
    private static final Set<String> KNOWN_METADATA_KEYS = Set.of("name", "description", "baseImage", "componentFile");
    private static final Set<String> KNOWN_FIELD_KEYS = Set.of("name", "type");

    private static final Map<String, PassingStyle> MARKERS = Map.of(
            "inputPath", PassingStyle.INPUT_PATH,
            "inputTextFile", PassingStyle.INPUT_TEXT_STREAM,
            "inputBinaryFile", PassingStyle.INPUT_BINARY_STREAM,
            "outputPath", PassingStyle.OUTPUT_PATH,
            "outputTextFile", PassingStyle.OUTPUT_TEXT_STREAM,
            "outputBinaryFile", PassingStyle.OUTPUT_BINARY_STREAM);

    /**
     * Parses the definition file at the given path. A {@code sourceFile} is resolved relative to
     * the definition's directory.
     *
     * @param path path to the definition YAML file
     * @return the parsed function definition
     * @throws DefinitionParseException if the file cannot be read, is invalid YAML or is malformed
     */
    public FunctionDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String yaml;
        try {
            yaml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DefinitionParseException("Failed to read function definition: " + e.getMessage(), e, null, source);
        }
        Path baseDirectory = path.toAbsolutePath().getParent();
        return parse(yaml, source, baseDirectory);
    }

    /**
     * Parses definition YAML held in memory.
     *
     * @param yaml          the YAML document
     * @param source        identifier used in error messages
     * @param baseDirectory directory {@code sourceFile} is resolved against, may be null
     * @return the parsed function definition
     * @throws DefinitionParseException if the YAML is invalid or malformed
     */
    public FunctionDefinition parse(String yaml, String source, Path baseDirectory) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new DefinitionParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        if (root == null || !root.isObject()) {
            throw new DefinitionParseException("Function definition must be a YAML mapping", null, source);
        }

        String name = requireString(root, "name", null, source);
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "definition root", name, source);

        FunctionDefinition.Builder builder = FunctionDefinition.builder(name)
                .module(optionalString(root, "module"))
                .docstring(optionalString(root, "docstring"))
                .source(readSource(root, name, source, baseDirectory))
                .returns(parseAnnotation(root.get("returns"), name, source))
                .metadata(parseMetadata(root.get("metadata"), name, source));

        JsonNode parameters = root.get("parameters");
        if (parameters != null && !parameters.isNull()) {
            if (!parameters.isArray()) {
                throw new DefinitionParseException("'parameters' must be a list", name, source);
            }
            for (JsonNode parameter : parameters) {
                builder.parameter(parseParameter(parameter, name, source));
            }
        }
        return builder.build();
    }

    private Parameter parseParameter(JsonNode node, String functionName, String source) {
        if (!node.isObject()) {
            throw new DefinitionParseException("Each parameter must be a mapping", functionName, source);
        }
        String parameterName = requireString(node, "name", functionName, source);
        rejectUnknownKeys(node, KNOWN_PARAMETER_KEYS, "parameter '" + parameterName + "'", functionName, source);
        TypeAnnotation annotation = parseAnnotation(node.get("type"), functionName, source);
        if (!node.has("default")) {
            return Parameter.required(parameterName, annotation);
        }
        JsonNode defaultNode = node.get("default");
        Object defaultValue = defaultNode.isNull() ? null : YAML_MAPPER.convertValue(defaultNode, Object.class);
        return Parameter.withDefault(parameterName, annotation, defaultValue);
    }

    private TypeAnnotation parseAnnotation(JsonNode node, String functionName, String source) {
        if (node == null || node.isNull()) {
            return TypeAnnotation.empty();
        }
        if (node.isTextual()) {
            return TypeAnnotation.nativeType(node.asText());
        }
        if (!node.isObject() || node.size() == 0) {
            throw new DefinitionParseException("Invalid type annotation: " + node, functionName, source);
        }
        if (node.has("namedTuple")) {
            rejectUnknownKeys(node, Set.of("namedTuple", "fields"), "namedTuple annotation", functionName, source);
            List<TypeAnnotation.NamedTuple.Field> fields = new ArrayList<>();
            JsonNode fieldsNode = node.path("fields");
            if (!fieldsNode.isArray()) {
                throw new DefinitionParseException("namedTuple 'fields' must be a list", functionName, source);
            }
            for (JsonNode field : fieldsNode) {
                String fieldName = requireString(field, "name", functionName, source);
                rejectUnknownKeys(field, KNOWN_FIELD_KEYS, "field '" + fieldName + "'", functionName, source);
                fields.add(new TypeAnnotation.NamedTuple.Field(
                        fieldName, parseAnnotation(field.get("type"), functionName, source)));
            }
            return new TypeAnnotation.NamedTuple(node.get("namedTuple").asText(), fields);
        }
        if (node.size() != 1) {
            throw new DefinitionParseException(
                    "Type annotation must have exactly one key: " + node, functionName, source);
        }
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        Map.Entry<String, JsonNode> entry = entries.next();
        String kind = entry.getKey();
        JsonNode value = entry.getValue();
        PassingStyle marker = MARKERS.get(kind);
        if (marker != null) {
            return TypeAnnotation.marker(marker, parseAnnotation(value, functionName, source));
        }
        return switch (kind) {
            case "native" -> TypeAnnotation.nativeType(requireText(value, kind, functionName, source));
            case "forwardRef" -> TypeAnnotation.forwardRef(requireText(value, kind, functionName, source));
            case "raw" -> TypeAnnotation.raw(requireText(value, kind, functionName, source));
            default -> throw new DefinitionParseException(
                    "Unknown type annotation kind '" + kind + "'", functionName, source);
        };
    }

    private ComponentMetadata parseMetadata(JsonNode node, String functionName, String source) {
        if (node == null || node.isNull()) {
            return ComponentMetadata.none();
        }
        rejectUnknownKeys(node, KNOWN_METADATA_KEYS, "metadata", functionName, source);
        return new ComponentMetadata(
                optionalString(node, "name"),
                optionalString(node, "description"),
                optionalString(node, "baseImage"),
                optionalString(node, "componentFile"));
    }

    private String readSource(JsonNode root, String functionName, String source, Path baseDirectory) {
        String inline = optionalString(root, "source");
        String sourceFile = optionalString(root, "sourceFile");
        if (inline != null && sourceFile != null) {
            throw new DefinitionParseException(
                    "Specify either 'source' or 'sourceFile', not both", functionName, source);
        }
        if (sourceFile == null) {
            return inline;
        }
        Path file = baseDirectory != null ? baseDirectory.resolve(sourceFile) : Path.of(sourceFile);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DefinitionParseException(
                    "Failed to read source file '" + file + "': " + e.getMessage(), e, functionName, source);
        }
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String functionName, String source) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!knownKeys.contains(key)) {
                throw new DefinitionParseException(
                        "Unknown key '" + key + "' in " + blockName + ". Allowed keys: " + knownKeys.stream()
                                .sorted()
                                .toList(),
                        functionName,
                        source);
            }
        }
    }

    private static String requireString(JsonNode node, String field, String functionName, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new DefinitionParseException("Missing or empty required field '" + field + "'", functionName, source);
        }
        return value.asText();
    }

    private static String requireText(JsonNode value, String kind, String functionName, String source) {
        if (value == null || !value.isTextual()) {
            throw new DefinitionParseException("'" + kind + "' annotation requires a string", functionName, source);
        }
        return value.asText();
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
