package io.funcomponent.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.funcomponent.core.engine.BuiltinTypeRegistry;
import io.funcomponent.core.engine.ComponentCompiler;
import io.funcomponent.core.error.DefinitionParseException;
import io.funcomponent.core.model.CompileOptions;
import io.funcomponent.core.model.ComponentSpecification;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.model.Parameter;
import io.funcomponent.core.model.PassingStyle;
import io.funcomponent.core.model.TypeAnnotation;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FunctionDefinitionParser")
class FunctionDefinitionParserTest {

    private static final Path FUNCTIONS = Path.of("src/test/resources/functions");

    private final FunctionDefinitionParser parser = new FunctionDefinitionParser();

    @Nested
    @DisplayName("Valid definitions")
    class ValidDefinitions {

        @Test
        void parsesInlineSourceAndNamedTuple() {
            FunctionDefinition function = parser.parse(FUNCTIONS.resolve("add-multiply.yaml"));

            assertThat(function.name()).isEqualTo("add_multiply_two_numbers");
            assertThat(function.module()).isEqualTo("my_pipeline.math");
            assertThat(function.docstring()).isEqualTo("Returns sum and product of two arguments");
            assertThat(function.parameters()).containsExactly(
                    Parameter.required("a", TypeAnnotation.nativeType("float")),
                    Parameter.withDefault("b", TypeAnnotation.nativeType("float"), 3));
            assertThat(function.returnAnnotation()).isInstanceOf(TypeAnnotation.NamedTuple.class);
            TypeAnnotation.NamedTuple tuple = (TypeAnnotation.NamedTuple) function.returnAnnotation();
            assertThat(tuple.typeName()).isEqualTo("Outputs");
            assertThat(tuple.fields()).extracting(TypeAnnotation.NamedTuple.Field::name).containsExactly("sum", "product");
            assertThat(function.source()).startsWith("def add_multiply_two_numbers(");
        }

        @Test
        @DisplayName("Markers, source file and metadata are read")
        void parsesMarkersAndMetadata() {
            FunctionDefinition function = parser.parse(FUNCTIONS.resolve("train-model.yaml"));

            assertThat(function.module()).isEqualTo("__main__");
            assertThat(function.parameters().get(0).annotation())
                    .isEqualTo(TypeAnnotation.marker(PassingStyle.INPUT_PATH, TypeAnnotation.raw("CSV")));
            assertThat(function.parameters().get(1).annotation())
                    .isEqualTo(TypeAnnotation.marker(PassingStyle.INPUT_TEXT_STREAM, TypeAnnotation.nativeType("dict")));
            assertThat(function.parameters().get(2).annotation())
                    .isEqualTo(TypeAnnotation.marker(PassingStyle.OUTPUT_PATH, TypeAnnotation.forwardRef("Model")));
            assertThat(function.parameters().get(3).annotation())
                    .isEqualTo(TypeAnnotation.marker(PassingStyle.OUTPUT_BINARY_STREAM, TypeAnnotation.empty()));
            assertThat(function.parameters().get(5)).isEqualTo(Parameter.withDefault("label", TypeAnnotation.nativeType("str"), null));
            assertThat(function.returnAnnotation()).isEqualTo(TypeAnnotation.nativeType("bool"));
            assertThat(function.source()).startsWith("@component\ndef train_model(");
            assertThat(function.metadata().humanName()).isEqualTo("Train model");
            assertThat(function.metadata().baseImage()).isEqualTo("python:3.9");
            assertThat(function.metadata().targetComponentFile()).isEqualTo("build/train_model.yaml");
        }

        @Test
        @DisplayName("Parsed definition compiles end to end")
        void parsedDefinitionCompiles() {
            FunctionDefinition function = parser.parse(FUNCTIONS.resolve("train-model.yaml"));
            BuiltinTypeRegistry registry = BuiltinTypeRegistry.standard();

            ComponentSpecification component = new ComponentCompiler(registry, registry, null, () -> "unused")
                    .compile(function, CompileOptions.defaults());

            assertThat(component.name()).isEqualTo("Train model");
            assertThat(component.implementation().image()).isEqualTo("python:3.9");
            assertThat(component.inputs())
                    .extracting(i -> i.name() + ":" + i.type())
                    .containsExactly("training_data:CSV", "config:JsonObject", "epochs:Integer", "label:String");
            assertThat(component.outputs())
                    .extracting(o -> o.name() + ":" + o.type())
                    .containsExactly("model:Model", "log:null", "Output:Boolean");
        }
    }

    @Nested
    @DisplayName("Invalid definitions")
    class InvalidDefinitions {

        @Test
        void unknownKeyIsRejected() {
            assertThatThrownBy(() -> parser.parse(FUNCTIONS.resolve("unknown-key.yaml")))
                    .isInstanceOf(DefinitionParseException.class)
                    .hasMessageContaining("defualt")
                    .satisfies(e -> {
                        DefinitionParseException error = (DefinitionParseException) e;
                        assertThat(error.functionName()).isEqualTo("broken");
                        assertThat(error.source()).endsWith("unknown-key.yaml");
                    });
        }

        @Test
        void missingFileIsRejected() {
            assertThatThrownBy(() -> parser.parse(FUNCTIONS.resolve("absent.yaml")))
                    .isInstanceOf(DefinitionParseException.class)
                    .hasMessageContaining("Failed to read");
        }

        @Test
        void missingNameIsRejected() {
            assertThatThrownBy(() -> parser.parse("parameters: []", "inline", null))
                    .isInstanceOf(DefinitionParseException.class)
                    .hasMessageContaining("'name'");
        }

        @Test
        void invalidYamlIsRejected() {
            assertThatThrownBy(() -> parser.parse("name: [unclosed", "inline", null))
                    .isInstanceOf(DefinitionParseException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        void unknownAnnotationKindIsRejected() {
            String yaml = """
                    name: f
                    parameters:
                      - name: x
                        type: { inputFolder: str }
                    """;

            assertThatThrownBy(() -> parser.parse(yaml, "inline", null))
                    .isInstanceOf(DefinitionParseException.class)
                    .hasMessageContaining("inputFolder");
        }

        @Test
        void inlineSourceAndSourceFileAreExclusive() {
            String yaml = """
                    name: f
                    source: "def f(): pass"
                    sourceFile: f.py
                    """;

            assertThatThrownBy(() -> parser.parse(yaml, "inline", null))
                    .isInstanceOf(DefinitionParseException.class)
                    .hasMessageContaining("either");
        }
    }
}
