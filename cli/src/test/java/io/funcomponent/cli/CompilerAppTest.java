package io.funcomponent.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.funcomponent.cli.config.ConfigLoadException;
import io.funcomponent.core.error.DefinitionParseException;
import io.funcomponent.core.model.ComponentSpecification;
import io.funcomponent.core.model.PlaceholderNode;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CompilerApp")
class CompilerAppTest {

    private static final String FUNCTION = "src/test/resources/functions/add.yaml";
    private static final String CONFIG = "src/test/resources/config/minimal-config.yaml";

    private final Map<String, String> envVars = new HashMap<>();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @TempDir
    Path tempDir;

    @AfterAll
    static void restoreLogging() {
        LogbackConfigurator.configure("text", "WARN");
    }

    private ComponentSpecification run(String... args) {
        return CompilerApp.run(args, envVars::get, new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Component YAML goes to stdout without --output")
    void writesToStdout() {
        ComponentSpecification component = run("--function", FUNCTION, "--config", CONFIG);

        String yaml = stdout.toString(StandardCharsets.UTF_8);
        assertThat(component.implementation().image()).isEqualTo("python:3.9");
        assertThat(yaml).startsWith("name: Add\n").contains("image: python:3.9");
    }

    @Test
    @DisplayName("Component YAML is written to the --output file")
    void writesToFile() throws Exception {
        Path output = tempDir.resolve("out/add.yaml");

        run("--function", FUNCTION, "--config", CONFIG, "--output", output.toString());

        assertThat(stdout.size()).isZero();
        assertThat(Files.readString(output)).startsWith("name: Add\n");
    }

    @Test
    @DisplayName("Environment packages wrap the command")
    void packagesFromEnvironment() {
        envVars.put("FUNC_COMPONENT_PACKAGES", "numpy");

        ComponentSpecification component = run("--function", FUNCTION, "--config", CONFIG);

        assertThat(component.implementation().command().get(0)).isEqualTo(PlaceholderNode.literal("sh"));
        assertThat(((PlaceholderNode.Literal) component.implementation().command().get(2)).text())
                .contains("'numpy'");
    }

    @Test
    void missingFunctionArgumentIsRejected() {
        assertThatThrownBy(() -> run("--config", CONFIG))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("--function");
    }

    @Test
    void unknownArgumentIsRejected() {
        assertThatThrownBy(() -> run("--function", FUNCTION, "--verbose"))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("--verbose");
    }

    @Test
    void flagWithoutValueIsRejected() {
        assertThatThrownBy(() -> run("--function"))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Missing value");
    }

    @Test
    void missingFunctionFileIsRejected() {
        assertThatThrownBy(() -> run("--function", "absent.yaml", "--config", CONFIG))
                .isInstanceOf(DefinitionParseException.class);
    }
}
