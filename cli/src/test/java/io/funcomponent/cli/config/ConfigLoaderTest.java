package io.funcomponent.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.funcomponent.core.model.CaptureMode;
import io.funcomponent.core.model.CompileOptions;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static Path config(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Test
    @DisplayName("Full config populates every field")
    void fullConfig() throws Exception {
        CompilerConfig config = ConfigLoader.load(config("full-config.yaml"), NO_ENV::get);

        assertThat(config.baseImage()).isEqualTo("python:3.9-slim");
        assertThat(config.captureMode()).isEqualTo(CaptureMode.SOURCE_COPY);
        assertThat(config.packagesToInstall()).containsExactly("pandas==1.3.0", "scikit-learn");
        assertThat(config.modulesToCapture()).containsExactly("my_pipeline");
        assertThat(config.extraCode()).isEqualTo("import math\n");
        assertThat(config.loggingFormat()).isEqualTo("json");
        assertThat(config.loggingLevel()).isEqualTo("DEBUG");
    }

    @Test
    @DisplayName("Minimal config falls back to defaults")
    void minimalConfig() throws Exception {
        CompilerConfig config = ConfigLoader.load(config("minimal-config.yaml"), NO_ENV::get);

        assertThat(config.baseImage()).isEqualTo("python:3.9");
        assertThat(config.captureMode()).isEqualTo(CaptureMode.SOURCE_COPY);
        assertThat(config.packagesToInstall()).isEmpty();
        assertThat(config.extraCode()).isEmpty();
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("INFO");
    }

    @Test
    @DisplayName("Configured image is a default, not a call-site image")
    void compileOptionsOmitBaseImage() throws Exception {
        CompileOptions options =
                ConfigLoader.load(config("full-config.yaml"), NO_ENV::get).toCompileOptions("out.yaml");

        assertThat(options.baseImage()).isNull();
        assertThat(options.packagesToInstall()).containsExactly("pandas==1.3.0", "scikit-learn");
        assertThat(options.outputComponentFile()).isEqualTo("out.yaml");
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> ConfigLoader.load(Path.of("does-not-exist.yaml"), NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("--config");
    }

    @Test
    void invalidCaptureModeIsRejected() {
        assertThatThrownBy(() -> ConfigLoader.load(config("bad-capture-mode.yaml"), NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("by-magic");
    }

    @Test
    void captureModeAcceptsKebabAndEnumNames() {
        assertThat(ConfigLoader.parseCaptureMode("closure-serialization")).isEqualTo(CaptureMode.CLOSURE_SERIALIZATION);
        assertThat(ConfigLoader.parseCaptureMode("SOURCE_COPY")).isEqualTo(CaptureMode.SOURCE_COPY);
    }

    @Test
    void invalidLoggingFormatIsRejected() {
        assertThatThrownBy(() -> CompilerConfig.builder().loggingFormat("xml").build())
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("xml");
    }
}
