package io.funcomponent.cli.config;

import io.funcomponent.core.model.CaptureMode;
import io.funcomponent.core.model.CompileOptions;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the command-line compiler.
 *
 * @param baseImage         default container image, {@code null} for the built-in default
 * @param captureMode       how function bodies are captured
 * @param packagesToInstall packages pip-installed before the program runs
 * @param modulesToCapture  modules captured by value in closure mode
 * @param extraCode         code placed before every function
 * @param loggingFormat     json or text
 * @param loggingLevel      root log level
 */
public record CompilerConfig(
        String baseImage,
        CaptureMode captureMode,
        List<String> packagesToInstall,
        List<String> modulesToCapture,
        String extraCode,
        String loggingFormat,
        String loggingLevel) {

    public CompilerConfig {
        packagesToInstall = packagesToInstall == null ? List.of() : List.copyOf(packagesToInstall);
        modulesToCapture = modulesToCapture == null ? List.of() : List.copyOf(modulesToCapture);
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Converts the configuration into per-compilation options. The configured base image is a
     * default, not a call-site image, so it is not part of the options.
     */
    public CompileOptions toCompileOptions(String outputComponentFile) {
        return CompileOptions.builder()
                .captureMode(captureMode)
                .packagesToInstall(packagesToInstall)
                .modulesToCapture(modulesToCapture)
                .extraCode(extraCode)
                .outputComponentFile(outputComponentFile)
                .build();
    }

    /** Builder for {@link CompilerConfig}. */
    public static final class Builder {
        private String baseImage;
        private CaptureMode captureMode = CaptureMode.SOURCE_COPY;
        private List<String> packagesToInstall = new ArrayList<>();
        private List<String> modulesToCapture = new ArrayList<>();
        private String extraCode = "";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder baseImage(String baseImage) {
            this.baseImage = baseImage;
            return this;
        }

        public Builder captureMode(CaptureMode captureMode) {
            this.captureMode = captureMode;
            return this;
        }

        public Builder packagesToInstall(List<String> packagesToInstall) {
            this.packagesToInstall = new ArrayList<>(packagesToInstall);
            return this;
        }

        public Builder modulesToCapture(List<String> modulesToCapture) {
            this.modulesToCapture = new ArrayList<>(modulesToCapture);
            return this;
        }

        public Builder extraCode(String extraCode) {
            this.extraCode = extraCode;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CompilerConfig build() {
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'json' or 'text', got: " + loggingFormat);
            }
            return new CompilerConfig(
                    baseImage,
                    captureMode,
                    packagesToInstall,
                    modulesToCapture,
                    extraCode,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
