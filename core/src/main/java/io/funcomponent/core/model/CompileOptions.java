package io.funcomponent.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Call-site options for a single compilation.
 *
 * @param baseImage           explicit container image, {@code null} to use the attached or default image
 * @param extraCode           Python code placed before the function code
 * @param packagesToInstall   packages pip-installed before the program runs
 * @param modulesToCapture    modules captured by value when using closure serialization, empty for
 *                            the function's own module
 * @param captureMode         how the function body is captured
 * @param outputComponentFile where to write the component YAML, {@code null} for none
 */
public record CompileOptions(
        String baseImage,
        String extraCode,
        List<String> packagesToInstall,
        List<String> modulesToCapture,
        CaptureMode captureMode,
        String outputComponentFile) {

    public CompileOptions {
        extraCode = extraCode == null ? "" : extraCode;
        packagesToInstall = packagesToInstall == null ? List.of() : List.copyOf(packagesToInstall);
        modulesToCapture = modulesToCapture == null ? List.of() : List.copyOf(modulesToCapture);
        captureMode = captureMode == null ? CaptureMode.SOURCE_COPY : captureMode;
    }

    /** Options with every field at its default. */
    public static CompileOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompileOptions}. */
    public static final class Builder {
        private String baseImage;
        private String extraCode = "";
        private final List<String> packagesToInstall = new ArrayList<>();
        private final List<String> modulesToCapture = new ArrayList<>();
        private CaptureMode captureMode = CaptureMode.SOURCE_COPY;
        private String outputComponentFile;

        private Builder() {}

        public Builder baseImage(String baseImage) {
            this.baseImage = baseImage;
            return this;
        }

        public Builder extraCode(String extraCode) {
            this.extraCode = extraCode;
            return this;
        }

        public Builder packagesToInstall(List<String> packages) {
            this.packagesToInstall.clear();
            this.packagesToInstall.addAll(packages);
            return this;
        }

        public Builder modulesToCapture(List<String> modules) {
            this.modulesToCapture.clear();
            this.modulesToCapture.addAll(modules);
            return this;
        }

        public Builder captureMode(CaptureMode captureMode) {
            this.captureMode = captureMode;
            return this;
        }

        public Builder outputComponentFile(String outputComponentFile) {
            this.outputComponentFile = outputComponentFile;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(
                    baseImage, extraCode, packagesToInstall, modulesToCapture, captureMode, outputComponentFile);
        }
    }
}
