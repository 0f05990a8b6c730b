package io.funcomponent.core.engine;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Process-wide default container image, used when neither the call site nor the function names
 * one.
 *
 * <p>The default is either a fixed image or a factory evaluated lazily on every compilation that
 * needs it. Writes are last-write-wins without locking: compilations racing a concurrent
 * {@link #setDefault} may see either value. Callers that need isolation should pass a default
 * image to {@link ComponentCompiler} instead.
 */
public final class BaseImages {

    /** Image used when no default has been configured. */
    public static final String FALLBACK_IMAGE = "tensorflow/tensorflow:1.13.2-py3";

    private static volatile Supplier<String> defaultImage = () -> FALLBACK_IMAGE;

    private BaseImages() {
        // utility class
    }

    /** Sets a fixed process-wide default image. */
    public static void setDefault(String image) {
        Objects.requireNonNull(image, "image must not be null");
        defaultImage = () -> image;
    }

    /** Sets a factory evaluated whenever the default image is needed. */
    public static void setDefault(Supplier<String> imageFactory) {
        defaultImage = Objects.requireNonNull(imageFactory, "imageFactory must not be null");
    }

    /** Restores {@link #FALLBACK_IMAGE} as the default. */
    public static void reset() {
        defaultImage = () -> FALLBACK_IMAGE;
    }

    /** Returns the current default, evaluating a configured factory. */
    public static String currentDefault() {
        return defaultImage.get();
    }
}
