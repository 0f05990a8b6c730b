package io.funcomponent.core.model;

/** How the function body is embedded into the generated program. */
public enum CaptureMode {
    /** Copy the literal function source. */
    SOURCE_COPY,
    /** Embed a serialized closure loaded with cloudpickle. */
    CLOSURE_SERIALIZATION
}
