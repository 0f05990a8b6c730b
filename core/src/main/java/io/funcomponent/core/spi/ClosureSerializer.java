package io.funcomponent.core.spi;

import io.funcomponent.core.model.FunctionDefinition;
import java.util.List;
import java.util.Objects;

/**
 * Serializes a function closure into an opaque blob that {@code pickle.loads} can restore. The
 * blob is tagged with the interpreter version that produced it.
 */
public interface ClosureSerializer {

    /**
     * Serializes the function and, transitively, the listed modules by value.
     *
     * @param function         the function to serialize
     * @param modulesToCapture modules captured by value instead of by reference
     * @return the serialized closure
     */
    SerializedClosure serialize(FunctionDefinition function, List<String> modulesToCapture);

    /**
     * A serialized closure.
     *
     * @param payload         the pickle bytes
     * @param producerVersion interpreter version of the serializing environment
     */
    record SerializedClosure(byte[] payload, InterpreterVersion producerVersion) {
        public SerializedClosure {
            Objects.requireNonNull(payload, "payload must not be null");
            Objects.requireNonNull(producerVersion, "producerVersion must not be null");
            payload = payload.clone();
        }

        @Override
        public byte[] payload() {
            return payload.clone();
        }
    }

    /** Python {@code sys.version_info}. */
    record InterpreterVersion(int major, int minor, int micro, String releaseLevel, int serial) {
        public InterpreterVersion {
            Objects.requireNonNull(releaseLevel, "releaseLevel must not be null");
        }

        /** Renders the version as a Python tuple literal, e.g. {@code (3, 7, 4, 'final', 0)}. */
        public String toPythonTuple() {
            return "(" + major + ", " + minor + ", " + micro + ", '" + releaseLevel + "', " + serial + ")";
        }
    }
}
