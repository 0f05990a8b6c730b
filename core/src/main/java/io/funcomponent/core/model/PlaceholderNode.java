package io.funcomponent.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Element of a command-line template.
 *
 * <p>A template is an ordered list of these nodes that an external binder resolves into concrete
 * strings once argument values are known. {@link IsPresent} is a predicate and only appears as
 * the condition of an {@link IfThen}.
 */
public sealed interface PlaceholderNode {

    /** A fixed command-line token. */
    record Literal(String text) implements PlaceholderNode {
        public Literal {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /** Replaced by the value bound to the named input. */
    record InputValue(String inputName) implements PlaceholderNode {
        public InputValue {
            Objects.requireNonNull(inputName, "inputName must not be null");
        }
    }

    /** Replaced by a local path holding the data of the named input. */
    record InputPath(String inputName) implements PlaceholderNode {
        public InputPath {
            Objects.requireNonNull(inputName, "inputName must not be null");
        }
    }

    /** Replaced by a local path the named output must be written to. */
    record OutputPath(String outputName) implements PlaceholderNode {
        public OutputPath {
            Objects.requireNonNull(outputName, "outputName must not be null");
        }
    }

    /** True when an argument was bound to the named input. */
    record IsPresent(String inputName) implements PlaceholderNode {
        public IsPresent {
            Objects.requireNonNull(inputName, "inputName must not be null");
        }
    }

    /** Expands to {@code thenBranch} only if {@code condition} holds at binding time. */
    record IfThen(PlaceholderNode condition, List<PlaceholderNode> thenBranch) implements PlaceholderNode {
        public IfThen {
            Objects.requireNonNull(condition, "condition must not be null");
            thenBranch = thenBranch == null ? List.of() : List.copyOf(thenBranch);
        }
    }

    static PlaceholderNode literal(String text) {
        return new Literal(text);
    }
}
