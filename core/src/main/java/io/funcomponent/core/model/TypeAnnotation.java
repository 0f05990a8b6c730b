package io.funcomponent.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Annotation attached to a function parameter or to the function's return value.
 *
 * <p>Sealed hierarchy mirroring the annotation kinds a Python signature can carry: nothing, a
 * native type object, a forward reference, an arbitrary annotation reduced to its string form, a
 * named tuple, or one of the six passing-style markers wrapping an inner annotation.
 */
public sealed interface TypeAnnotation {

    /** Shared instance for "no annotation". */
    TypeAnnotation EMPTY = new Empty();

    /** Returns the empty annotation. */
    static TypeAnnotation empty() {
        return EMPTY;
    }

    /** Returns a native type annotation such as {@code int} or {@code dict}. */
    static TypeAnnotation nativeType(String name) {
        return new NativeType(name);
    }

    /** Returns a forward reference annotation, e.g. {@code 'GcsPath'}. */
    static TypeAnnotation forwardRef(String name) {
        return new ForwardRef(name);
    }

    /** Returns an annotation known only by its string form, e.g. {@code typing.List[int]}. */
    static TypeAnnotation raw(String text) {
        return new Raw(text);
    }

    /** Wraps an inner annotation into a passing-style marker such as {@code InputPath('CSV')}. */
    static TypeAnnotation marker(PassingStyle style, TypeAnnotation inner) {
        return new Marker(style, inner);
    }

    /** Returns {@code true} if this annotation is the empty sentinel. */
    default boolean isEmpty() {
        return this instanceof Empty;
    }

    /** No annotation at all. */
    record Empty() implements TypeAnnotation {
        @Override
        public String toString() {
            return "<empty>";
        }
    }

    /** A native type object, identified by its class name. */
    record NativeType(String name) implements TypeAnnotation {
        public NativeType {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return "<class '" + name + "'>";
        }
    }

    /** A forward reference to a type by name. */
    record ForwardRef(String name) implements TypeAnnotation {
        public ForwardRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return "ForwardRef('" + name + "')";
        }
    }

    /** Any other annotation; {@code text} is its string form. */
    record Raw(String text) implements TypeAnnotation {
        public Raw {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * Tuple-like return structure with named fields.
     *
     * @param typeName the tuple class name
     * @param fields   the fields in declaration order
     */
    record NamedTuple(String typeName, List<Field> fields) implements TypeAnnotation {
        public NamedTuple {
            Objects.requireNonNull(typeName, "typeName must not be null");
            fields = fields == null ? List.of() : List.copyOf(fields);
        }

        @Override
        public String toString() {
            return typeName;
        }

        /** A named field; {@code annotation} is {@link TypeAnnotation#EMPTY} when untyped. */
        public record Field(String name, TypeAnnotation annotation) {
            public Field {
                Objects.requireNonNull(name, "name must not be null");
                annotation = annotation == null ? EMPTY : annotation;
            }
        }
    }

    /** A passing-style marker wrapping the underlying data type annotation. */
    record Marker(PassingStyle style, TypeAnnotation inner) implements TypeAnnotation {
        public Marker {
            Objects.requireNonNull(style, "style must not be null");
            if (!style.isFileStyle()) {
                throw new IllegalArgumentException("Not a passing-style marker: " + style);
            }
            inner = inner == null ? EMPTY : inner;
        }

        @Override
        public String toString() {
            return style.markerName() + "(" + inner + ")";
        }
    }
}
