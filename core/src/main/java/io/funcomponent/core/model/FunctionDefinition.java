package io.funcomponent.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The callable being compiled: a Python function described across the reflection boundary.
 *
 * <p>Carries everything signature analysis and code capture need: the identifier and defining
 * module, the ordered parameter list, the return annotation, the literal source text (decorators
 * and enclosing indentation included) and the docstring. Immutable.
 *
 * @param name             the function identifier, e.g. {@code add_multiply_two_numbers}
 * @param module           the defining module, e.g. {@code __main__}
 * @param parameters       parameters in declaration order
 * @param returnAnnotation return annotation, {@link TypeAnnotation#EMPTY} when absent
 * @param source           literal source of the function definition, may be null
 * @param docstring        the documentation string, may be null
 * @param metadata         attached component metadata, never null
 */
public record FunctionDefinition(
        String name,
        String module,
        List<Parameter> parameters,
        TypeAnnotation returnAnnotation,
        String source,
        String docstring,
        ComponentMetadata metadata) {

    public FunctionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("function name must not be blank");
        }
        module = module == null ? "__main__" : module;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        returnAnnotation = returnAnnotation == null ? TypeAnnotation.EMPTY : returnAnnotation;
        metadata = metadata == null ? ComponentMetadata.none() : metadata;
    }

    /** Creates a new builder for a function with the given identifier. */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Fluent builder for {@link FunctionDefinition}. */
    public static final class Builder {
        private final String name;
        private String module = "__main__";
        private final List<Parameter> parameters = new ArrayList<>();
        private TypeAnnotation returnAnnotation = TypeAnnotation.EMPTY;
        private String source;
        private String docstring;
        private ComponentMetadata metadata = ComponentMetadata.none();

        private Builder(String name) {
            this.name = name;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            this.parameters.add(parameter);
            return this;
        }

        /** Adds a required parameter. */
        public Builder parameter(String parameterName, TypeAnnotation annotation) {
            return parameter(Parameter.required(parameterName, annotation));
        }

        /** Adds an optional parameter with the given default, which may be {@code null}. */
        public Builder optionalParameter(String parameterName, TypeAnnotation annotation, Object defaultValue) {
            return parameter(Parameter.withDefault(parameterName, annotation, defaultValue));
        }

        public Builder returns(TypeAnnotation returnAnnotation) {
            this.returnAnnotation = returnAnnotation;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder docstring(String docstring) {
            this.docstring = docstring;
            return this;
        }

        public Builder metadata(ComponentMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public FunctionDefinition build() {
            return new FunctionDefinition(name, module, parameters, returnAnnotation, source, docstring, metadata);
        }
    }
}
