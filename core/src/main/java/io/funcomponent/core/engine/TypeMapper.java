package io.funcomponent.core.engine;

import io.funcomponent.core.model.TypeAnnotation;
import io.funcomponent.core.spi.TypeRegistry;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a parameter or return annotation to a canonical type name.
 *
 * <p>Never fails: every annotation resolves to some type name, or to empty when it is absent.
 */
public final class TypeMapper {

    private final TypeRegistry typeRegistry;

    public TypeMapper(TypeRegistry typeRegistry) {
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "typeRegistry must not be null");
    }

    /**
     * Resolves the canonical type name of an annotation.
     *
     * @param annotation the annotation, may be null
     * @return the type name, or empty for an absent annotation
     */
    public Optional<String> resolve(TypeAnnotation annotation) {
        if (annotation == null || annotation.isEmpty()) {
            return Optional.empty();
        }
        String typeName;
        if (annotation instanceof TypeAnnotation.NativeType nativeType) {
            Optional<String> registered = typeRegistry.typeName(nativeType.name());
            if (registered.isPresent()) {
                return registered;
            }
            typeName = nativeType.name();
        } else if (annotation instanceof TypeAnnotation.ForwardRef forwardRef) {
            typeName = forwardRef.name();
        } else {
            typeName = annotation.toString();
        }
        // The table is keyed by type names as well, e.g. "int" or "Dict"
        return Optional.of(typeRegistry.typeName(typeName).orElse(typeName));
    }
}
