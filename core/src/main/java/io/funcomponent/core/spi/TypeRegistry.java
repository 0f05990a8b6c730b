package io.funcomponent.core.spi;

import java.util.Optional;

/**
 * Registry of data types known to the pipeline system. Maps annotation types to canonical type
 * names, and type names to the Python code that encodes or decodes values of that type inside
 * the container.
 *
 * <p>Implementations MUST be immutable and thread-safe.
 */
public interface TypeRegistry {

    /**
     * Looks up the canonical type name registered for a type key. Keys are native type names
     * ({@code int}, {@code dict}) and the string aliases of registered types ({@code Integer},
     * {@code List}).
     *
     * @param typeKey the native type name or alias
     * @return the canonical type name, or empty if the key is not registered
     */
    Optional<String> typeName(String typeKey);

    /**
     * Returns the serializer used to write an output value of the given type to a file.
     *
     * @param typeName canonical type name
     * @return the serializer, or empty if values of this type are written with {@code str}
     */
    Optional<Serializer> serializer(String typeName);

    /**
     * Returns the deserializer used to decode a command-line argument of the given type.
     *
     * @param typeName canonical type name
     * @return the deserializer, or empty if arguments of this type are passed as plain text
     */
    Optional<Deserializer> deserializer(String typeName);

    /**
     * Python serializer for a type.
     *
     * @param functionName name of the Python callable that turns a value into text
     * @param definition   Python source defining {@code functionName}, or {@code null} if the
     *                     callable is available in the standard library
     */
    record Serializer(String functionName, String definition) {}

    /**
     * Python deserializer for a type.
     *
     * @param expression Python expression evaluating to a callable that decodes text
     * @param definition Python source the expression depends on, or {@code null}
     */
    record Deserializer(String expression, String definition) {}
}
