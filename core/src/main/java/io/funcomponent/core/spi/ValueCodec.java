package io.funcomponent.core.spi;

/**
 * Converts values to and from their serialized text form for a given type name. Used at
 * analysis time to materialize parameter defaults.
 */
public interface ValueCodec {

    /**
     * Serializes a value to the text form expected for {@code typeName}.
     *
     * @param value    the value, never null
     * @param typeName canonical type name, or {@code null} to infer it from the value
     * @return the serialized text
     * @throws io.funcomponent.core.error.ValueSerializationException if the value does not match
     *     the type
     */
    String serialize(Object value, String typeName);

    /**
     * Decodes serialized text back into a value of {@code typeName}.
     *
     * @param text     the serialized text
     * @param typeName canonical type name, or {@code null} for plain text
     * @return the decoded value
     * @throws io.funcomponent.core.error.ValueSerializationException if the text cannot be decoded
     */
    Object deserialize(String text, String typeName);
}
