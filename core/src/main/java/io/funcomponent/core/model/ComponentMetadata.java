package io.funcomponent.core.model;

/**
 * Component metadata attached to a function by its author, overriding values derived from the
 * signature. Every field is optional ({@code null} when absent).
 *
 * @param humanName           component name shown to pipeline authors
 * @param description         component description, replaces the docstring
 * @param baseImage           container image the function must run in
 * @param targetComponentFile path the compiled component YAML is written to
 */
public record ComponentMetadata(String humanName, String description, String baseImage, String targetComponentFile) {

    private static final ComponentMetadata NONE = new ComponentMetadata(null, null, null, null);

    /** Metadata with no overrides. */
    public static ComponentMetadata none() {
        return NONE;
    }
}
