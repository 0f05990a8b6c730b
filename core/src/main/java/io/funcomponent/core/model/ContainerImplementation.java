package io.funcomponent.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Container invocation template: the image plus the command and argument templates.
 *
 * @param image   container image reference
 * @param command command template, literal tokens only in compiled components
 * @param args    argument template with placeholders
 */
public record ContainerImplementation(String image, List<PlaceholderNode> command, List<PlaceholderNode> args) {

    public ContainerImplementation {
        Objects.requireNonNull(image, "image must not be null");
        command = command == null ? List.of() : List.copyOf(command);
        args = args == null ? List.of() : List.copyOf(args);
    }
}
