package io.funcomponent.core.engine;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out unique names within one namespace. A name already taken gets the first free
 * {@code _2}, {@code _3}, ... suffix. Not thread-safe; one instance per namespace per compilation.
 */
final class NameCollisionResolver {

    private static final String DELIMITER = "_";

    private final Set<String> used = new HashSet<>();

    /**
     * Reserves and returns a unique name derived from {@code name}.
     *
     * @param name the preferred name
     * @return {@code name} if free, otherwise {@code name + "_" + i} for the smallest free i ≥ 2
     */
    String claim(String name) {
        String unique = name;
        for (int i = 2; used.contains(unique); i++) {
            unique = name + DELIMITER + i;
        }
        used.add(unique);
        return unique;
    }
}
