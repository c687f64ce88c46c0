package dev.jiff.config;

import java.util.Optional;

/**
 * Read access to environment variables, abstracted so configuration can be tested without the host environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /** Value of {@code key} with surrounding whitespace removed, or empty when unset or blank. */
    default Optional<String> getTrimmed(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
