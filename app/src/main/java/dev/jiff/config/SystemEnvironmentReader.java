package dev.jiff.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads variables from a snapshot of the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    private final Map<String, String> environment;

    public SystemEnvironmentReader() {
        this(System.getenv());
    }

    SystemEnvironmentReader(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(environment.get(key));
    }
}
