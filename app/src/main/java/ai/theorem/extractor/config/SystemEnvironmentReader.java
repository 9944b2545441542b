package ai.theorem.extractor.config;

import java.util.Optional;

/**
 * Reads values from the process environment, treating blank values as absent.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key)).filter(value -> !value.isBlank());
    }
}
