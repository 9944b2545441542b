package ai.theorem.extractor.config;

import java.util.Optional;

/**
 * Source of environment values, replaceable in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
