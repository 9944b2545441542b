package ai.theorem.extractor.oracle;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds on how long and how often the oracle is asked before a theorem is rejected by default.
 *
 * @param maxAttempts total number of oracle calls per theorem, including the first one
 * @param initialBackoffSeconds base delay after a rate-limited call
 * @param maxBackoffSeconds upper bound of the exponential backoff
 * @param jitterFactor random spread applied to each backoff delay, between 0.0 and 1.0
 * @param callTimeout wall-clock limit of a single oracle call
 */
public record RetryPolicy(int maxAttempts,
                          int initialBackoffSeconds,
                          int maxBackoffSeconds,
                          double jitterFactor,
                          Duration callTimeout) {

    public static final int DEFAULT_MAX_ATTEMPTS = 6;
    public static final int DEFAULT_INITIAL_BACKOFF_SECONDS = 2;
    public static final int DEFAULT_MAX_BACKOFF_SECONDS = 60;
    public static final double DEFAULT_JITTER_FACTOR = 0.3;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(120);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF_SECONDS, DEFAULT_MAX_BACKOFF_SECONDS,
                DEFAULT_JITTER_FACTOR, DEFAULT_CALL_TIMEOUT);
    }
}
