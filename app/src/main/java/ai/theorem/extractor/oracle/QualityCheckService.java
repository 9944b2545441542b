package ai.theorem.extractor.oracle;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Asks the quality oracle about one theorem at a time with bounded retries and a per-call timeout.
 * Never fails: when no usable verdict is obtained the theorem is rejected with {@link QualityVerdict#rejected()}.
 */
public class QualityCheckService implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(QualityCheckService.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final QualityOracle oracle;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final ExecutorService executor;

    public QualityCheckService(QualityOracle oracle) {
        this(oracle, RetryPolicy.defaults());
    }

    public QualityCheckService(QualityOracle oracle, RetryPolicy retryPolicy) {
        this(oracle, retryPolicy, Thread::sleep);
    }

    QualityCheckService(QualityOracle oracle, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "quality-oracle");
            thread.setDaemon(true);
            return thread;
        });
    }

    public QualityVerdict check(String theoremBody) {
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return callWithTimeout(theoremBody);
            } catch (TimeoutException ex) {
                LOGGER.warn("Quality oracle did not answer within {} seconds; rejecting theorem",
                        retryPolicy.callTimeout().toSeconds());
                return QualityVerdict.rejected();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Quality check interrupted; rejecting theorem");
                return QualityVerdict.rejected();
            } catch (OracleException ex) {
                if (attempt == maxAttempts - 1) {
                    LOGGER.warn("Quality oracle failed after {} attempts ({}); rejecting theorem",
                            maxAttempts, ex.getMessage());
                    return QualityVerdict.rejected();
                }
                Optional<Duration> delay = calculateRetryDelay(ex, attempt);
                if (delay.isEmpty()) {
                    LOGGER.warn("Quality oracle attempt {}/{} failed: {}; retrying",
                            attempt + 1, maxAttempts, ex.getMessage());
                    continue;
                }
                LOGGER.warn("Quality oracle rate limited (429/RESOURCE_EXHAUSTED); retrying in {} seconds (attempt {}/{})",
                        delay.get().toSeconds(), attempt + 1, maxAttempts);
                try {
                    sleeper.sleep(delay.get().toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Quality oracle retry interrupted; rejecting theorem");
                    return QualityVerdict.rejected();
                }
            }
        }
        return QualityVerdict.rejected();
    }

    private QualityVerdict callWithTimeout(String theoremBody) throws TimeoutException, InterruptedException {
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        Future<QualityVerdict> future = executor.submit(() -> {
            if (callerContext != null) {
                MDC.setContextMap(callerContext);
            }
            try {
                return oracle.evaluate(theoremBody);
            } finally {
                MDC.clear();
            }
        });
        try {
            QualityVerdict verdict = future.get(retryPolicy.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (verdict == null) {
                throw new MalformedVerdictException("Quality oracle returned no verdict");
            }
            return verdict;
        } catch (TimeoutException | InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof OracleException oracleException) {
                throw oracleException;
            }
            throw new OracleException("Quality oracle call failed: " + cause, cause);
        }
    }

    private Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }

        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }

        // initialBackoff * 2^attempt, capped, then spread by the jitter factor
        long baseDelaySeconds = retryPolicy.initialBackoffSeconds() * (1L << Math.min(attemptNumber, 30));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, retryPolicy.maxBackoffSeconds());
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * retryPolicy.jitterFactor();
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));

        return Optional.of(Duration.ofSeconds(finalDelaySeconds));
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
        if (matcher.find()) {
            try {
                double seconds = Double.parseDouble(matcher.group(1));
                long millis = Math.max(0, (long) (seconds * 1000));
                return Optional.of(Duration.ofMillis(millis));
            } catch (NumberFormatException ex) {
                LOGGER.debug("Ignoring unparsable retry delay in '{}'", message);
            }
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
