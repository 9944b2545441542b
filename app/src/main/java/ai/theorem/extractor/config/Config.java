package ai.theorem.extractor.config;

import ai.theorem.extractor.oracle.OracleMode;
import ai.theorem.extractor.oracle.RetryPolicy;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputPath,
        Path outputPath,
        int sampleLimit,
        boolean includeAppendix,
        long shuffleSeed,
        OracleMode oracleMode,
        LogFormat logFormat,
        OracleConfig oracleConfig,
        Secrets secrets,
        RetryPolicy retryPolicy
) {

    public Config {
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(outputPath, "outputPath");
        if (sampleLimit < 0) {
            throw new IllegalArgumentException("sampleLimit must be greater than or equal to zero");
        }
        oracleMode = Objects.requireNonNull(oracleMode, "oracleMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        oracleConfig = Objects.requireNonNull(oracleConfig, "oracleConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        if (inputPath.normalize().equals(outputPath.normalize())) {
            throw new IllegalArgumentException("output path must differ from the input path");
        }
    }

    public boolean skipAppendix() {
        return !includeAppendix;
    }

    public boolean isDryRun() {
        return oracleMode == OracleMode.DRY_RUN;
    }
}
