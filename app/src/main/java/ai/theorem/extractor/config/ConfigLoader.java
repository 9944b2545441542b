package ai.theorem.extractor.config;

import ai.theorem.extractor.cli.CliArguments;
import ai.theorem.extractor.oracle.OracleMode;
import ai.theorem.extractor.oracle.RetryPolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT_PATH = "INPUT_PATH";
    static final String ENV_OUTPUT_PATH = "OUTPUT_PATH";
    static final String ENV_SAMPLE_PAPERS = "SAMPLE_PAPERS";
    static final String ENV_INCLUDE_APPENDIX = "INCLUDE_APPENDIX";
    static final String ENV_SHUFFLE_SEED = "SHUFFLE_SEED";
    static final String ENV_ORACLE_MODE = "ORACLE_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_ORACLE_TIMEOUT_SECONDS = "ORACLE_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";

    private static final String DEFAULT_OUTPUT_PATH = "theorem_dataset.jsonl";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final long DEFAULT_SHUFFLE_SEED = 42L;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        OracleMode oracleMode = resolveOracleMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        Path inputPath = Optional.ofNullable(arguments.input())
                .or(() -> env(ENV_INPUT_PATH).map(Path::of))
                .orElseThrow(() -> new IllegalArgumentException("input path must be provided (--input or INPUT_PATH)"));
        Path outputPath = Optional.ofNullable(arguments.output())
                .orElseGet(() -> Path.of(env(ENV_OUTPUT_PATH).orElse(DEFAULT_OUTPUT_PATH)));

        int sampleLimit = resolveSampleLimit(arguments);
        boolean includeAppendix = arguments.includeAppendix()
                || env(ENV_INCLUDE_APPENDIX).map(ConfigLoader::parseBoolean).orElse(false);
        long shuffleSeed = Optional.ofNullable(arguments.seed())
                .or(() -> env(ENV_SHUFFLE_SEED).map(ConfigLoader::parseLong))
                .orElse(DEFAULT_SHUFFLE_SEED);

        LlmProvider provider = env(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OPENAI);
        String modelName = env(ENV_LLM_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        OracleConfig oracleConfig = new OracleConfig(provider, modelName, baseUrl);

        Secrets secrets = new Secrets(env(ENV_OPENAI_API_KEY), env(ENV_GEMINI_API_KEY));
        if (oracleMode == OracleMode.PRODUCTION && oracleConfig.requiresApiKey()
                && secrets.apiKeyFor(provider).isEmpty()) {
            throw new IllegalStateException(apiKeyVariable(provider) + " must be provided unless running in dry-run mode");
        }

        RetryPolicy retryPolicy = new RetryPolicy(
                env(ENV_LLM_MAX_RETRY_ATTEMPTS)
                        .map(value -> parsePositiveInteger(ENV_LLM_MAX_RETRY_ATTEMPTS, value))
                        .orElse(RetryPolicy.DEFAULT_MAX_ATTEMPTS),
                env(ENV_LLM_INITIAL_BACKOFF_SECONDS)
                        .map(value -> parsePositiveInteger(ENV_LLM_INITIAL_BACKOFF_SECONDS, value))
                        .orElse(RetryPolicy.DEFAULT_INITIAL_BACKOFF_SECONDS),
                env(ENV_LLM_MAX_BACKOFF_SECONDS)
                        .map(value -> parsePositiveInteger(ENV_LLM_MAX_BACKOFF_SECONDS, value))
                        .orElse(RetryPolicy.DEFAULT_MAX_BACKOFF_SECONDS),
                env(ENV_LLM_RETRY_JITTER_FACTOR)
                        .map(ConfigLoader::parseDouble)
                        .orElse(RetryPolicy.DEFAULT_JITTER_FACTOR),
                env(ENV_ORACLE_TIMEOUT_SECONDS)
                        .map(value -> Duration.ofSeconds(parsePositiveInteger(ENV_ORACLE_TIMEOUT_SECONDS, value)))
                        .orElse(RetryPolicy.DEFAULT_CALL_TIMEOUT));

        return new Config(inputPath, outputPath, sampleLimit, includeAppendix, shuffleSeed, oracleMode, logFormat,
                oracleConfig, secrets, retryPolicy);
    }

    private OracleMode resolveOracleMode(CliArguments arguments) {
        OracleMode cliMode = arguments.oracleMode();
        if (cliMode != null) {
            return cliMode;
        }
        if (arguments.dryRun()) {
            return OracleMode.DRY_RUN;
        }
        return env(ENV_ORACLE_MODE)
                .map(OracleMode::from)
                .orElse(OracleMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveSampleLimit(CliArguments arguments) {
        Integer limit = arguments.samplePapers();
        if (limit != null) {
            if (limit < 0) {
                throw new IllegalArgumentException("--sample-papers must be zero or greater");
            }
            return limit;
        }
        return env(ENV_SAMPLE_PAPERS)
                .map(value -> parsePositiveInteger(ENV_SAMPLE_PAPERS, value))
                .orElse(0);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private static String apiKeyVariable(LlmProvider provider) {
        return provider == LlmProvider.GEMINI ? ENV_GEMINI_API_KEY : ENV_OPENAI_API_KEY;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        return value.equals("true") || value.equals("1") || value.equals("yes");
    }

    private static int parsePositiveInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static long parseLong(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_SHUFFLE_SEED + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
