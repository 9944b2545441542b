package ai.theorem.extractor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.theorem.extractor.cli.CliArguments;
import ai.theorem.extractor.oracle.OracleMode;
import ai.theorem.extractor.oracle.RetryPolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "papers.jsonl",
                "--output", "out/theorems.jsonl",
                "--sample-papers", "5",
                "--include-appendix",
                "--seed", "7",
                "--oracle-mode", "dry-run",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputPath()).isEqualTo(Path.of("papers.jsonl"));
        assertThat(config.outputPath()).isEqualTo(Path.of("out/theorems.jsonl"));
        assertThat(config.sampleLimit()).isEqualTo(5);
        assertThat(config.includeAppendix()).isTrue();
        assertThat(config.skipAppendix()).isFalse();
        assertThat(config.shuffleSeed()).isEqualTo(7L);
        assertThat(config.oracleMode()).isEqualTo(OracleMode.DRY_RUN);
        assertThat(config.isDryRun()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.oracleConfig().provider()).isEqualTo(LlmProvider.OPENAI);
        assertThat(config.oracleConfig().modelName()).isEqualTo("o3-mini");
        assertThat(config.oracleConfig().baseUrl()).isEmpty();
        assertThat(config.secrets().openAiApiKey()).isEmpty();
    }

    @Test
    void appliesDefaultsForOmittedValues() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "papers", "--dry-run");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.outputPath()).isEqualTo(Path.of("theorem_dataset.jsonl"));
        assertThat(config.sampleLimit()).isZero();
        assertThat(config.skipAppendix()).isTrue();
        assertThat(config.shuffleSeed()).isEqualTo(42L);
        assertThat(config.oracleMode()).isEqualTo(OracleMode.DRY_RUN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.retryPolicy()).isEqualTo(RetryPolicy.defaults());
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_INPUT_PATH, "/data/papers.jsonl");
        envValues.put(ConfigLoader.ENV_OUTPUT_PATH, "/data/theorems.jsonl");
        envValues.put(ConfigLoader.ENV_SAMPLE_PAPERS, "3");
        envValues.put(ConfigLoader.ENV_INCLUDE_APPENDIX, "true");
        envValues.put(ConfigLoader.ENV_SHUFFLE_SEED, "11");
        envValues.put(ConfigLoader.ENV_ORACLE_MODE, "production");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_LLM_PROVIDER, "ollama");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "llama3.1:8b");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_ORACLE_TIMEOUT_SECONDS, "30");
        envValues.put(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS, "3");
        envValues.put(ConfigLoader.ENV_LLM_INITIAL_BACKOFF_SECONDS, "1");
        envValues.put(ConfigLoader.ENV_LLM_MAX_BACKOFF_SECONDS, "10");
        envValues.put(ConfigLoader.ENV_LLM_RETRY_JITTER_FACTOR, "0.1");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.inputPath()).isEqualTo(Path.of("/data/papers.jsonl"));
        assertThat(config.outputPath()).isEqualTo(Path.of("/data/theorems.jsonl"));
        assertThat(config.sampleLimit()).isEqualTo(3);
        assertThat(config.includeAppendix()).isTrue();
        assertThat(config.shuffleSeed()).isEqualTo(11L);
        assertThat(config.oracleMode()).isEqualTo(OracleMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.oracleConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.oracleConfig().modelName()).isEqualTo("llama3.1:8b");
        assertThat(config.oracleConfig().baseUrl()).contains("http://ollama:11434");
        assertThat(config.retryPolicy()).isEqualTo(new RetryPolicy(3, 1, 10, 0.1, Duration.ofSeconds(30)));
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_OLLAMA_BASE_URL);
    }

    @Test
    void cliValuesTakePrecedenceOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_INPUT_PATH, "env.jsonl",
                ConfigLoader.ENV_SHUFFLE_SEED, "99",
                ConfigLoader.ENV_ORACLE_MODE, "production"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "cli.jsonl", "--seed", "1", "--dry-run");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.inputPath()).isEqualTo(Path.of("cli.jsonl"));
        assertThat(config.shuffleSeed()).isEqualTo(1L);
        assertThat(config.oracleMode()).isEqualTo(OracleMode.DRY_RUN);
    }

    @Test
    void providerDefaultModelIsUsedWithoutOverride() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "gemini",
                ConfigLoader.ENV_GEMINI_API_KEY, "gemini-key"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "papers.jsonl");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.oracleConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.oracleConfig().modelName()).isEqualTo("gemini-1.5-pro");
        assertThat(config.secrets().apiKeyFor(LlmProvider.GEMINI)).contains("gemini-key");
        assertThat(config.secrets().toString()).doesNotContain("gemini-key");
    }

    @Test
    void missingApiKeyInProductionModeThrows() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_INPUT_PATH, "papers.jsonl"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void missingGeminiKeyNamesGeminiVariable() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "gemini",
                ConfigLoader.ENV_OPENAI_API_KEY, "openai-key"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "papers.jsonl");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void missingInputPathThrows() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--dry-run");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("input path");
    }

    @Test
    void invalidIntegerInEnvironmentThrows() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_SAMPLE_PAPERS, "many"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "papers.jsonl", "--dry-run");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_SAMPLE_PAPERS);
    }

    @Test
    void outputMustDifferFromInput() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "same.jsonl", "--output", "./same.jsonl", "--dry-run");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
