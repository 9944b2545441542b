package ai.theorem.extractor.cli;

import ai.theorem.extractor.config.Config;
import ai.theorem.extractor.config.ConfigLoader;
import ai.theorem.extractor.config.OracleConfig;
import ai.theorem.extractor.config.SystemEnvironmentReader;
import ai.theorem.extractor.dataset.DatasetReadException;
import ai.theorem.extractor.dataset.PaperDatasetReader;
import ai.theorem.extractor.extract.TheoremExtractor;
import ai.theorem.extractor.logging.LoggingConfigurator;
import ai.theorem.extractor.oracle.ChatModelQualityOracle;
import ai.theorem.extractor.oracle.PassThroughQualityOracle;
import ai.theorem.extractor.oracle.QualityCheckService;
import ai.theorem.extractor.oracle.QualityOracle;
import ai.theorem.extractor.oracle.QualityOracleFactory;
import ai.theorem.extractor.pipeline.DatasetProcessor;
import ai.theorem.extractor.pipeline.DatasetRunResult;
import ai.theorem.extractor.pipeline.Paper;
import ai.theorem.extractor.pipeline.PaperPipeline;
import ai.theorem.extractor.writer.TheoremDatasetWriter;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and theorem dataset pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private final ConfigLoader configLoader;
    private final Function<Config, ChatModel> chatModelFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createChatModel);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ChatModel> chatModelFactory) {
        this.configLoader = configLoader;
        this.chatModelFactory = chatModelFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println("Invalid configuration: " + ex.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode: input={} output={} sample={} includeAppendix={}",
                config.oracleMode(), config.inputPath(), config.outputPath(), config.sampleLimit(),
                config.includeAppendix());

        try {
            return execute(config);
        } catch (DatasetReadException | UncheckedIOException ex) {
            LOGGER.error("Theorem extraction aborted: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int execute(Config config) {
        List<Paper> papers = new PaperDatasetReader().read(config.inputPath());

        QualityOracleFactory oracleFactory = new QualityOracleFactory(
                () -> createProductionOracle(config), new PassThroughQualityOracle());
        QualityOracle oracle;
        try {
            oracle = oracleFactory.select(config.oracleMode());
        } catch (IllegalStateException ex) {
            LOGGER.error("Quality oracle could not be created: {}", ex.getMessage(), ex);
            return EXIT_CONFIG_ERROR;
        }

        DatasetRunResult runResult;
        try (QualityCheckService qualityCheckService = new QualityCheckService(oracle, config.retryPolicy())) {
            PaperPipeline pipeline = new PaperPipeline(new TheoremExtractor(), qualityCheckService, config.skipAppendix());
            DatasetProcessor processor = new DatasetProcessor(pipeline, config.shuffleSeed(), config.sampleLimit());
            runResult = processor.process(papers);
        }

        new TheoremDatasetWriter().write(config.outputPath(), runResult.records());
        LOGGER.info("Saved {} theorems to {}", runResult.records().size(), config.outputPath());
        if (!runResult.failedPapers().isEmpty()) {
            LOGGER.warn("Extraction failed for papers: {}", String.join(", ", runResult.failedPapers()));
        }
        return EXIT_OK;
    }

    private QualityOracle createProductionOracle(Config config) {
        OracleConfig oracleConfig = config.oracleConfig();
        ChatModel chatModel = chatModelFactory.apply(config);
        return new ChatModelQualityOracle(chatModel, oracleConfig.provider().name(), oracleConfig.modelName());
    }

    private static ChatModel createChatModel(Config config) {
        OracleConfig oracleConfig = config.oracleConfig();
        String apiKey = config.secrets().apiKeyFor(oracleConfig.provider()).orElse(null);
        return switch (oracleConfig.provider()) {
            case OPENAI -> createOpenAiChatModel(oracleConfig, apiKey, config.retryPolicy().callTimeout());
            case GEMINI -> createGeminiChatModel(oracleConfig, apiKey, config.retryPolicy().callTimeout());
            case OLLAMA -> createOllamaChatModel(oracleConfig, config.retryPolicy().callTimeout());
        };
    }

    static ChatModel createOpenAiChatModel(OracleConfig oracleConfig, String apiKey, Duration timeout) {
        if (apiKey == null) {
            throw new IllegalStateException("OPENAI_API_KEY must be provided when LLM_PROVIDER=openai");
        }
        try {
            LOGGER.info("Using OpenAI model '{}'", oracleConfig.modelName());
            return OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(oracleConfig.modelName())
                    .responseFormat("json_object")
                    .timeout(timeout)
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize OpenAI chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(OracleConfig oracleConfig, String apiKey, Duration timeout) {
        if (apiKey == null) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini");
        }
        try {
            LOGGER.info("Using Gemini model '{}'", oracleConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(oracleConfig.modelName())
                    .temperature(0.1)
                    .timeout(timeout)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }

    private static ChatModel createOllamaChatModel(OracleConfig oracleConfig, Duration timeout) {
        try {
            String baseUrl = oracleConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", oracleConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(oracleConfig.modelName())
                    .temperature(0.1)
                    .timeout(timeout)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }
}
