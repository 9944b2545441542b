package ai.theorem.extractor.cli;

import ai.theorem.extractor.config.LogFormat;
import ai.theorem.extractor.oracle.OracleMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-theorem-extractor", mixinStandardHelpOptions = true,
        description = "Extracts theorems with a single definitive answer from LaTeX papers")
public class CliArguments {

    @CommandLine.Option(names = "--input", description = "Paper dataset: a JSON Lines file or a directory of .tex files", paramLabel = "PATH")
    private Path input;

    @CommandLine.Option(names = "--output", description = "Output JSON Lines file for the theorem dataset", paramLabel = "PATH")
    private Path output;

    @CommandLine.Option(names = "--sample-papers", description = "Number of papers to process after shuffling", paramLabel = "COUNT")
    private Integer samplePapers;

    @CommandLine.Option(names = "--include-appendix", description = "Include theorems from appendices (skipped by default)")
    private boolean includeAppendix;

    @CommandLine.Option(names = "--seed", description = "Seed used to shuffle the papers", paramLabel = "SEED")
    private Long seed;

    @CommandLine.Option(names = "--oracle-mode", description = "Quality oracle mode: production or dry-run", converter = OracleModeConverter.class)
    private OracleMode oracleMode;

    @CommandLine.Option(names = "--dry-run", description = "Keep every extracted theorem without calling the quality oracle")
    private boolean dryRun;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public Integer samplePapers() {
        return samplePapers;
    }

    public boolean includeAppendix() {
        return includeAppendix;
    }

    public Long seed() {
        return seed;
    }

    public OracleMode oracleMode() {
        return oracleMode;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
