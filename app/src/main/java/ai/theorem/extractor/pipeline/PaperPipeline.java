package ai.theorem.extractor.pipeline;

import ai.theorem.extractor.extract.TheoremExtractor;
import ai.theorem.extractor.extract.TheoremSpan;
import ai.theorem.extractor.latex.AppendixTruncator;
import ai.theorem.extractor.latex.CommandHarvester;
import ai.theorem.extractor.latex.CommentStripper;
import ai.theorem.extractor.oracle.QualityCheckService;
import ai.theorem.extractor.oracle.QualityVerdict;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Turns one paper into the theorems worth keeping: strips comments, optionally drops the appendix,
 * extracts spans and keeps those the quality oracle judges to have a single definitive answer.
 */
public class PaperPipeline {

    static final String MDC_PAPER_KEY = "paper";

    private static final Logger LOGGER = LoggerFactory.getLogger(PaperPipeline.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final TheoremExtractor extractor;
    private final QualityCheckService qualityCheckService;
    private final boolean skipAppendix;

    public PaperPipeline(TheoremExtractor extractor, QualityCheckService qualityCheckService, boolean skipAppendix) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.qualityCheckService = Objects.requireNonNull(qualityCheckService, "qualityCheckService");
        this.skipAppendix = skipAppendix;
    }

    public PaperResult process(Paper paper) {
        Objects.requireNonNull(paper, "paper");
        String paperLink = paper.paperLink().orElse("");
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_PAPER_KEY, paperLink)) {
            return processInternal(paper.fullText(), paperLink);
        }
    }

    private PaperResult processInternal(String latexText, String paperLink) {
        List<String> customCommands = CommandHarvester.harvest(latexText);
        LOGGER.debug("Harvested {} custom command definitions", customCommands.size());

        String workingText = AppendixTruncator.truncate(CommentStripper.strip(latexText), skipAppendix);
        List<TheoremSpan> spans = extractor.extract(workingText);
        if (spans.isEmpty()) {
            LOGGER.info("No theorems found in the paper, skipping");
            return PaperResult.empty();
        }

        List<ExtractedTheorem> kept = new ArrayList<>();
        for (int i = 0; i < spans.size(); i++) {
            TheoremSpan span = spans.get(i);
            LOGGER.info("Processing theorem {}/{} ({})", i + 1, spans.size(), span.displayLabel());
            String context = contextBefore(workingText, span.startOffset());
            QualityVerdict verdict = qualityCheckService.check(span.body());
            if (!verdict.singleDefinitiveAnswer()) {
                LOGGER.info("{} does not have a single, definitive answer, skipping", span.displayLabel());
                continue;
            }
            kept.add(new ExtractedTheorem(paperLink, span.displayLabel(), context, span.body(), verdict.explanation()));
        }
        return new PaperResult(kept, spans.size());
    }

    /**
     * Returns the whole working text before {@code position} with whitespace runs collapsed to single spaces.
     */
    static String contextBefore(String workingText, int position) {
        int end = Math.max(0, Math.min(position, workingText.length()));
        return WHITESPACE.matcher(workingText.substring(0, end)).replaceAll(" ").strip();
    }
}
