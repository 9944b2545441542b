package ai.theorem.extractor.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the paper pipeline over a whole dataset and assembles the output records.
 */
public class DatasetProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetProcessor.class);

    private final PaperPipeline pipeline;
    private final long shuffleSeed;
    private final int sampleLimit;

    /**
     * @param pipeline per-paper pipeline
     * @param shuffleSeed seed used to shuffle the papers before sampling
     * @param sampleLimit number of papers to process after shuffling, or 0 for all of them
     */
    public DatasetProcessor(PaperPipeline pipeline, long shuffleSeed, int sampleLimit) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        if (sampleLimit < 0) {
            throw new IllegalArgumentException("sampleLimit must be zero or greater");
        }
        this.shuffleSeed = shuffleSeed;
        this.sampleLimit = sampleLimit;
    }

    public DatasetRunResult process(List<Paper> papers) {
        if (papers == null || papers.isEmpty()) {
            LOGGER.info("No papers to process");
            return DatasetRunResult.empty();
        }
        List<Paper> selected = selectPapers(papers);

        List<ExtractedTheorem> theorems = new ArrayList<>();
        List<String> failedPapers = new ArrayList<>();
        int totalSpans = 0;
        int keptSpans = 0;
        for (int i = 0; i < selected.size(); i++) {
            Paper paper = selected.get(i);
            String paperLink = paper.paperLink().orElse("");
            LOGGER.info("Processing paper {}/{}: {}", i + 1, selected.size(), paperLink);
            PaperResult result;
            try {
                result = pipeline.process(paper);
            } catch (RuntimeException ex) {
                LOGGER.error("Processing failed for paper {}: {}", paperLink, ex.getMessage(), ex);
                failedPapers.add(paperLink);
                continue;
            }
            totalSpans += result.totalSpans();
            keptSpans += result.keptSpans();
            theorems.addAll(result.theorems());
            LOGGER.info("Found {} high-quality theorems out of {} total", result.keptSpans(), result.totalSpans());
            LOGGER.info("Running totals - theorems found: {}, high-quality theorems: {}, dataset size: {}",
                    totalSpans, keptSpans, theorems.size());
        }

        List<TheoremRecord> records = toRecords(theorems);
        int duplicateContexts = theorems.size() - records.size();
        LOGGER.info("Processing complete: papers={}, theorems found={}, high-quality theorems={}, "
                        + "duplicate contexts removed={}, failed papers={}",
                selected.size(), totalSpans, keptSpans, duplicateContexts, failedPapers.size());
        return new DatasetRunResult(records, selected.size(), totalSpans, keptSpans, duplicateContexts, failedPapers);
    }

    /**
     * Shuffles, drops repeated links in shuffled order, samples, then names unlinked papers by processing index.
     */
    List<Paper> selectPapers(List<Paper> papers) {
        List<Paper> shuffled = new ArrayList<>(papers);
        Collections.shuffle(shuffled, new Random(shuffleSeed));

        Set<String> seenLinks = new HashSet<>();
        List<Paper> unique = new ArrayList<>(shuffled.size());
        for (Paper paper : shuffled) {
            if (paper.paperLink().isEmpty() || seenLinks.add(paper.paperLink().get())) {
                unique.add(paper);
            }
        }
        if (unique.size() < papers.size()) {
            LOGGER.info("Removed {} duplicate papers based on paper_link", papers.size() - unique.size());
        }

        int limit = unique.size();
        if (sampleLimit > 0 && sampleLimit < unique.size()) {
            LOGGER.info("Selected the first {} of {} papers", sampleLimit, unique.size());
            limit = sampleLimit;
        }
        List<Paper> selected = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Paper paper = unique.get(i);
            selected.add(paper.paperLink().isPresent() ? paper : paper.withPaperLink("paper_" + i));
        }
        return List.copyOf(selected);
    }

    private List<TheoremRecord> toRecords(List<ExtractedTheorem> theorems) {
        Set<String> seenContexts = new HashSet<>();
        List<TheoremRecord> records = new ArrayList<>(theorems.size());
        for (ExtractedTheorem theorem : theorems) {
            if (seenContexts.add(theorem.context())) {
                records.add(TheoremRecord.from(records.size(), theorem));
            }
        }
        return records;
    }
}
