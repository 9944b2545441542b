package ai.theorem.extractor.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of a batch run over a paper dataset.
 */
public record DatasetRunResult(List<TheoremRecord> records,
                               int papersProcessed,
                               int totalSpans,
                               int keptSpans,
                               int duplicateContextsRemoved,
                               List<String> failedPapers) {

    public DatasetRunResult {
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        failedPapers = List.copyOf(Objects.requireNonNull(failedPapers, "failedPapers"));
    }

    public static DatasetRunResult empty() {
        return new DatasetRunResult(List.of(), 0, 0, 0, 0, List.of());
    }
}
