package ai.theorem.extractor.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Theorems kept for one paper plus the number of spans found before the quality check.
 */
public record PaperResult(List<ExtractedTheorem> theorems, int totalSpans) {

    public PaperResult {
        theorems = List.copyOf(Objects.requireNonNull(theorems, "theorems"));
        if (totalSpans < theorems.size()) {
            throw new IllegalArgumentException("totalSpans must not be less than the number of kept theorems");
        }
    }

    public static PaperResult empty() {
        return new PaperResult(List.of(), 0);
    }

    public int keptSpans() {
        return theorems.size();
    }
}
