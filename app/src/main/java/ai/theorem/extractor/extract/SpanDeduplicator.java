package ai.theorem.extractor.extract;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops spans that end where an earlier span already ended and orders the rest by position.
 */
public final class SpanDeduplicator {

    private SpanDeduplicator() {
    }

    /**
     * Keeps the first span seen for each end offset, in the given order, then sorts by start offset.
     * The input list is not modified.
     */
    public static List<TheoremSpan> deduplicateAndSort(List<TheoremSpan> spans) {
        if (spans == null || spans.isEmpty()) {
            return List.of();
        }
        Set<Integer> seenEndOffsets = new HashSet<>();
        List<TheoremSpan> unique = new ArrayList<>(spans.size());
        for (TheoremSpan span : spans) {
            if (seenEndOffsets.add(span.endOffset())) {
                unique.add(span);
            }
        }
        unique.sort(Comparator.comparingInt(TheoremSpan::startOffset));
        return List.copyOf(unique);
    }
}
