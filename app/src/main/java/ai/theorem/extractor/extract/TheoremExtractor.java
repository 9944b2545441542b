package ai.theorem.extractor.extract;

import ai.theorem.extractor.latex.NumberingModeDetector;
import ai.theorem.extractor.latex.SectionIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs structural extraction over one working text and returns non-overlapping spans in document order.
 * Holds no per-document state, so one instance can serve any number of documents.
 */
public class TheoremExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TheoremExtractor.class);

    private final SpanExtractor spanExtractor;

    public TheoremExtractor() {
        this(new SpanExtractor());
    }

    public TheoremExtractor(SpanExtractor spanExtractor) {
        this.spanExtractor = Objects.requireNonNull(spanExtractor, "spanExtractor");
    }

    public List<TheoremSpan> extract(String workingText) {
        if (workingText == null || workingText.isEmpty()) {
            return List.of();
        }
        boolean sectionScoped = NumberingModeDetector.isSectionScoped(workingText);
        SectionIndex sections = SectionIndex.build(workingText);
        EnvironmentCatalog catalog = EnvironmentCatalog.discover(workingText);
        LOGGER.debug("Theorem environments: {}; sections: {}; section-scoped numbering: {}",
                catalog.size(), sections.entries().size(), sectionScoped);

        List<TheoremSpan> candidates = new ArrayList<>(spanExtractor.extractExplicit(workingText, catalog));
        candidates.addAll(spanExtractor.extractImplicit(workingText, catalog, sections, sectionScoped));

        List<TheoremSpan> spans = SpanDeduplicator.deduplicateAndSort(candidates);
        int removed = candidates.size() - spans.size();
        if (removed > 0) {
            LOGGER.debug("Removed {} duplicate theorem spans", removed);
        }
        return spans;
    }
}
