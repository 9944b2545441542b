package ai.theorem.extractor.extract.label;

import ai.theorem.extractor.latex.SectionEntry;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a {@link NumberResolver} may look at when inferring the number of an unnumbered theorem.
 *
 * @param window working text surrounding the theorem
 * @param label the theorem's {@code \label} key, if any
 * @param enclosingSection last section starting before the theorem, if any
 * @param sectionScoped whether the document numbers theorems within sections
 * @param counter 1-based running count of this environment's occurrences
 */
public record ResolutionContext(String window,
                                Optional<String> label,
                                Optional<SectionEntry> enclosingSection,
                                boolean sectionScoped,
                                int counter) {

    public static final int WINDOW_RADIUS = 1000;

    public ResolutionContext {
        window = Objects.requireNonNullElse(window, "");
        label = label == null ? Optional.empty() : label;
        enclosingSection = enclosingSection == null ? Optional.empty() : enclosingSection;
        if (counter < 1) {
            throw new IllegalArgumentException("counter must be at least 1");
        }
    }

    /**
     * Returns the text from {@value #WINDOW_RADIUS} characters before {@code start} to the same distance
     * after {@code end}, clamped to the bounds of {@code text}.
     */
    public static String windowAround(String text, int start, int end) {
        int from = Math.max(0, start - WINDOW_RADIUS);
        int to = Math.min(text.length(), end + WINDOW_RADIUS);
        return text.substring(from, Math.max(from, to));
    }
}
