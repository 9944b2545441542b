package ai.theorem.extractor.pipeline;

import java.util.Objects;

/**
 * A theorem that passed the quality check, with the text that precedes it in its paper.
 */
public record ExtractedTheorem(String paperLink,
                               String displayLabel,
                               String context,
                               String theorem,
                               String explanation) {

    public ExtractedTheorem {
        paperLink = Objects.requireNonNullElse(paperLink, "");
        displayLabel = Objects.requireNonNullElse(displayLabel, "");
        context = Objects.requireNonNullElse(context, "");
        theorem = Objects.requireNonNull(theorem, "theorem");
        explanation = Objects.requireNonNullElse(explanation, "");
    }
}
