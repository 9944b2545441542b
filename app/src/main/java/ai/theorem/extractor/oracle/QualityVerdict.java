package ai.theorem.extractor.oracle;

import java.util.Objects;

/**
 * Oracle judgement on whether a theorem has a single, definitive answer.
 */
public record QualityVerdict(boolean singleDefinitiveAnswer, String explanation) {

    private static final QualityVerdict REJECTED = new QualityVerdict(false, "");

    public QualityVerdict {
        explanation = Objects.requireNonNullElse(explanation, "");
    }

    /**
     * Verdict used whenever the oracle cannot give a usable answer.
     */
    public static QualityVerdict rejected() {
        return REJECTED;
    }
}
