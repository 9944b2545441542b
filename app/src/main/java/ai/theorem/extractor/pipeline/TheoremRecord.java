package ai.theorem.extractor.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * One row of the output dataset.
 */
@JsonPropertyOrder({"id", "paper_link", "context", "theorem", "unique_answer_explanation"})
public record TheoremRecord(@JsonProperty("id") int id,
                            @JsonProperty("paper_link") String paperLink,
                            @JsonProperty("context") String context,
                            @JsonProperty("theorem") String theorem,
                            @JsonProperty("unique_answer_explanation") String uniqueAnswerExplanation) {

    public TheoremRecord {
        if (id < 0) {
            throw new IllegalArgumentException("id must not be negative");
        }
        paperLink = Objects.requireNonNullElse(paperLink, "");
        context = Objects.requireNonNullElse(context, "");
        theorem = Objects.requireNonNull(theorem, "theorem");
        uniqueAnswerExplanation = Objects.requireNonNullElse(uniqueAnswerExplanation, "");
    }

    static TheoremRecord from(int id, ExtractedTheorem theorem) {
        return new TheoremRecord(id, theorem.paperLink(), theorem.context(), theorem.theorem(), theorem.explanation());
    }
}
