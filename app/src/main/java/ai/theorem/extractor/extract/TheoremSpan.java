package ai.theorem.extractor.extract;

import java.util.Objects;
import java.util.Optional;

/**
 * A theorem-like region of the working text. Offsets refer to the text the extraction ran on.
 */
public record TheoremSpan(String environmentName,
                          Optional<String> label,
                          String displayLabel,
                          String body,
                          int startOffset,
                          int endOffset) {

    public TheoremSpan {
        Objects.requireNonNull(environmentName, "environmentName");
        label = label == null ? Optional.empty() : label;
        Objects.requireNonNull(displayLabel, "displayLabel");
        body = Objects.requireNonNullElse(body, "");
        if (startOffset < 0 || startOffset >= endOffset) {
            throw new IllegalArgumentException("startOffset must be non-negative and less than endOffset: "
                    + startOffset + " >= " + endOffset);
        }
    }
}
