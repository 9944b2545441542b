package ai.theorem.extractor.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * One input paper: raw LaTeX source and, when known, a link to the original.
 */
public record Paper(Optional<String> paperLink, String fullText) {

    public Paper {
        paperLink = paperLink == null ? Optional.empty() : paperLink.filter(link -> !link.isBlank());
        fullText = Objects.requireNonNull(fullText, "fullText");
    }

    public static Paper of(String paperLink, String fullText) {
        return new Paper(Optional.ofNullable(paperLink), fullText);
    }

    public Paper withPaperLink(String link) {
        return new Paper(Optional.of(link), fullText);
    }
}
