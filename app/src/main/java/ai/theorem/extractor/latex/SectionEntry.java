package ai.theorem.extractor.latex;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A {@code \section} occurrence in the working text.
 *
 * @param ordinal 1-based position among all {@code \section} commands of the document
 * @param explicitNumber positive leading integer parsed from the title, if any
 * @param number effective section number used for theorem numbering
 * @param startOffset offset of the {@code \section} command
 * @param title raw title text between the braces
 */
public record SectionEntry(int ordinal, OptionalInt explicitNumber, int number, int startOffset, String title) {

    public SectionEntry {
        explicitNumber = explicitNumber == null ? OptionalInt.empty() : explicitNumber;
        title = Objects.requireNonNullElse(title, "");
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be at least 1");
        }
        if (startOffset < 0) {
            throw new IllegalArgumentException("startOffset must not be negative");
        }
    }
}
