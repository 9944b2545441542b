package ai.theorem.extractor.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered index of {@code \section} boundaries and their effective numbers.
 */
public final class SectionIndex {

    private static final Pattern SECTION = Pattern.compile("\\\\section\\s*(?:\\[.*?\\])?\\s*\\{([^}]*)\\}");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)[.\\s]+");

    private final List<SectionEntry> entries;

    private SectionIndex(List<SectionEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Scans the text for sections. A title such as {@code "2. Main Results"} sets the section number to 2
     * and the running counter continues from there; a missing or non-positive leading integer keeps the counter.
     */
    public static SectionIndex build(String latexText) {
        if (latexText == null || latexText.isEmpty()) {
            return new SectionIndex(List.of());
        }
        List<SectionEntry> entries = new ArrayList<>();
        Matcher matcher = SECTION.matcher(latexText);
        int ordinal = 0;
        int counter = 0;
        while (matcher.find()) {
            ordinal++;
            counter++;
            String title = matcher.group(1);
            OptionalInt explicitNumber = parseLeadingNumber(title);
            if (explicitNumber.isPresent()) {
                counter = explicitNumber.getAsInt();
            }
            entries.add(new SectionEntry(ordinal, explicitNumber, counter, matcher.start(), title));
        }
        return new SectionIndex(entries);
    }

    public List<SectionEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns the last section starting strictly before {@code offset}.
     */
    public Optional<SectionEntry> enclosing(int offset) {
        SectionEntry current = null;
        for (SectionEntry entry : entries) {
            if (entry.startOffset() < offset) {
                current = entry;
            } else {
                break;
            }
        }
        return Optional.ofNullable(current);
    }

    private static OptionalInt parseLeadingNumber(String title) {
        Matcher matcher = LEADING_NUMBER.matcher(title);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            int value = Integer.parseInt(matcher.group(1));
            return value > 0 ? OptionalInt.of(value) : OptionalInt.empty();
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }
}
