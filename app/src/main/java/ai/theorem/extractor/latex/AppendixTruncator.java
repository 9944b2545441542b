package ai.theorem.extractor.latex;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts a working text at the first appendix marker so that appendix theorems are ignored.
 */
public final class AppendixTruncator {

    private static final List<Pattern> APPENDIX_MARKERS = List.of(
            // a control word ends at the first non-letter, so \appendixname is not a marker
            Pattern.compile("\\\\appendix(?![A-Za-z])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\\\(?:section|part)\\*?\\s*(?:\\[[^\\]]*\\])?\\s*\\{[^}]*appendi(?:x|ces)[^}]*\\}",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\\\begin\\{appendix\\}", Pattern.CASE_INSENSITIVE));

    private AppendixTruncator() {
    }

    public static String truncate(String latexText, boolean skipAppendix) {
        if (!skipAppendix || latexText == null) {
            return latexText;
        }
        OptionalInt start = findAppendixStart(latexText);
        return start.isPresent() ? latexText.substring(0, start.getAsInt()) : latexText;
    }

    /**
     * Returns the offset of the earliest appendix marker, if any.
     */
    public static OptionalInt findAppendixStart(String latexText) {
        if (latexText == null || latexText.isEmpty()) {
            return OptionalInt.empty();
        }
        int earliest = -1;
        for (Pattern marker : APPENDIX_MARKERS) {
            Matcher matcher = marker.matcher(latexText);
            if (matcher.find() && (earliest < 0 || matcher.start() < earliest)) {
                earliest = matcher.start();
            }
        }
        return earliest < 0 ? OptionalInt.empty() : OptionalInt.of(earliest);
    }
}
