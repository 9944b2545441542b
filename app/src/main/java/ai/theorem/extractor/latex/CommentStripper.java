package ai.theorem.extractor.latex;

import java.util.regex.Pattern;

/**
 * Removes LaTeX line comments while keeping escaped percent signs.
 */
public final class CommentStripper {

    private static final Pattern LINE_COMMENT = Pattern.compile("(?<!\\\\)%[^\\n]*(?:\\n|$)");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n\\s*\\n+");

    private CommentStripper() {
    }

    /**
     * Strips every unescaped {@code %...} up to the end of its line and collapses runs of blank lines
     * into a single blank line. Text before a comment marker on the same line is left untouched.
     *
     * @param latexText raw LaTeX source
     * @return the source without comments, never {@code null}
     */
    public static String strip(String latexText) {
        if (latexText == null || latexText.isEmpty()) {
            return "";
        }
        String withoutComments = LINE_COMMENT.matcher(latexText).replaceAll("\n");
        return BLANK_LINE_RUN.matcher(withoutComments).replaceAll("\n\n");
    }
}
