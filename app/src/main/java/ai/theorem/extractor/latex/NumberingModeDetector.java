package ai.theorem.extractor.latex;

import java.util.List;

/**
 * Detects whether a document numbers its theorems within sections (e.g. "Theorem 2.3").
 */
public final class NumberingModeDetector {

    private static final List<String> SECTION_SCOPED_DIRECTIVES = List.of(
            "\\numberwithin{theorem}{section}",
            "\\numberwithin{thm}{section}",
            "\\renewcommand{\\thethm}{\\thesection.\\arabic{thm}}",
            "\\renewcommand{\\thetheorem}{\\thesection.\\arabic{theorem}}",
            "\\newtheorem{theorem}{Theorem}[section]");

    private NumberingModeDetector() {
    }

    public static boolean isSectionScoped(String latexText) {
        if (latexText == null || latexText.isEmpty()) {
            return false;
        }
        for (String directive : SECTION_SCOPED_DIRECTIVES) {
            if (latexText.contains(directive)) {
                return true;
            }
        }
        return false;
    }
}
