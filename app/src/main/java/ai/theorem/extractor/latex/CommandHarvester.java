package ai.theorem.extractor.latex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Collects custom macro and operator definitions from a LaTeX source.
 * The result is side information only; the source text is never modified.
 */
public final class CommandHarvester {

    private static final List<Pattern> DEFINITION_PATTERNS = List.of(
            Pattern.compile("\\\\newcommand\\{\\\\[^}]+\\}(\\[\\d+\\])?\\{[^}]+\\}"),
            Pattern.compile("\\\\DeclareMathOperator\\{\\\\[^}]+\\}\\{[^}]+\\}"),
            Pattern.compile("\\\\def\\\\[A-Za-z0-9]+(\\[[^\\]]*\\])?\\{[^}]+\\}"),
            Pattern.compile("\\\\renewcommand\\{\\\\[^}]+\\}(\\[\\d+\\])?\\{[^}]+\\}"));

    private CommandHarvester() {
    }

    public static List<String> harvest(String latexText) {
        if (latexText == null || latexText.isEmpty()) {
            return List.of();
        }
        List<Definition> definitions = new ArrayList<>();
        for (Pattern pattern : DEFINITION_PATTERNS) {
            Matcher matcher = pattern.matcher(latexText);
            while (matcher.find()) {
                definitions.add(new Definition(matcher.start(), matcher.group()));
            }
        }
        definitions.sort(Comparator.comparingInt(Definition::offset));
        return definitions.stream()
                .map(Definition::text)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns the harvested definitions joined one per line, in document order.
     */
    public static String harvestAsText(String latexText) {
        return String.join("\n", harvest(latexText));
    }

    private record Definition(int offset, String text) { }
}
