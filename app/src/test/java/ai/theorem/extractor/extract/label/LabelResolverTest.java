package ai.theorem.extractor.extract.label;

import static org.assertj.core.api.Assertions.assertThat;

import ai.theorem.extractor.latex.SectionEntry;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class LabelResolverTest {

    private final LabelResolver resolver = new LabelResolver();

    @Test
    void referenceFollowedByNumberComesFirst() {
        ResolutionContext context = context("Theorem 9 aside, \\ref{thm:main} 3.2 is what we prove.", "thm:main");

        assertThat(new ReferenceNumberResolver().resolve(context)).contains("3.2");
        assertThat(resolver.resolve(context)).isEqualTo("3.2");
    }

    @Test
    void readsNumberedLabelKeys() {
        assertThat(resolver.resolve(context("\\label{thm:4} text", null))).isEqualTo("4");
        assertThat(resolver.resolve(context("\\label{theorem_2.1} text", null))).isEqualTo("2.1");
        assertThat(resolver.resolve(context("\\label{th12} text", null))).isEqualTo("12");
    }

    @Test
    void readsTagWithoutParentheses() {
        assertThat(resolver.resolve(context("x = y \\tag{(3)}", null))).isEqualTo("3");
        assertThat(resolver.resolve(context("x = y \\tag{A1}", null))).isEqualTo("A1");
    }

    @Test
    void readsTextualTheoremReferences() {
        assertThat(resolver.resolve(context("By Theorem 4.2 we get", null))).isEqualTo("4.2");
        assertThat(resolver.resolve(context("by theorem~5, done", null))).isEqualTo("5");
    }

    @Test
    void onlyFirstTextualMatchIsConsultedByEachPattern() {
        WindowPatternResolver textual = new WindowPatternResolver(
                "theorem[\\s~]*(?:\\\\ref\\{[^}]*\\}|" + LabelResolver.NUMBER + ")");
        ResolutionContext context = context("Theorem~\\ref{a} and Theorem 3.1", null);

        assertThat(textual.resolve(context)).isEmpty();
        assertThat(resolver.resolve(context)).isEqualTo("3.1");
    }

    @Test
    void fallsBackToDigitsOfOwnLabel() {
        ResolutionContext context = context("no hints here", "lem7");

        assertThat(new LabelDigitsResolver().resolve(context)).contains("7");
        assertThat(resolver.resolve(context)).isEqualTo("7");
    }

    @Test
    void synthesizesSectionNumberOnlyWhenSectionScoped() {
        SectionEntry section = new SectionEntry(2, OptionalInt.empty(), 2, 10, "Main");
        ResolutionContext scoped = new ResolutionContext("plain", Optional.empty(), Optional.of(section), true, 3);
        ResolutionContext unscoped = new ResolutionContext("plain", Optional.empty(), Optional.of(section), false, 3);

        assertThat(new SectionCounterResolver().resolve(scoped)).contains("2.3");
        assertThat(resolver.resolve(scoped)).isEqualTo("2.3");
        assertThat(new SectionCounterResolver().resolve(unscoped)).isEmpty();
        assertThat(resolver.resolve(unscoped)).isEqualTo("3");
    }

    @Test
    void emptyChainStillAnswersWithCounter() {
        LabelResolver silent = new LabelResolver(List.of(ctx -> Optional.empty()));

        assertThat(silent.resolve(new ResolutionContext("", Optional.empty(), Optional.empty(), false, 5)))
                .isEqualTo("5");
    }

    @Test
    void windowIsClampedToText() {
        String text = "a".repeat(1500) + "THEOREM" + "b".repeat(1500);
        int start = 1500;
        int end = start + "THEOREM".length();

        String window = ResolutionContext.windowAround(text, start, end);

        assertThat(window).hasSize(2 * ResolutionContext.WINDOW_RADIUS + "THEOREM".length());
        assertThat(ResolutionContext.windowAround("short", 1, 3)).isEqualTo("short");
    }

    private static ResolutionContext context(String window, String label) {
        return new ResolutionContext(window, Optional.ofNullable(label), Optional.empty(), false, 1);
    }
}
