package ai.theorem.extractor.extract;

import ai.theorem.extractor.extract.label.LabelResolver;
import ai.theorem.extractor.extract.label.ResolutionContext;
import ai.theorem.extractor.latex.SectionEntry;
import ai.theorem.extractor.latex.SectionIndex;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Finds theorem-like spans for every environment of a catalog.
 * <p>
 * The explicit pass handles {@code \begin{env}[number]} forms and takes the bracket contents as the number.
 * The implicit pass handles every {@code \begin{env}...\end{env}} occurrence and asks the {@link LabelResolver}
 * for a number. Both passes may report the same region; {@link SpanDeduplicator} sorts that out.
 */
public class SpanExtractor {

    private final LabelResolver labelResolver;

    public SpanExtractor() {
        this(new LabelResolver());
    }

    public SpanExtractor(LabelResolver labelResolver) {
        this.labelResolver = Objects.requireNonNull(labelResolver, "labelResolver");
    }

    public List<TheoremSpan> extractExplicit(String text, EnvironmentCatalog catalog) {
        List<TheoremSpan> spans = new ArrayList<>();
        for (EnvironmentDescriptor environment : catalog.environments()) {
            Matcher matcher = environment.numberedPattern().matcher(text);
            while (matcher.find()) {
                String number = matcher.group(1).trim();
                LabelledBody labelled = LabelledBody.parse(matcher.group(2));
                spans.add(new TheoremSpan(environment.environmentName(),
                        labelled.label(),
                        displayLabel(environment, number),
                        labelled.body(),
                        matcher.start(),
                        matcher.end()));
            }
        }
        return spans;
    }

    public List<TheoremSpan> extractImplicit(String text,
                                             EnvironmentCatalog catalog,
                                             SectionIndex sections,
                                             boolean sectionScoped) {
        List<TheoremSpan> spans = new ArrayList<>();
        Map<String, Integer> counters = new HashMap<>();
        for (EnvironmentDescriptor environment : catalog.environments()) {
            Matcher matcher = environment.unnumberedPattern().matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                LabelledBody labelled = LabelledBody.parse(matcher.group(1));
                Optional<SectionEntry> section = sectionScoped ? sections.enclosing(start) : Optional.empty();
                int counter = counters.merge(environment.environmentName(), 1, Integer::sum);

                ResolutionContext context = new ResolutionContext(
                        ResolutionContext.windowAround(text, start, end),
                        labelled.label(),
                        section,
                        sectionScoped,
                        counter);
                String number = labelResolver.resolve(context);
                spans.add(new TheoremSpan(environment.environmentName(),
                        labelled.label(),
                        displayLabel(environment, number),
                        labelled.body(),
                        start,
                        end));
            }
        }
        return spans;
    }

    private static String displayLabel(EnvironmentDescriptor environment, String number) {
        return environment.displayName() + " " + number;
    }
}
