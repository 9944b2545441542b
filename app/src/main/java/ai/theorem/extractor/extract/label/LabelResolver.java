package ai.theorem.extractor.extract.label;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Infers the display number of an unnumbered theorem by trying resolvers in order until one answers.
 * The bare counter always answers, so every theorem gets a number.
 */
public class LabelResolver {

    static final String NUMBER = "([0-9]+(?:\\.[0-9]+)*)";

    private final List<NumberResolver> resolvers;

    public LabelResolver() {
        this(defaultChain());
    }

    public LabelResolver(List<NumberResolver> resolvers) {
        this.resolvers = List.copyOf(Objects.requireNonNull(resolvers, "resolvers"));
    }

    /**
     * The default heuristic chain, most specific evidence first:
     * <ol>
     *   <li>{@code \ref{label}} followed by a number</li>
     *   <li>numbered label keys such as {@code \label{thm:3}} or {@code \label{theorem_2.1}}</li>
     *   <li>{@code \tag{...}}</li>
     *   <li>textual references such as "Theorem 4" or "theorem 2.3"</li>
     *   <li>digits inside the theorem's own label</li>
     *   <li>section number and counter, for section-scoped documents</li>
     *   <li>the bare counter</li>
     * </ol>
     */
    public static List<NumberResolver> defaultChain() {
        return List.of(
                new ReferenceNumberResolver(),
                new WindowPatternResolver("\\\\label\\{(?:theorem|thm)(?::|_|-)" + NUMBER),
                new WindowPatternResolver("\\\\label\\{(?:th|theorem):?" + NUMBER),
                new WindowPatternResolver("\\\\tag\\{\\(?([^}]+?)\\)?\\}"),
                new WindowPatternResolver("theorem[\\s~]*(?:\\\\ref\\{[^}]*\\}|" + NUMBER + ")"),
                new WindowPatternResolver("theorem[\\s~]*([0-9]+\\.[0-9]+)"),
                new WindowPatternResolver("theorem[\\s~]*([0-9]+)"),
                new LabelDigitsResolver(),
                new SectionCounterResolver(),
                context -> Optional.of(Integer.toString(context.counter())));
    }

    public String resolve(ResolutionContext context) {
        Objects.requireNonNull(context, "context");
        for (NumberResolver resolver : resolvers) {
            Optional<String> number = resolver.resolve(context);
            if (number.isPresent()) {
                return number.get();
            }
        }
        return Integer.toString(context.counter());
    }
}
