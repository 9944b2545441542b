package ai.theorem.extractor.extract.label;

import java.util.Optional;

/**
 * Synthesizes {@code "<section>.<counter>"} for documents that number theorems within sections.
 */
public class SectionCounterResolver implements NumberResolver {

    @Override
    public Optional<String> resolve(ResolutionContext context) {
        if (!context.sectionScoped()) {
            return Optional.empty();
        }
        return context.enclosingSection()
                .map(section -> section.number() + "." + context.counter());
    }
}
