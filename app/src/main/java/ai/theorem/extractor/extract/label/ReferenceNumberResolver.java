package ai.theorem.extractor.extract.label;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds {@code \ref{label}} followed by a literal number, e.g. {@code \ref{thm:main} 3.2}.
 */
public class ReferenceNumberResolver implements NumberResolver {

    @Override
    public Optional<String> resolve(ResolutionContext context) {
        return context.label().flatMap(label -> {
            Pattern pattern = Pattern.compile("\\\\ref\\{" + Pattern.quote(label) + "\\}\\s*" + LabelResolver.NUMBER,
                    Pattern.CASE_INSENSITIVE);
            return new WindowPatternResolver(pattern, 1).resolve(context);
        });
    }
}
