package ai.theorem.extractor.extract.label;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a number such as {@code 4} or {@code 2.7} straight out of the theorem's own label key.
 */
public class LabelDigitsResolver implements NumberResolver {

    private static final Pattern NUMBER = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)");

    @Override
    public Optional<String> resolve(ResolutionContext context) {
        return context.label().flatMap(label -> {
            Matcher matcher = NUMBER.matcher(label);
            return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
        });
    }
}
