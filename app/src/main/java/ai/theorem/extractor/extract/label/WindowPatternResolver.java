package ai.theorem.extractor.extract.label;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks at the first match of a pattern inside the context window and reads the number from one group.
 * Later matches are not consulted: if the first one carries no number, the resolver gives up.
 */
public class WindowPatternResolver implements NumberResolver {

    private final Pattern pattern;
    private final int group;

    public WindowPatternResolver(String regex) {
        this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), 1);
    }

    public WindowPatternResolver(Pattern pattern, int group) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        if (group < 1) {
            throw new IllegalArgumentException("group must be at least 1");
        }
        this.group = group;
    }

    @Override
    public Optional<String> resolve(ResolutionContext context) {
        Matcher matcher = pattern.matcher(context.window());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.ofNullable(matcher.group(group))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    @Override
    public String toString() {
        return "WindowPatternResolver[" + pattern.pattern() + "]";
    }
}
