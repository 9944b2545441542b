package ai.theorem.extractor.extract;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A theorem-like environment together with the patterns that match its occurrences.
 */
public record EnvironmentDescriptor(String environmentName,
                                    String displayName,
                                    Pattern unnumberedPattern,
                                    Pattern numberedPattern) {

    public static final String BUILT_IN_NAME = "theorem";
    public static final String BUILT_IN_DISPLAY_NAME = "Theorem";

    public EnvironmentDescriptor {
        environmentName = requireNonBlank(environmentName, "environmentName");
        displayName = requireNonBlank(displayName, "displayName");
        Objects.requireNonNull(unnumberedPattern, "unnumberedPattern");
        Objects.requireNonNull(numberedPattern, "numberedPattern");
    }

    /**
     * Compiles {@code \begin{name}...\end{name}} and {@code \begin{name}[number]...\end{name}},
     * both non-greedy and spanning line breaks.
     */
    public static EnvironmentDescriptor of(String environmentName, String displayName) {
        String begin = Pattern.quote("\\begin{" + environmentName + "}");
        String end = Pattern.quote("\\end{" + environmentName + "}");
        Pattern unnumbered = Pattern.compile(begin + "(.*?)" + end, Pattern.DOTALL);
        Pattern numbered = Pattern.compile(begin + "\\[([^\\]]+)\\](.*?)" + end, Pattern.DOTALL);
        return new EnvironmentDescriptor(environmentName, displayName, unnumbered, numbered);
    }

    public static EnvironmentDescriptor builtIn() {
        return of(BUILT_IN_NAME, BUILT_IN_DISPLAY_NAME);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
