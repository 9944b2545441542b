package ai.theorem.extractor.extract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-document table of theorem-like environments, built-in first, then declared ones in document order.
 */
public final class EnvironmentCatalog {

    private static final Pattern NEW_THEOREM = Pattern.compile("\\\\newtheorem\\{([^}]+)\\}\\{([^}]+)\\}");
    private static final String THEOREM_MARKER = "theorem";

    private final Map<String, EnvironmentDescriptor> environments;

    private EnvironmentCatalog(Map<String, EnvironmentDescriptor> environments) {
        this.environments = environments;
    }

    /**
     * Builds the catalog from {@code \newtheorem{name}{Display}} declarations whose name or display
     * string contains "theorem" (any case). A name is registered once; later declarations are ignored.
     */
    public static EnvironmentCatalog discover(String latexText) {
        Map<String, EnvironmentDescriptor> environments = new LinkedHashMap<>();
        EnvironmentDescriptor builtIn = EnvironmentDescriptor.builtIn();
        environments.put(builtIn.environmentName(), builtIn);
        if (latexText != null) {
            Matcher matcher = NEW_THEOREM.matcher(latexText);
            while (matcher.find()) {
                String name = matcher.group(1).trim();
                String displayName = matcher.group(2).trim();
                if (name.isEmpty() || displayName.isEmpty() || !isTheoremLike(name, displayName)) {
                    continue;
                }
                environments.putIfAbsent(name, EnvironmentDescriptor.of(name, displayName));
            }
        }
        return new EnvironmentCatalog(environments);
    }

    public List<EnvironmentDescriptor> environments() {
        return List.copyOf(environments.values());
    }

    public Optional<EnvironmentDescriptor> find(String environmentName) {
        return Optional.ofNullable(environments.get(environmentName));
    }

    public int size() {
        return environments.size();
    }

    private static boolean isTheoremLike(String name, String displayName) {
        return name.toLowerCase(Locale.ROOT).contains(THEOREM_MARKER)
                || displayName.toLowerCase(Locale.ROOT).contains(THEOREM_MARKER);
    }
}
