package ai.theorem.extractor.config;

import java.util.Optional;

/**
 * Holds the API keys of the hosted model providers.
 */
public record Secrets(Optional<String> openAiApiKey, Optional<String> geminiApiKey) {

    public Secrets {
        openAiApiKey = openAiApiKey == null ? Optional.empty() : openAiApiKey.filter(s -> !s.isBlank());
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey.filter(s -> !s.isBlank());
    }

    public static Secrets none() {
        return new Secrets(Optional.empty(), Optional.empty());
    }

    /**
     * Returns the key the given provider authenticates with; Ollama needs none.
     */
    public Optional<String> apiKeyFor(LlmProvider provider) {
        return switch (provider) {
            case OPENAI -> openAiApiKey;
            case GEMINI -> geminiApiKey;
            case OLLAMA -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return "Secrets[openAiApiKey=" + mask(openAiApiKey) + ", geminiApiKey=" + mask(geminiApiKey) + "]";
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "***" : "<unset>";
    }
}
