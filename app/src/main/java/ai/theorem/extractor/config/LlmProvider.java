package ai.theorem.extractor.config;

import java.util.Locale;

/**
 * Supported large language model providers for the quality oracle.
 */
public enum LlmProvider {
    OPENAI,
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai", "" -> OPENAI;
            case "gemini" -> GEMINI;
            case "ollama" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }

    public String defaultModel() {
        return switch (this) {
            case OPENAI -> "o3-mini";
            case GEMINI -> "gemini-1.5-pro";
            case OLLAMA -> "qwen2.5:14b";
        };
    }
}
