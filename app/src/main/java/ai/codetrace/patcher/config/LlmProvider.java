package ai.codetrace.patcher.config;

import java.util.Locale;

/**
 * Chat model backends the production client can talk to.
 */
public enum LlmProvider {
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini" -> GEMINI;
            case "ollama", "" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }

    public String defaultModel() {
        return switch (this) {
            case GEMINI -> "models/gemini-1.5-pro-latest";
            case OLLAMA -> "qwen2.5-coder:7b";
        };
    }
}
