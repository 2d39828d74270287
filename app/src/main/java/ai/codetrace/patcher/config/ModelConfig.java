package ai.codetrace.patcher.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Model provider settings and the retry budget for rate-limited calls.
 */
public record ModelConfig(
        LlmProvider provider,
        String modelName,
        Optional<String> baseUrl,
        int maxRetryAttempts,
        int initialBackoffSeconds,
        int maxBackoffSeconds,
        double retryJitterFactor
) {

    public ModelConfig {
        provider = Objects.requireNonNull(provider, "provider");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (retryJitterFactor < 0.0 || retryJitterFactor > 1.0) {
            throw new IllegalArgumentException("retryJitterFactor must be between 0.0 and 1.0");
        }
    }
}
