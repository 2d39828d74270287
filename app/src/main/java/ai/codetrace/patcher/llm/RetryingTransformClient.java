package ai.codetrace.patcher.llm;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries rate-limited transformation requests with exponential backoff, jitter and provider retry-after hints.
 */
public class RetryingTransformClient implements TransformClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingTransformClient.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final TransformClient delegate;
    private final int maxRetryAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;

    public RetryingTransformClient(TransformClient delegate) {
        this(delegate, 6, 2, 60, 0.3);
    }

    public RetryingTransformClient(TransformClient delegate, int maxRetryAttempts, int initialBackoffSeconds,
                                   int maxBackoffSeconds, double jitterFactor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
    }

    @Override
    public TransformResponse transform(String originalText, String instruction) {
        TransformException lastFailure = null;
        for (int attempt = 0; attempt < maxRetryAttempts; attempt++) {
            try {
                return delegate.transform(originalText, instruction);
            } catch (TransformException ex) {
                lastFailure = ex;
                Optional<Duration> maybeDelay = calculateRetryDelay(ex, attempt);
                if (maybeDelay.isEmpty() || attempt == maxRetryAttempts - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Transformation rate limited; max retries ({}) exceeded", maxRetryAttempts);
                    }
                    throw ex;
                }
                Duration delay = maybeDelay.get();
                LOGGER.warn("Transformation rate limited; retrying in {} ms (attempt {}/{})",
                        delay.toMillis(), attempt + 1, maxRetryAttempts);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Transformation retry interrupted");
                    throw ex;
                }
            }
        }
        throw lastFailure == null ? new TransformException("Unknown transformation failure", null) : lastFailure;
    }

    private Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        long baseDelaySeconds = initialBackoffSeconds * (1L << attemptNumber);
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));
        return Optional.of(Duration.ofSeconds(finalDelaySeconds));
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
        if (matcher.find()) {
            try {
                double seconds = Double.parseDouble(matcher.group(1));
                return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
            } catch (NumberFormatException ex) {
                LOGGER.debug("Ignoring malformed retry-after hint in '{}'", message);
            }
        }
        return Optional.empty();
    }
}
