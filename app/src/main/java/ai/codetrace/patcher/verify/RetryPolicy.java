package ai.codetrace.patcher.verify;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry of the initial verification: {@code maxAttempts} runs in total, {@code delay} apart.
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(2, Duration.ofSeconds(2));
    }
}
