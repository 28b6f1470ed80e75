package in.kirim.service.dispatch;

import java.time.Duration;

/**
 * Retry schedule for sending to one recipient.
 *
 * One initial attempt plus {@code maxRetries} retries. After failed attempt k
 * the worker waits {@code baseDelay × k}, capped at {@code maxDelay}.
 *
 * Usage:
 * <pre>
 * RetryBackoff backoff = RetryBackoff.builder()
 *     .baseDelay(Duration.ofSeconds(3))
 *     .maxRetries(3)
 *     .build();
 *
 * for (int attempt = 1; attempt &lt;= backoff.maxAttempts(); attempt++) {
 *     try {
 *         send();
 *         break;
 *     } catch (MessagingException e) {
 *         if (backoff.shouldRetry(attempt)) {
 *             sleeper.sleep(backoff.delayAfterFailure(attempt));
 *         }
 *     }
 * }
 * </pre>
 */
public final class RetryBackoff {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxRetries;

    private RetryBackoff(Duration baseDelay, Duration maxDelay, int maxRetries) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxRetries = maxRetries;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * True if a failed attempt with this number is followed by another one.
     */
    public boolean shouldRetry(int failedAttempt) {
        return failedAttempt < maxAttempts();
    }

    /**
     * Wait after failed attempt number {@code failedAttempt} (1-based).
     */
    public Duration delayAfterFailure(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1");
        }
        Duration delay = baseDelay.multipliedBy(failedAttempt);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Sum of all waits when every attempt fails.
     */
    public Duration totalBackoff() {
        Duration total = Duration.ZERO;
        for (int k = 1; k <= maxRetries; k++) {
            total = total.plus(delayAfterFailure(k));
        }
        return total;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 1 + 3 attempts, 3s × attempt.
     */
    public static RetryBackoff defaults() {
        return builder().build();
    }

    /**
     * Builder for RetryBackoff.
     */
    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(3);
        private Duration maxDelay = Duration.ofMinutes(1);
        private int maxRetries = 3;

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative()) {
                throw new IllegalArgumentException("Base delay must not be negative");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("Max delay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public RetryBackoff build() {
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("Max delay must be >= base delay");
            }
            return new RetryBackoff(baseDelay, maxDelay, maxRetries);
        }
    }
}
