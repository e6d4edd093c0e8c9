package in.nextopen.infrastructure.broker.common;

import in.nextopen.config.NextOpenConfig.GatewayConfig;

import java.time.Duration;

/**
 * Exponential backoff for transient brokerage failures.
 *
 * One instance covers one logical call. The delay returned by {@link #getNextDelay()}
 * is the pause after the current failure; {@link #recordFailure()} then grows it.
 *
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(2))
 *     .maxDelay(Duration.ofSeconds(60))
 *     .multiplier(2.0)
 *     .maxAttempts(8)
 *     .build();
 * </pre>
 */
public class BackoffPolicy {

    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;

    private BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while fewer than maxAttempts calls have failed
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    public synchronized void recordFailure() {
        attemptCount++;
        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BackoffPolicy fromConfig(GatewayConfig config) {
        return builder()
            .initialDelay(config.backoffBase())
            .maxDelay(config.backoffMax())
            .multiplier(config.backoffMultiplier())
            .maxAttempts(config.maxAttempts())
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = 8;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
                return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public BackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new BackoffPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
