package in.mesbridge.infrastructure.broker.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Reconnection policy with linear backoff for the broker session.
 *
 * Features:
 * - First attempt after a connection loss is immediate
 * - Delay grows by a fixed increment after every failed attempt
 * - Maximum backoff duration (cap)
 * - Exhaustion after the maximum number of failed attempts
 * - Reset after a successful connection
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(5))
 *     .increment(Duration.ofSeconds(5))
 *     .maxDelay(Duration.ofMinutes(1))
 *     .maxAttempts(10)
 *     .build();
 *
 * while (policy.shouldRetry()) {
 *     Thread.sleep(policy.getNextDelay().toMillis());
 *     try {
 *         connect();
 *         policy.recordSuccess();
 *         break;
 *     } catch (Exception e) {
 *         policy.recordFailure();
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration increment;
    private final Duration maxDelay;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Instant lastAttemptTime;

    private ReconnectionPolicy(Duration initialDelay, Duration increment,
                               Duration maxDelay, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.increment = increment;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @return true while fewer than {@code maxAttempts} consecutive attempts have failed
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Delay before the next attempt: zero before the first failure, then
     * {@code initialDelay + increment * (failures - 1)}, capped at {@code maxDelay}.
     */
    public synchronized Duration getNextDelay() {
        if (attemptCount == 0) {
            return Duration.ZERO;
        }
        Duration delay = initialDelay.plus(increment.multipliedBy(attemptCount - 1L));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Record a failed connection attempt.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();
    }

    /**
     * Record a successful connection. Resets the attempt counter.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        lastAttemptTime = null;
    }

    /**
     * @return true once {@code maxAttempts} consecutive attempts have failed
     */
    public synchronized boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }

    /**
     * @return number of failed attempts since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @return time of the last failed attempt, or null if none since the last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for the Ironbeam session: 5s, 10s, 15s ... capped at 60s, 10 attempts.
     */
    public static ReconnectionPolicy forIronbeam() {
        return builder().build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration increment = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofSeconds(60);
        private int maxAttempts = 10;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder increment(Duration increment) {
            if (increment.isNegative()) {
                throw new IllegalArgumentException("Increment cannot be negative");
            }
            this.increment = increment;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, increment, maxDelay, maxAttempts);
        }
    }
}
