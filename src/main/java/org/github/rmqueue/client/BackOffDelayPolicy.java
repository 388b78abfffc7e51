package org.github.rmqueue.client;

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * Contract to determine a delay between connection attempts.
 */
@FunctionalInterface
public interface BackOffDelayPolicy {

    Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

    /**
     * Returns the delay to wait after a failed attempt.
     *
     * <p>The policy can return the {@link #TIMEOUT} constant to stop retrying.
     *
     * @param attempt number of the failed attempt, starting at 1
     * @return the delay, {@link #TIMEOUT} if the task should stop being retried
     */
    Duration delay(int attempt);

    /**
     * Policy with a fixed delay and no limit on attempts.
     *
     * @param delay the fixed delay
     * @return fixed-delay policy
     */
    static BackOffDelayPolicy fixed(Duration delay) {
        return new FixedBackOffPolicy(delay, 0);
    }

    /**
     * Policy with a fixed delay, giving up after {@code maxAttempts} attempts.
     *
     * @param delay the fixed delay
     * @param maxAttempts number of attempts before timing out, 0 for no limit
     * @return fixed-delay policy with an attempt limit
     */
    static BackOffDelayPolicy fixed(Duration delay, int maxAttempts) {
        return new FixedBackOffPolicy(delay, maxAttempts);
    }

    final class FixedBackOffPolicy implements BackOffDelayPolicy {

        private final Duration delay;
        private final int maxAttempts;

        private FixedBackOffPolicy(Duration delay, int maxAttempts) {
            Preconditions.checkNotNull(delay, "delay");
            Preconditions.checkArgument(!delay.isNegative(), "Delay should not be negative: %s", delay);
            Preconditions.checkArgument(maxAttempts >= 0,
                    "Max attempts should be greater or equal to 0: %s", maxAttempts);
            this.delay = delay;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Duration delay(int attempt) {
            if (maxAttempts > 0 && attempt >= maxAttempts) {
                return TIMEOUT;
            }
            return delay;
        }

        @Override
        public String toString() {
            return "FixedBackOffPolicy{" +
                    "delay=" + delay +
                    ", maxAttempts=" + maxAttempts +
                    '}';
        }
    }
}
