package com.amqpclient.reconnect;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconnect policy for a connection: how long to wait before each reconnect
 * attempt and when to give up.
 *
 * The delay before attempt n (1-based, counted since the connection was last
 * open) is {@code min(delay * delayMultiplier^(n-1), maxDelay)}. A
 * {@code maxAttempts} of 0 means reconnect forever.
 *
 * <pre>{@code
 * ReconnectOptions policy = ReconnectOptions.builder()
 *     .delay(Duration.ofMillis(100))
 *     .delayMultiplier(2.0)
 *     .maxDelay(Duration.ofSeconds(30))
 *     .maxAttempts(10)
 *     .build();
 * }</pre>
 */
public final class ReconnectOptions {

    public static final Duration DEFAULT_DELAY = Duration.ofMillis(10);
    public static final double DEFAULT_DELAY_MULTIPLIER = 2.0;
    public static final Duration FOREVER = Duration.ofMillis(Long.MAX_VALUE);
    public static final int UNLIMITED_ATTEMPTS = 0;

    private static final ReconnectOptions DEFAULTS = builder().build();

    private final Duration delay;
    private final double delayMultiplier;
    private final Duration maxDelay;
    private final int maxAttempts;

    private ReconnectOptions(Builder builder) {
        this.delay = builder.delay;
        this.delayMultiplier = builder.delayMultiplier;
        this.maxDelay = builder.maxDelay;
        this.maxAttempts = builder.maxAttempts;
    }

    /**
     * Policy with the default delays and no attempt limit.
     */
    public static ReconnectOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .delay(delay)
            .delayMultiplier(delayMultiplier)
            .maxDelay(maxDelay)
            .maxAttempts(maxAttempts);
    }

    /**
     * Delay before the given reconnect attempt.
     *
     * @param attempt reconnect attempt number, starting at 1
     * @return the delay, or empty if no further attempt should be made
     */
    public Optional<Duration> nextDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1: " + attempt);
        }
        if (maxAttempts != UNLIMITED_ATTEMPTS && attempt > maxAttempts) {
            return Optional.empty();
        }

        long maxMillis = maxDelay.toMillis();
        double millis = delay.toMillis() * Math.pow(delayMultiplier, attempt - 1);
        if (Double.isInfinite(millis) || Double.isNaN(millis) || millis >= maxMillis) {
            return Optional.of(Duration.ofMillis(maxMillis));
        }
        return Optional.of(Duration.ofMillis((long) millis));
    }

    public Duration getDelay() {
        return delay;
    }

    public double getDelayMultiplier() {
        return delayMultiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isUnlimited() {
        return maxAttempts == UNLIMITED_ATTEMPTS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReconnectOptions)) return false;
        ReconnectOptions that = (ReconnectOptions) o;
        return Double.compare(that.delayMultiplier, delayMultiplier) == 0
            && maxAttempts == that.maxAttempts
            && delay.equals(that.delay)
            && maxDelay.equals(that.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(delay, delayMultiplier, maxDelay, maxAttempts);
    }

    @Override
    public String toString() {
        return String.format("ReconnectOptions{delay=%dms, multiplier=%.2f, maxDelay=%s, maxAttempts=%s}",
                           delay.toMillis(), delayMultiplier,
                           maxDelay.equals(FOREVER) ? "forever" : maxDelay.toMillis() + "ms",
                           maxAttempts == UNLIMITED_ATTEMPTS ? "unlimited" : String.valueOf(maxAttempts));
    }

    /**
     * Builder for {@link ReconnectOptions}.
     */
    public static final class Builder {
        private Duration delay = DEFAULT_DELAY;
        private double delayMultiplier = DEFAULT_DELAY_MULTIPLIER;
        private Duration maxDelay = FOREVER;
        private int maxAttempts = UNLIMITED_ATTEMPTS;

        private Builder() {
        }

        /**
         * Delay before the first reconnect attempt.
         */
        public Builder delay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Reconnect delay must not be negative: " + delay);
            }
            this.delay = delay;
            return this;
        }

        /**
         * Factor applied to the delay after each failed attempt. Must be at least 1.
         */
        public Builder delayMultiplier(double delayMultiplier) {
            if (Double.isNaN(delayMultiplier) || delayMultiplier < 1.0) {
                throw new IllegalArgumentException("Delay multiplier must be >= 1: " + delayMultiplier);
            }
            this.delayMultiplier = delayMultiplier;
            return this;
        }

        /**
         * Upper bound for the delay between attempts.
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("Maximum delay must not be negative: " + maxDelay);
            }
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Maximum number of reconnect attempts, 0 for no limit.
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("Maximum attempts must not be negative: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectOptions build() {
            if (maxDelay.compareTo(delay) < 0) {
                throw new IllegalArgumentException(
                    "Maximum delay " + maxDelay + " is shorter than the initial delay " + delay);
            }
            return new ReconnectOptions(this);
        }
    }
}
