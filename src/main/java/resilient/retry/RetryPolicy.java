package resilient.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Immutable bounded-retry configuration.
 *
 * <p>The delay after failure {@code n} (zero-based) is
 * {@code min(initialDelay × multiplier^n, maxDelay)}, optionally spread by a symmetric
 * jitter of {@code ±jitter × delay} and never above {@code maxDelay}.
 */
public final class RetryPolicy {

    /** 3 attempts, 500 ms initial delay doubling up to 5 s, no jitter, default classifier. */
    public static final RetryPolicy DEFAULT = builder().build();

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitter;
    private final Predicate<Throwable> retryOn;

    private RetryPolicy(Builder b) {
        this.maxAttempts  = b.maxAttempts;
        this.initialDelay = b.initialDelay;
        this.multiplier   = b.multiplier;
        this.maxDelay     = b.maxDelay;
        this.jitter       = b.jitter;
        this.retryOn      = b.retryOn;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-populated with this policy's values. */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .multiplier(multiplier)
                .maxDelay(maxDelay)
                .jitter(jitter)
                .retryOn(retryOn);
    }

    public int maxAttempts()        { return maxAttempts; }
    public Duration initialDelay()  { return initialDelay; }
    public double multiplier()      { return multiplier; }
    public Duration maxDelay()      { return maxDelay; }
    public double jitter()          { return jitter; }

    public boolean isRetryable(Throwable error) {
        return retryOn.test(error);
    }

    /** Delay after failure {@code n} (zero-based), before jitter. */
    public Duration baseDelay(int n) {
        double ms = initialDelay.toMillis() * Math.pow(multiplier, n);
        return Duration.ofMillis((long) Math.min(ms, maxDelay.toMillis()));
    }

    /** Delay after failure {@code n} (zero-based) with jitter applied. */
    public Duration delayFor(int n, Random random) {
        Duration base = baseDelay(n);
        if (jitter <= 0.0 || base.isZero()) {
            return base;
        }
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * jitter;
        long ms = Math.round(base.toMillis() * factor);
        return Duration.ofMillis(Math.max(0L, Math.min(ms, maxDelay.toMillis())));
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{maxAttempts=%d, initialDelay=%dms, multiplier=%.2f, maxDelay=%dms, jitter=%.2f}",
                maxAttempts, initialDelay.toMillis(), multiplier, maxDelay.toMillis(), jitter);
    }

    public static final class Builder {

        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofMillis(5000);
        private double jitter = 0.0;
        private Predicate<Throwable> retryOn = RetryClassifier::isRetryable;

        private Builder() { }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = requireNonNegative(initialDelay, "initialDelay");
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = requireNonNegative(maxDelay, "maxDelay");
            return this;
        }

        public Builder jitter(double jitter) {
            if (jitter < 0.0 || jitter > 1.0) {
                throw new IllegalArgumentException("jitter must be within [0, 1], got " + jitter);
            }
            this.jitter = jitter;
            return this;
        }

        /** Replaces the error classifier; errors it rejects are rethrown immediately. */
        public Builder retryOn(Predicate<Throwable> retryOn) {
            this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
            return this;
        }

        public RetryPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay (" + maxDelay.toMillis()
                        + "ms) must not be below initialDelay (" + initialDelay.toMillis() + "ms)");
            }
            return new RetryPolicy(this);
        }

        private static Duration requireNonNegative(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return d;
        }
    }
}
