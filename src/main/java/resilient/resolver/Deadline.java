package resilient.resolver;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Caller-imposed overall time limit for a resolve or interact call.
 * Measured on the monotonic clock; every blocking wait is clipped to it.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(System::nanoTime, Long.MAX_VALUE, false);

    private final LongSupplier ticker;
    private final long expiresAtNanos;
    private final boolean bounded;

    private Deadline(LongSupplier ticker, long expiresAtNanos, boolean bounded) {
        this.ticker         = ticker;
        this.expiresAtNanos = expiresAtNanos;
        this.bounded        = bounded;
    }

    /** A deadline that never expires. */
    public static Deadline none() {
        return NONE;
    }

    /** Expires {@code budget} from now. */
    public static Deadline after(Duration budget) {
        return after(budget, System::nanoTime);
    }

    static Deadline after(Duration budget, LongSupplier ticker) {
        if (budget.isNegative()) {
            budget = Duration.ZERO;
        }
        return new Deadline(ticker, ticker.getAsLong() + budget.toNanos(), true);
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean isExpired() {
        return bounded && expiresAtNanos - ticker.getAsLong() <= 0;
    }

    /** Time left, never negative; {@code null} for an unbounded deadline. */
    public Duration remaining() {
        if (!bounded) {
            return null;
        }
        return Duration.ofNanos(Math.max(0L, expiresAtNanos - ticker.getAsLong()));
    }

    /** The shorter of {@code timeout} and the time left. */
    public Duration clip(Duration timeout) {
        Duration left = remaining();
        return left == null || timeout.compareTo(left) <= 0 ? timeout : left;
    }

    @Override
    public String toString() {
        return bounded ? "Deadline{" + remaining().toMillis() + " ms left}" : "Deadline{none}";
    }
}
