package resilient.retry;

import java.time.Duration;

/**
 * Thrown when every attempt of a retried operation failed. The last failure is the
 * {@linkplain #getCause() cause}.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attemptCount;
    private final Duration elapsed;
    private final boolean interrupted;

    public RetryExhaustedException(String operation, int attemptCount, Duration elapsed,
                                   Throwable lastError, boolean interrupted) {
        super(String.format("%s failed after %d attempt(s) in %d ms%s: %s",
                operation, attemptCount, elapsed.toMillis(), interrupted ? " (interrupted)" : "",
                lastError.getMessage()), lastError);
        this.attemptCount = attemptCount;
        this.elapsed      = elapsed;
        this.interrupted  = interrupted;
    }

    public int getAttemptCount() { return attemptCount; }
    public Duration getElapsed() { return elapsed; }

    /** Whether retrying stopped early because the thread was interrupted during backoff. */
    public boolean isInterrupted() { return interrupted; }
}
