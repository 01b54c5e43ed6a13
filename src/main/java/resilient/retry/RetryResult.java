package resilient.retry;

import java.time.Duration;
import java.util.List;

/**
 * Successful outcome of {@link RetryExecutor#execute}.
 *
 * @param value        the operation's return value
 * @param attemptCount attempts made, including the successful one
 * @param delays       backoff delays slept between attempts, in order
 * @param elapsed      total wall time including delays
 */
public record RetryResult<T>(T value, int attemptCount, List<Duration> delays, Duration elapsed) {

    public RetryResult {
        delays = List.copyOf(delays);
    }
}
