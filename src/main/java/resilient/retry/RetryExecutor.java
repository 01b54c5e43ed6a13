package resilient.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Runs an operation under a {@link RetryPolicy}: a plain bounded loop with an explicit
 * sleep between attempts.
 *
 * <p>Errors the policy classifies as fatal, and every {@link Error}, are rethrown
 * unchanged on the first occurrence. When all attempts fail,
 * {@link RetryExhaustedException} is thrown with the last failure as its cause.
 *
 * <pre>{@code
 * RetryResult<String> r = new RetryExecutor().execute("fetch title", driver::getTitle,
 *         RetryPolicy.builder().maxAttempts(3).initialDelay(Duration.ofMillis(200)).build());
 * }</pre>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;
    private final Random random;

    public RetryExecutor() {
        this(Sleeper.SYSTEM, new Random());
    }

    public RetryExecutor(Sleeper sleeper) {
        this(sleeper, new Random());
    }

    public RetryExecutor(Sleeper sleeper, Random random) {
        this.sleeper = sleeper;
        this.random  = random;
    }

    public <T> RetryResult<T> execute(Supplier<T> operation, RetryPolicy policy) {
        return execute("operation", operation, policy);
    }

    /**
     * @param name      label used in logs and in the exhaustion message
     * @param operation the fallible operation
     * @param policy    bounds and classification
     * @return the value with attempt count, delays and elapsed time
     * @throws RetryExhaustedException when every attempt failed with a retryable error
     */
    public <T> RetryResult<T> execute(String name, Supplier<T> operation, RetryPolicy policy) {
        long start = System.nanoTime();
        List<Duration> delays = new ArrayList<>();
        int max = policy.maxAttempts();
        RuntimeException last = null;

        for (int attempt = 1; attempt <= max; attempt++) {
            try {
                log.debug("Attempt {}/{}: {}", attempt, max, name);
                T value = operation.get();
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}/{}", name, attempt, max);
                }
                return new RetryResult<>(value, attempt, delays, elapsedSince(start));
            } catch (RuntimeException e) {
                if (!policy.isRetryable(e)) {
                    log.debug("Not retrying {}: {}", name, e.toString());
                    throw e;
                }
                last = e;
                if (attempt == max) {
                    break;
                }
                Duration delay = policy.delayFor(attempt - 1, random);
                log.warn("Attempt {}/{} of {} failed: {} - retrying in {} ms",
                        attempt, max, name, e.toString(), delay.toMillis());
                if (!delay.isZero()) {
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RetryExhaustedException(name, attempt, elapsedSince(start), e, true);
                    }
                }
                delays.add(delay);
            }
        }

        Duration elapsed = elapsedSince(start);
        log.error("All {} attempts failed for {} after {} ms: {}", max, name, elapsed.toMillis(), last.toString());
        throw new RetryExhaustedException(name, max, elapsed, last, false);
    }

    /** Convenience for operations without a result. */
    public RetryResult<Void> run(String name, Runnable operation, RetryPolicy policy) {
        return execute(name, () -> {
            operation.run();
            return null;
        }, policy);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
