package resilient.monitor;

import resilient.model.AttemptOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects sustained degradation of a chain, independently of any single call's outcome.
 *
 * <p>A chain is {@link HealthState#DEGRADED} while the number of failures inside the
 * trailing window is at least the threshold. It clears itself: once old failures age out
 * of the window the chain reads {@link HealthState#HEALTHY} again, no reset required.
 * Transitions are logged (WARN on degradation, INFO on recovery) when observed.
 */
public class FailureMonitor {

    private static final Logger log = LoggerFactory.getLogger(FailureMonitor.class);

    public static final Duration DEFAULT_WINDOW    = Duration.ofSeconds(60);
    public static final int      DEFAULT_THRESHOLD = 5;

    private static final int MIN_CAPACITY = 64;

    private final Duration window;
    private final int threshold;
    private final int capacity;
    private final Clock clock;
    private final Map<String, FailureWindow> windows = new ConcurrentHashMap<>();

    public FailureMonitor() {
        this(DEFAULT_WINDOW, DEFAULT_THRESHOLD, Clock.systemUTC());
    }

    /**
     * @param window    trailing window length
     * @param threshold failures inside the window that flip a chain to degraded
     * @param clock     time source for evaluating the window
     */
    public FailureMonitor(Duration window, int threshold, Clock clock) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Failure window must be positive");
        }
        if (threshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be >= 1, got " + threshold);
        }
        this.window    = window;
        this.threshold = threshold;
        this.capacity  = Math.max(MIN_CAPACITY, threshold * 4);
        this.clock     = clock;
    }

    public Duration window()  { return window; }
    public int threshold()    { return threshold; }
    public Clock clock()      { return clock; }

    public void recordFailure(String chainId, String message, Instant timestamp) {
        recordFailure(chainId, AttemptOutcome.TRANSIENT_ERROR, message, timestamp);
    }

    public void recordFailure(String chainId, AttemptOutcome kind, String message, Instant timestamp) {
        FailureWindow w = windows.computeIfAbsent(chainId, id -> new FailureWindow(window, capacity));
        w.add(new FailureRecord(timestamp, kind, message));
        evaluate(chainId, w);
    }

    public boolean isDegraded(String chainId) {
        return state(chainId) == HealthState.DEGRADED;
    }

    public HealthState state(String chainId) {
        FailureWindow w = windows.get(chainId);
        return w == null ? HealthState.HEALTHY : evaluate(chainId, w);
    }

    /** Failures of a chain currently inside the window, oldest first. */
    public List<FailureRecord> failures(String chainId) {
        FailureWindow w = windows.get(chainId);
        return w == null ? List.of() : w.snapshot(clock.instant());
    }

    /** Snapshot of every chain currently degraded, most failures first. */
    public List<DegradationReport> report() {
        Instant now = clock.instant();
        List<DegradationReport> degraded = new ArrayList<>();
        windows.forEach((chainId, w) -> {
            List<FailureRecord> records = w.snapshot(now);
            if (records.size() >= threshold) {
                FailureRecord first = records.get(0);
                FailureRecord last  = records.get(records.size() - 1);
                degraded.add(new DegradationReport(chainId, records.size(), first.timestamp(),
                        last.timestamp(), last.message()));
            }
        });
        degraded.sort(Comparator.comparingInt(DegradationReport::failureCount).reversed()
                .thenComparing(DegradationReport::chainId));
        return degraded;
    }

    public void reset(String chainId) {
        FailureWindow w = windows.remove(chainId);
        if (w != null) {
            log.info("Failure history reset for '{}'", chainId);
        }
    }

    public void reset() {
        windows.clear();
        log.info("Failure monitor reset");
    }

    private HealthState evaluate(String chainId, FailureWindow w) {
        int count = w.count(clock.instant());
        HealthState next = count >= threshold ? HealthState.DEGRADED : HealthState.HEALTHY;
        HealthState previous = w.transition(next);
        if (previous != next) {
            if (next == HealthState.DEGRADED) {
                log.warn("ALERT: '{}' failed {} times within {}s - the page may have changed; consider updating its locators",
                        chainId, count, window.toSeconds());
            } else {
                log.info("'{}' recovered: failures aged out of the {}s window", chainId, window.toSeconds());
            }
        }
        return next;
    }
}
