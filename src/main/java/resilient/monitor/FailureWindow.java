package resilient.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Time-ordered failures of one chain inside a trailing window. Entries older than the
 * window are evicted lazily, whenever the window is written or read; a hard capacity
 * keeps memory bounded under failure storms. All methods synchronize on this window.
 */
final class FailureWindow {

    private final Duration duration;
    private final int capacity;
    private final Deque<FailureRecord> records = new ArrayDeque<>();
    private HealthState state = HealthState.HEALTHY;

    FailureWindow(Duration duration, int capacity) {
        this.duration = duration;
        this.capacity = capacity;
    }

    synchronized void add(FailureRecord record) {
        // records arrive roughly in order; keep the deque sorted so eviction stays at the head
        if (records.isEmpty() || !record.timestamp().isBefore(records.peekLast().timestamp())) {
            records.addLast(record);
        } else {
            insertSorted(record);
        }
        while (records.size() > capacity) {
            records.pollFirst();
        }
    }

    /** Evicts expired entries relative to {@code now} and returns the remaining count. */
    synchronized int count(Instant now) {
        evict(now);
        return records.size();
    }

    synchronized List<FailureRecord> snapshot(Instant now) {
        evict(now);
        return List.copyOf(records);
    }

    /** Stores {@code next} and returns the previous state. */
    synchronized HealthState transition(HealthState next) {
        HealthState previous = state;
        state = next;
        return previous;
    }

    private void evict(Instant now) {
        Instant cutoff = now.minus(duration);
        while (!records.isEmpty() && !records.peekFirst().timestamp().isAfter(cutoff)) {
            records.pollFirst();
        }
    }

    private void insertSorted(FailureRecord record) {
        Deque<FailureRecord> tail = new ArrayDeque<>();
        while (!records.isEmpty() && records.peekLast().timestamp().isAfter(record.timestamp())) {
            tail.addFirst(records.pollLast());
        }
        records.addLast(record);
        records.addAll(tail);
    }
}
