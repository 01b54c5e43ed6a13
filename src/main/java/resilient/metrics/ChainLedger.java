package resilient.metrics;

import resilient.model.LocatorCandidate;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable statistics for every candidate of one chain, guarded by this object's monitor.
 * Several flows resolving the same chain concurrently may record into it safely.
 */
public final class ChainLedger {

    private final String chainId;
    private final double decayFactor;
    private final Map<String, Counters> entries = new LinkedHashMap<>();

    ChainLedger(String chainId, double decayFactor) {
        this.chainId     = chainId;
        this.decayFactor = decayFactor;
    }

    public String chainId() {
        return chainId;
    }

    /**
     * Folds one observation into the candidate's counters, creating the entry on first use.
     *
     * @return the updated snapshot
     */
    public synchronized LedgerEntry record(LocatorCandidate candidate, boolean success, long latencyMs, Instant at) {
        Counters c = entries.computeIfAbsent(candidate.key(), k -> new Counters(candidate));
        if (success) {
            c.successes++;
        } else {
            c.failures++;
        }
        c.totalLatencyMs  += Math.max(0L, latencyMs);
        c.lastUsed         = at;
        c.decayedSamples   = c.decayedSamples * decayFactor + 1.0;
        c.decayedSuccesses = c.decayedSuccesses * decayFactor + (success ? 1.0 : 0.0);
        return c.snapshot();
    }

    public synchronized Optional<LedgerEntry> entry(LocatorCandidate candidate) {
        Counters c = entries.get(candidate.key());
        return c == null ? Optional.empty() : Optional.of(c.snapshot());
    }

    /** Snapshot of all entries keyed by {@link LocatorCandidate#key()}, in first-recorded order. */
    public synchronized Map<String, LedgerEntry> snapshot() {
        Map<String, LedgerEntry> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> copy.put(k, v.snapshot()));
        return Collections.unmodifiableMap(copy);
    }

    /** Explicit reset; the only operation that lowers counts. */
    public synchronized void reset() {
        entries.clear();
    }

    private static final class Counters {
        private final LocatorCandidate candidate;
        private long successes;
        private long failures;
        private long totalLatencyMs;
        private Instant lastUsed;
        private double decayedSuccesses;
        private double decayedSamples;

        private Counters(LocatorCandidate candidate) {
            this.candidate = candidate;
        }

        private LedgerEntry snapshot() {
            return new LedgerEntry(candidate, successes, failures, totalLatencyMs, lastUsed,
                    decayedSuccesses, decayedSamples);
        }
    }
}
