package resilient.metrics;

import resilient.model.LocatorCandidate;

import java.time.Instant;

/**
 * Immutable snapshot of the cumulative statistics for one (chain, candidate) pair.
 *
 * @param candidate        the candidate the statistics belong to
 * @param successCount     successful attempts
 * @param failureCount     failed attempts
 * @param totalLatencyMs   summed latency of all attempts
 * @param lastUsed         time of the most recent attempt
 * @param decayedSuccesses exponentially-decayed success weight
 * @param decayedSamples   exponentially-decayed sample weight
 */
public record LedgerEntry(
        LocatorCandidate candidate,
        long successCount,
        long failureCount,
        long totalLatencyMs,
        Instant lastUsed,
        double decayedSuccesses,
        double decayedSamples) {

    public long samples() {
        return successCount + failureCount;
    }

    /** Plain success rate in {@code [0, 1]}; 0 with no samples. */
    public double successRate() {
        long total = samples();
        return total == 0 ? 0.0 : (double) successCount / total;
    }

    /** Success rate where older observations count for less; 0 with no samples. */
    public double recencyWeightedSuccessRate() {
        return decayedSamples == 0.0 ? 0.0 : decayedSuccesses / decayedSamples;
    }

    public double averageLatencyMs() {
        long total = samples();
        return total == 0 ? 0.0 : (double) totalLatencyMs / total;
    }
}
