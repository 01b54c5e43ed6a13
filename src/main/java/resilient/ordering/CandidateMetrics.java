package resilient.ordering;

import resilient.model.LocatorCandidate;

import java.time.Instant;

/**
 * Per-candidate line of {@link AdaptiveOrderingEngine#metricsReport}.
 *
 * @param candidate                  the candidate
 * @param samples                    attempts recorded
 * @param successCount               successful attempts
 * @param failureCount               failed attempts
 * @param successRate                plain success rate in {@code [0, 1]}
 * @param averageLatencyMs           mean latency over all attempts
 * @param recencyWeightedSuccessRate decayed success rate used for ranking
 * @param score                      ranking score, {@code NaN} while below the sample threshold
 * @param healthy                    {@code false} once enough samples show a success rate under 80 %
 * @param lastUsed                   most recent attempt, {@code null} if never tried
 */
public record CandidateMetrics(
        LocatorCandidate candidate,
        long samples,
        long successCount,
        long failureCount,
        double successRate,
        double averageLatencyMs,
        double recencyWeightedSuccessRate,
        double score,
        boolean healthy,
        Instant lastUsed) {

    @Override
    public String toString() {
        return String.format("%s='%s' success %.1f%% (%d/%d), avg %.0f ms%s",
                candidate.kind(), candidate.expression(), successRate * 100.0, successCount, samples,
                averageLatencyMs, healthy ? "" : " [UNHEALTHY]");
    }
}
