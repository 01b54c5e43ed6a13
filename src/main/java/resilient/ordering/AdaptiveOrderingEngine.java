package resilient.ordering;

import resilient.metrics.ChainLedger;
import resilient.metrics.LedgerEntry;
import resilient.metrics.MetricsLedger;
import resilient.model.AttemptOutcome;
import resilient.model.LocatorCandidate;
import resilient.model.LocatorChain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns ledger history into a runtime try-order for a chain.
 *
 * <p>Score per observed candidate:
 * <pre>
 *   recencyWeightedSuccessRate − latencyWeight × (averageLatency / maxAverageLatencyInChain)
 * </pre>
 * Candidates with fewer than {@code minSamples} observations keep their declared slot;
 * observed candidates are stably sorted by descending score (ties by declared position)
 * into the remaining slots. With no data at all the effective order equals the declared
 * order. The order is recomputed on every call, so two calls may differ if metrics
 * changed in between.
 */
public class AdaptiveOrderingEngine {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveOrderingEngine.class);

    public static final double DEFAULT_LATENCY_WEIGHT = 0.2;
    public static final int    DEFAULT_MIN_SAMPLES    = 1;

    /** Below this success rate a candidate with enough samples is reported unhealthy. */
    static final double HEALTHY_SUCCESS_RATE = 0.8;
    static final int    HEALTH_MIN_SAMPLES   = 3;

    private final MetricsLedger ledger;
    private final double latencyWeight;
    private final int minSamples;
    private final Clock clock;

    public AdaptiveOrderingEngine() {
        this(new MetricsLedger(), DEFAULT_LATENCY_WEIGHT, DEFAULT_MIN_SAMPLES, Clock.systemUTC());
    }

    /**
     * @param ledger        statistics store owned by this engine
     * @param latencyWeight weight of the normalized latency penalty, {@code >= 0}
     * @param minSamples    observations needed before a candidate leaves its declared slot
     * @param clock         source of "last used" timestamps
     */
    public AdaptiveOrderingEngine(MetricsLedger ledger, double latencyWeight, int minSamples, Clock clock) {
        if (latencyWeight < 0.0) {
            throw new IllegalArgumentException("latencyWeight must be >= 0, got " + latencyWeight);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got " + minSamples);
        }
        this.ledger        = ledger;
        this.latencyWeight = latencyWeight;
        this.minSamples    = minSamples;
        this.clock         = clock;
    }

    public MetricsLedger ledger() {
        return ledger;
    }

    /**
     * Records one attempt outcome for a candidate of {@code chainId}.
     *
     * @return the updated ledger snapshot
     */
    public LedgerEntry record(String chainId, LocatorCandidate candidate, AttemptOutcome outcome, Duration latency) {
        boolean success = outcome == AttemptOutcome.SUCCESS;
        ChainLedger chainLedger = ledger.forChain(chainId);
        boolean wasHealthy = chainLedger.entry(candidate).map(AdaptiveOrderingEngine::isHealthy).orElse(true);

        LedgerEntry updated = chainLedger.record(candidate, success, latency.toMillis(), clock.instant());

        if (wasHealthy && !isHealthy(updated)) {
            log.warn("Locator {} of '{}' is unhealthy: success {}% over {} attempts - consider updating it",
                    candidate.key(), chainId, Math.round(updated.successRate() * 100.0), updated.samples());
        }
        return updated;
    }

    /**
     * Returns a permutation of the chain's declared candidates in the order they should
     * be tried now.
     */
    public List<LocatorCandidate> effectiveOrder(LocatorChain chain) {
        List<LocatorCandidate> declared = chain.candidates();
        Map<String, LedgerEntry> snapshot = ledger.forChain(chain.id()).snapshot();
        Map<String, Double> scores = scores(snapshot);

        LocatorCandidate[] slots = new LocatorCandidate[declared.size()];
        List<LocatorCandidate> observed = new ArrayList<>();
        for (LocatorCandidate c : declared) {
            if (scores.containsKey(c.key())) {
                observed.add(c);
            } else {
                slots[c.position()] = c;
            }
        }

        observed.sort(Comparator.<LocatorCandidate>comparingDouble(c -> scores.get(c.key()))
                .reversed()
                .thenComparingInt(LocatorCandidate::position));

        int next = 0;
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                slots[i] = observed.get(next++);
            }
        }

        List<LocatorCandidate> order = List.of(slots);
        if (log.isDebugEnabled() && !order.equals(declared)) {
            log.debug("Effective order for '{}' differs from declared: {}", chain.id(), order);
        }
        return order;
    }

    /**
     * Per-candidate statistics for a chain: declared candidates first, in declared order,
     * followed by any healed candidates recorded for the chain.
     */
    public List<CandidateMetrics> metricsReport(LocatorChain chain) {
        Map<String, LedgerEntry> snapshot = ledger.forChain(chain.id()).snapshot();
        Map<String, Double> scores = scores(snapshot);

        List<CandidateMetrics> report = new ArrayList<>();
        Set<String> declaredKeys = new HashSet<>();
        for (LocatorCandidate c : chain.candidates()) {
            declaredKeys.add(c.key());
            LedgerEntry e = snapshot.get(c.key());
            report.add(e == null ? empty(c) : toMetrics(e, scores));
        }
        for (LedgerEntry e : snapshot.values()) {
            if (!declaredKeys.contains(e.candidate().key())) {
                report.add(toMetrics(e, scores));
            }
        }
        return report;
    }

    /** Forgets everything learned about a chain; effective order returns to declared order. */
    public void reset(String chainId) {
        ledger.reset(chainId);
        log.info("Metrics reset for '{}'", chainId);
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    /** Scores of the candidates with enough samples, keyed by candidate key. */
    private Map<String, Double> scores(Map<String, LedgerEntry> snapshot) {
        double maxLatency = 0.0;
        for (LedgerEntry e : snapshot.values()) {
            if (e.samples() >= minSamples) {
                maxLatency = Math.max(maxLatency, e.averageLatencyMs());
            }
        }
        Map<String, Double> scores = new HashMap<>();
        for (Map.Entry<String, LedgerEntry> en : snapshot.entrySet()) {
            LedgerEntry e = en.getValue();
            if (e.samples() < minSamples) {
                continue;
            }
            double penalty = maxLatency > 0.0 ? latencyWeight * (e.averageLatencyMs() / maxLatency) : 0.0;
            scores.put(en.getKey(), e.recencyWeightedSuccessRate() - penalty);
        }
        return scores;
    }

    private static CandidateMetrics toMetrics(LedgerEntry e, Map<String, Double> scores) {
        return new CandidateMetrics(e.candidate(), e.samples(), e.successCount(), e.failureCount(),
                e.successRate(), e.averageLatencyMs(), e.recencyWeightedSuccessRate(),
                scores.getOrDefault(e.candidate().key(), Double.NaN), isHealthy(e), e.lastUsed());
    }

    private static CandidateMetrics empty(LocatorCandidate c) {
        return new CandidateMetrics(c, 0, 0, 0, 0.0, 0.0, 0.0, Double.NaN, true, null);
    }

    static boolean isHealthy(LedgerEntry e) {
        return e.samples() < HEALTH_MIN_SAMPLES || e.successRate() >= HEALTHY_SUCCESS_RATE;
    }
}
