package resilient.metrics;

import resilient.model.LocatorCandidate;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link ChainLedger} per chain identity. Instances are explicitly owned by the
 * resolver/ordering engine that created them; there is no global ledger.
 */
public class MetricsLedger {

    /** Default weight kept by older observations on each new one. */
    public static final double DEFAULT_DECAY_FACTOR = 0.8;

    private final double decayFactor;
    private final Map<String, ChainLedger> chains = new ConcurrentHashMap<>();

    public MetricsLedger() {
        this(DEFAULT_DECAY_FACTOR);
    }

    /**
     * @param decayFactor weight in {@code (0, 1]} kept by older observations each time a new
     *                    one is recorded; 1 disables decay
     */
    public MetricsLedger(double decayFactor) {
        if (decayFactor <= 0.0 || decayFactor > 1.0) {
            throw new IllegalArgumentException("decayFactor must be within (0, 1], got " + decayFactor);
        }
        this.decayFactor = decayFactor;
    }

    public double decayFactor() {
        return decayFactor;
    }

    public ChainLedger forChain(String chainId) {
        return chains.computeIfAbsent(chainId, id -> new ChainLedger(id, decayFactor));
    }

    public LedgerEntry record(String chainId, LocatorCandidate candidate, boolean success, long latencyMs, Instant at) {
        return forChain(chainId).record(candidate, success, latencyMs, at);
    }

    public Optional<LedgerEntry> entry(String chainId, LocatorCandidate candidate) {
        ChainLedger ledger = chains.get(chainId);
        return ledger == null ? Optional.empty() : ledger.entry(candidate);
    }

    public void reset(String chainId) {
        ChainLedger ledger = chains.get(chainId);
        if (ledger != null) {
            ledger.reset();
        }
    }

    public Set<String> chainIds() {
        return Set.copyOf(chains.keySet());
    }
}
