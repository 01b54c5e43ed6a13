package resilient.model;

import resilient.driver.ElementHandle;

import java.time.Duration;
import java.util.List;

/**
 * Successful outcome of one resolve call.
 *
 * <p>{@link #attempts()} lists every candidate tried in order; the last entry is the
 * success unless the element was rescued by self-healing, in which case the winning
 * attempt is the last entry and {@link #healed()} is {@code true}.
 */
public final class ResolutionResult {

    private final String chainId;
    private final LocatorCandidate candidate;
    private final ElementHandle handle;
    private final List<ResolutionAttempt> attempts;
    private final List<HealingAttempt> healingAttempts;
    private final Duration elapsed;
    private final boolean healed;

    public ResolutionResult(String chainId, LocatorCandidate candidate, ElementHandle handle,
                            List<ResolutionAttempt> attempts, List<HealingAttempt> healingAttempts,
                            Duration elapsed, boolean healed) {
        this.chainId         = chainId;
        this.candidate       = candidate;
        this.handle          = handle;
        this.attempts        = List.copyOf(attempts);
        this.healingAttempts = List.copyOf(healingAttempts);
        this.elapsed         = elapsed;
        this.healed          = healed;
    }

    public String chainId()                        { return chainId; }
    public LocatorCandidate candidate()            { return candidate; }
    public ElementHandle handle()                  { return handle; }
    public List<ResolutionAttempt> attempts()      { return attempts; }
    public List<HealingAttempt> healingAttempts()  { return healingAttempts; }
    public Duration elapsed()                      { return elapsed; }
    public boolean healed()                        { return healed; }

    /** Diagnostic view of this result; never carries a capture reference. */
    public DiagnosticBundle diagnostics(String chainDescription, boolean degraded) {
        return new DiagnosticBundle(chainId, chainDescription, attempts.size(), attempts, healingAttempts,
                null, elapsed, degraded, false);
    }

    @Override
    public String toString() {
        return String.format("ResolutionResult{%s via %s after %d attempt(s), %d ms%s}",
                chainId, candidate, attempts.size(), elapsed.toMillis(), healed ? ", healed" : "");
    }
}
