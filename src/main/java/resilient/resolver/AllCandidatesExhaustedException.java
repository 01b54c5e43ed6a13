package resilient.resolver;

import resilient.model.DiagnosticBundle;
import resilient.model.HealingAttempt;
import resilient.model.ResolutionAttempt;

import java.util.List;

/**
 * Terminal failure: every candidate of a chain failed and self-healing (if any strategy
 * was registered) found no replacement. Carries the complete attempt trail.
 */
public class AllCandidatesExhaustedException extends LocatorException {

    private final transient DiagnosticBundle diagnostics;

    public AllCandidatesExhaustedException(DiagnosticBundle diagnostics) {
        super(diagnostics.describe());
        this.diagnostics = diagnostics;
    }

    public DiagnosticBundle diagnostics() {
        return diagnostics;
    }

    public String chainId() {
        return diagnostics.chainId();
    }

    /** Static candidate attempts in the order they were tried. */
    public List<ResolutionAttempt> attempts() {
        return diagnostics.attempts();
    }

    /** Healing strategy invocations appended after the static attempts. */
    public List<HealingAttempt> healingAttempts() {
        return diagnostics.healingAttempts();
    }
}
