package resilient.model;

import java.time.Duration;
import java.util.List;

/**
 * Everything needed to debug a resolve call without re-running it.
 *
 * @param chainId          chain identity
 * @param chainDescription chain description (may be {@code null})
 * @param totalCandidates  number of candidates in the effective order
 * @param attempts         static-candidate attempts in try order
 * @param healingAttempts  healing strategy invocations, empty if healing did not run
 * @param captureReference reference returned by the diagnostic capture hook, or {@code null}
 * @param elapsed          wall time of the whole call
 * @param degraded         whether the chain was degraded when the call finished
 * @param deadlineExceeded whether the caller's deadline cut the call short
 */
public record DiagnosticBundle(
        String chainId,
        String chainDescription,
        int totalCandidates,
        List<ResolutionAttempt> attempts,
        List<HealingAttempt> healingAttempts,
        String captureReference,
        Duration elapsed,
        boolean degraded,
        boolean deadlineExceeded) {

    public DiagnosticBundle {
        attempts        = List.copyOf(attempts);
        healingAttempts = List.copyOf(healingAttempts);
    }

    /** Returns a copy carrying the given capture reference. */
    public DiagnosticBundle withCaptureReference(String reference) {
        return new DiagnosticBundle(chainId, chainDescription, totalCandidates, attempts, healingAttempts,
                reference, elapsed, degraded, deadlineExceeded);
    }

    /** Multi-line report listing every attempt, suitable for logs and attachments. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Element not found: ").append(chainId);
        if (chainDescription != null) {
            sb.append(" (").append(chainDescription).append(')');
        }
        sb.append('\n')
          .append("Tried ").append(attempts.size()).append('/').append(totalCandidates)
          .append(" candidate(s) in ").append(elapsed.toMillis()).append(" ms");
        if (deadlineExceeded) {
            sb.append(" - caller deadline exceeded");
        }
        if (degraded) {
            sb.append(" - chain is DEGRADED");
        }
        sb.append("\nAttempts:");
        for (ResolutionAttempt a : attempts) {
            sb.append("\n  ").append(a.summary());
        }
        if (!healingAttempts.isEmpty()) {
            sb.append("\nHealing:");
            for (HealingAttempt h : healingAttempts) {
                sb.append("\n  ").append(h.summary());
            }
        }
        if (captureReference != null) {
            sb.append("\nCapture: ").append(captureReference);
        }
        return sb.toString();
    }
}
