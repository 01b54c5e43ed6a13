package resilient.model;

import java.time.Instant;

/**
 * One try of one candidate during a resolve call.
 *
 * @param candidate    the candidate tried
 * @param attemptIndex zero-based position of this attempt within the call
 * @param startedAt    wall-clock start
 * @param endedAt      wall-clock end
 * @param outcome      final outcome after any in-place stale retry
 * @param latencyMs    time spent on this candidate, in milliseconds
 * @param tries        number of in-place tries (2 when a stale reference was retried)
 * @param reason       failure detail, {@code null} on success
 */
public record ResolutionAttempt(
        LocatorCandidate candidate,
        int attemptIndex,
        Instant startedAt,
        Instant endedAt,
        AttemptOutcome outcome,
        long latencyMs,
        int tries,
        String reason) {

    public boolean succeeded() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    /** One-line summary used in diagnostic reports. */
    public String summary() {
        String base = String.format("#%d %s %s='%s' (%d ms%s)",
                attemptIndex + 1, outcome, candidate.kind(), candidate.expression(), latencyMs,
                tries > 1 ? ", " + tries + " tries" : "");
        return reason == null ? base : base + " - " + reason;
    }
}
