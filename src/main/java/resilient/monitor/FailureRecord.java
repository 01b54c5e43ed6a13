package resilient.monitor;

import resilient.model.AttemptOutcome;

import java.time.Instant;

/**
 * One failure inside a {@link FailureWindow}.
 *
 * @param timestamp when the failure happened
 * @param kind      failure kind
 * @param message   failure detail
 */
public record FailureRecord(Instant timestamp, AttemptOutcome kind, String message) { }
