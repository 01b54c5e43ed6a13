package resilient.model;

/** Outcome of a single {@link ResolutionAttempt}. */
public enum AttemptOutcome {
    SUCCESS,
    /** The expression matched nothing within the timeout. */
    NOT_FOUND,
    /** A match appeared but never became visible (or the caller's deadline ran out). */
    TIMEOUT,
    /** The element reference was invalidated by a DOM mutation. */
    STALE,
    /** Any other driver-side failure that may not recur. */
    TRANSIENT_ERROR;

    public boolean isFailure() {
        return this != SUCCESS;
    }
}
