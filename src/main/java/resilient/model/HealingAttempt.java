package resilient.model;

/**
 * Record of one healing strategy invocation.
 *
 * @param strategyName name the strategy was registered under
 * @param proposed     candidate the strategy proposed, or {@code null} if it found nothing
 * @param healed       whether the proposed candidate was verified on the live page
 * @param outcome      outcome of verifying the proposal, {@code null} when nothing was proposed
 * @param reason       failure detail when {@code healed} is {@code false}
 */
public record HealingAttempt(String strategyName, LocatorCandidate proposed, boolean healed,
                             AttemptOutcome outcome, String reason) {

    public static HealingAttempt success(String strategyName, LocatorCandidate proposed) {
        return new HealingAttempt(strategyName, proposed, true, AttemptOutcome.SUCCESS, null);
    }

    /** The strategy proposed nothing, or threw. */
    public static HealingAttempt failed(String strategyName, LocatorCandidate proposed, String reason) {
        return new HealingAttempt(strategyName, proposed, false, null, reason);
    }

    /** The strategy proposed a candidate that failed verification with {@code outcome}. */
    public static HealingAttempt rejected(String strategyName, LocatorCandidate proposed,
                                          AttemptOutcome outcome, String reason) {
        return new HealingAttempt(strategyName, proposed, false, outcome, reason);
    }

    public String summary() {
        String target = proposed == null ? "no candidate" : proposed.kind() + "='" + proposed.expression() + "'";
        if (healed) {
            return String.format("healing[%s] HEALED %s", strategyName, target);
        }
        return outcome == null
                ? String.format("healing[%s] FAILED %s - %s", strategyName, target, reason)
                : String.format("healing[%s] %s %s - %s", strategyName, outcome, target, reason);
    }
}
