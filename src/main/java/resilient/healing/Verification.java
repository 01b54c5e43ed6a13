package resilient.healing;

import resilient.driver.ElementHandle;
import resilient.model.AttemptOutcome;

import java.util.Objects;

/**
 * Result of checking one healing proposal against the live page.
 *
 * @param handle  live handle when the proposal resolved, otherwise {@code null}
 * @param outcome how the check ended
 * @param reason  failure detail, {@code null} when resolved
 */
public record Verification(ElementHandle handle, AttemptOutcome outcome, String reason) {

    public Verification {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static Verification resolved(ElementHandle handle) {
        return new Verification(Objects.requireNonNull(handle, "handle"), AttemptOutcome.SUCCESS, null);
    }

    public static Verification rejected(AttemptOutcome outcome, String reason) {
        if (outcome == AttemptOutcome.SUCCESS) {
            throw new IllegalArgumentException("A rejected proposal cannot have outcome SUCCESS");
        }
        return new Verification(null, outcome, reason);
    }

    public boolean isResolved() {
        return handle != null;
    }
}
