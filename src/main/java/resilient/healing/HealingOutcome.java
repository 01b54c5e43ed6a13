package resilient.healing;

import resilient.driver.ElementHandle;
import resilient.model.HealingAttempt;
import resilient.model.LocatorCandidate;

import java.util.List;

/**
 * Result of {@link SelfHealingRegistry#heal}.
 *
 * @param candidate the verified rescue candidate, or {@code null}
 * @param handle    live handle for {@code candidate}, or {@code null}
 * @param attempts  every strategy invocation, in order
 */
public record HealingOutcome(LocatorCandidate candidate, ElementHandle handle, List<HealingAttempt> attempts) {

    public HealingOutcome {
        attempts = List.copyOf(attempts);
    }

    public static HealingOutcome failed(List<HealingAttempt> attempts) {
        return new HealingOutcome(null, null, attempts);
    }

    public boolean healed() {
        return candidate != null;
    }
}
