package resilient.healing;

import resilient.driver.BrowserDriver;
import resilient.model.LocatorCandidate;

import java.util.Optional;

/**
 * Proposes a brand-new candidate for an element whose declared candidates all failed.
 * Strategies may probe the live page; the registry verifies whatever they return.
 */
@FunctionalInterface
public interface HealingStrategy {

    /**
     * @param page live page
     * @param hint semantic description of the element (e.g. "Search submit button")
     * @return a candidate to try, or empty for "no match"
     */
    Optional<LocatorCandidate> discover(BrowserDriver page, String hint);
}
