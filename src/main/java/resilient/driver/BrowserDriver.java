package resilient.driver;

import resilient.model.StrategyKind;
import resilient.resolver.CandidateStaleException;
import resilient.resolver.TransientDriverException;

import java.time.Duration;
import java.util.Optional;

/**
 * Capability set the resolution engine needs from a browser automation layer.
 * Any implementation is pluggable; {@link SeleniumBrowserDriver} is the default one.
 *
 * <p>Implementations report an invalidated element reference with
 * {@link CandidateStaleException} and any other driver-side failure with
 * {@link TransientDriverException}. Methods never block longer than the timeout given.
 */
public interface BrowserDriver {

    /**
     * Looks up the first element matching {@code expression} without waiting.
     *
     * @return the handle, or empty when nothing matches
     */
    Optional<ElementHandle> exists(StrategyKind kind, String expression);

    /**
     * Waits until the element is displayed.
     *
     * @return {@code true} once visible, {@code false} if the timeout elapsed first
     * @throws CandidateStaleException if the reference was invalidated
     */
    boolean waitUntilVisible(ElementHandle handle, Duration timeout);

    /**
     * Waits until the element is displayed and enabled.
     *
     * @return {@code true} once enabled, {@code false} if the timeout elapsed first
     * @throws CandidateStaleException if the reference was invalidated
     */
    boolean waitUntilEnabled(ElementHandle handle, Duration timeout);

    void performClick(ElementHandle handle);

    /** Replaces the element's current value with {@code text}. */
    void performType(ElementHandle handle, String text);

    boolean isStale(ElementHandle handle);
}
