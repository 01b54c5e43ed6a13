package resilient.healing;

import resilient.driver.BrowserDriver;
import resilient.driver.SeleniumLocators;
import resilient.model.LocatorCandidate;
import resilient.model.StrategyKind;

import java.util.Optional;

/**
 * Matches the hint against visible text: exact (normalized) text first, then an XPath
 * {@code contains()} on a prefix of the hint. Needs no markup knowledge at all.
 */
public class TextHintStrategy implements HealingStrategy {

    /** Maximum hint characters fed into the partial-text XPath. */
    static final int TEXT_MATCH_MAX_CHARS = 30;

    @Override
    public Optional<LocatorCandidate> discover(BrowserDriver page, String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String text = hint.trim();
        if (page.exists(StrategyKind.TEXT, text).isPresent()) {
            return Optional.of(LocatorCandidate.healed(StrategyKind.TEXT, text, "Exact text '" + text + "'"));
        }

        String xpath = partialTextXpath(text);
        if (page.exists(StrategyKind.XPATH, xpath).isPresent()) {
            return Optional.of(LocatorCandidate.healed(StrategyKind.XPATH, xpath, "Text containing '" + text + "'"));
        }
        return Optional.empty();
    }

    static String partialTextXpath(String text) {
        String prefix = text.substring(0, Math.min(TEXT_MATCH_MAX_CHARS, text.length()));
        return "//*[contains(normalize-space(text())," + SeleniumLocators.xpathLiteral(prefix) + ")]";
    }
}
