package resilient.healing;

import resilient.driver.BrowserDriver;
import resilient.driver.SeleniumLocators;
import resilient.model.LocatorCandidate;
import resilient.model.StrategyKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Looks for the hint in the attributes that usually survive redesigns, most stable first:
 * {@code data-testid} (hint as-is and slugified), {@code aria-label}, {@code name},
 * then a partial {@code placeholder} match.
 */
public class AttributeHintStrategy implements HealingStrategy {

    @Override
    public Optional<LocatorCandidate> discover(BrowserDriver page, String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        for (String selector : selectorsFor(hint.trim())) {
            if (page.exists(StrategyKind.ATTRIBUTE, selector).isPresent()) {
                return Optional.of(LocatorCandidate.healed(StrategyKind.ATTRIBUTE, selector,
                        "Attribute match for '" + hint + "'"));
            }
        }
        return Optional.empty();
    }

    /** Candidate selectors for {@code hint}, in the order they are tried. */
    List<String> selectorsFor(String hint) {
        Set<String> testIds = new LinkedHashSet<>();
        testIds.add(hint);
        testIds.add(slug(hint));

        List<String> selectors = new ArrayList<>();
        for (String id : testIds) {
            selectors.add("[data-testid=" + SeleniumLocators.cssString(id) + "]");
        }
        selectors.add("[aria-label=" + SeleniumLocators.cssString(hint) + "]");
        selectors.add("[name=" + SeleniumLocators.cssString(hint) + "]");
        selectors.add("[placeholder*=" + SeleniumLocators.cssString(hint) + "]");
        return selectors;
    }

    /** "Search submit button" becomes "search-submit-button". */
    static String slug(String hint) {
        String s = hint.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return s.replaceAll("^-+|-+$", "");
    }
}
