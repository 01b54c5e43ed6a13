package resilient.healing;

import resilient.driver.FakeBrowserDriver;
import resilient.model.LocatorCandidate;
import resilient.model.StrategyKind;

import org.testng.annotations.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AttributeHintStrategy}.
 */
public class AttributeHintStrategyTest {

    private final AttributeHintStrategy strategy = new AttributeHintStrategy();

    @Test(description = "Selectors are tried from most to least stable attribute")
    public void testSelectorOrder() {
        assertThat(strategy.selectorsFor("Search submit")).containsExactly(
                "[data-testid='Search submit']",
                "[data-testid='search-submit']",
                "[aria-label='Search submit']",
                "[name='Search submit']",
                "[placeholder*='Search submit']");
    }

    @Test(description = "A slug identical to the hint is not tried twice")
    public void testNoDuplicateSlug() {
        assertThat(strategy.selectorsFor("email")).hasSize(4);
    }

    @Test(description = "The slugified data-testid is found and returned as a healed ATTRIBUTE candidate")
    public void testFindsSlugTestId() {
        FakeBrowserDriver page = new FakeBrowserDriver()
                .present(StrategyKind.ATTRIBUTE, "[data-testid='search-submit']")
                .present(StrategyKind.ATTRIBUTE, "[name='Search submit']");

        Optional<LocatorCandidate> found = strategy.discover(page, "Search submit");

        assertThat(found).isPresent();
        assertThat(found.get().kind()).isEqualTo(StrategyKind.ATTRIBUTE);
        assertThat(found.get().expression()).isEqualTo("[data-testid='search-submit']");
        assertThat(found.get().isHealed()).isTrue();
    }

    @Test(description = "Quotes in the hint are escaped in the CSS string")
    public void testQuotesEscaped() {
        assertThat(strategy.selectorsFor("Shopper's cart").get(2)).isEqualTo("[aria-label='Shopper\\'s cart']");
    }

    @Test(description = "Nothing matching and blank hints give no candidate")
    public void testNoMatch() {
        FakeBrowserDriver page = new FakeBrowserDriver();

        assertThat(strategy.discover(page, "Checkout")).isEmpty();
        assertThat(strategy.discover(page, "  ")).isEmpty();
        assertThat(page.lookups()).hasSize(5);
    }

    @Test(description = "Slugs are lower-case with single dashes")
    public void testSlug() {
        assertThat(AttributeHintStrategy.slug("  Add to Cart! ")).isEqualTo("add-to-cart");
    }
}
