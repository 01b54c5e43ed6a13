package resilient.driver;

import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

/**
 * {@link ElementHandle} wrapping a Selenium {@link WebElement} and the {@link By} that found it.
 */
public record SeleniumElementHandle(WebElement element, By locator) implements ElementHandle {

    @Override
    public String describe() {
        return String.valueOf(locator);
    }
}
