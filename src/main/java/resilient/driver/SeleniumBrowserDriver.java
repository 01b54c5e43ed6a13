package resilient.driver;

import resilient.model.StrategyKind;
import resilient.resolver.CandidateStaleException;
import resilient.resolver.CandidateTimeoutException;
import resilient.resolver.TransientDriverException;

import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedCondition;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * {@link BrowserDriver} backed by a Selenium {@link WebDriver}.
 *
 * <p>Implicit waits are never set; every wait is an explicit {@link WebDriverWait} bounded
 * by the caller's timeout so resolution latency stays deterministic.
 */
public class SeleniumBrowserDriver implements BrowserDriver {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserDriver.class);

    /** Default polling interval for explicit waits. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final WebDriver driver;
    private final Duration pollInterval;

    public SeleniumBrowserDriver(WebDriver driver) {
        this(driver, DEFAULT_POLL_INTERVAL);
    }

    /**
     * @param driver       active WebDriver session (lifecycle owned by the caller)
     * @param pollInterval how often explicit waits re-check their condition
     */
    public SeleniumBrowserDriver(WebDriver driver, Duration pollInterval) {
        this.driver       = driver;
        this.pollInterval = pollInterval;
    }

    public WebDriver getWebDriver() {
        return driver;
    }

    @Override
    public Optional<ElementHandle> exists(StrategyKind kind, String expression) {
        By by = SeleniumLocators.toBy(kind, expression);
        try {
            List<WebElement> found = driver.findElements(by);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new SeleniumElementHandle(found.get(0), by));
        } catch (InvalidSelectorException e) {
            log.warn("Invalid selector {} - treating as no match: {}", by, e.getMessage());
            return Optional.empty();
        } catch (WebDriverException e) {
            if (isInterruption(e)) {
                throw new CandidateTimeoutException("Interrupted while looking up " + by, e);
            }
            throw new TransientDriverException("Lookup failed for " + by + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean waitUntilVisible(ElementHandle handle, Duration timeout) {
        return await(handle, timeout, ExpectedConditions.visibilityOf(unwrap(handle)), "visible");
    }

    @Override
    public boolean waitUntilEnabled(ElementHandle handle, Duration timeout) {
        return await(handle, timeout, ExpectedConditions.elementToBeClickable(unwrap(handle)), "enabled");
    }

    @Override
    public void performClick(ElementHandle handle) {
        WebElement el = unwrap(handle);
        try {
            el.click();
        } catch (StaleElementReferenceException e) {
            throw new CandidateStaleException("Element went stale before click: " + handle.describe(), e);
        } catch (WebDriverException e) {
            throw new TransientDriverException("Click failed on " + handle.describe() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void performType(ElementHandle handle, String text) {
        WebElement el = unwrap(handle);
        try {
            el.clear();
            el.sendKeys(text);
        } catch (StaleElementReferenceException e) {
            throw new CandidateStaleException("Element went stale before typing: " + handle.describe(), e);
        } catch (WebDriverException e) {
            throw new TransientDriverException("Typing failed on " + handle.describe() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isStale(ElementHandle handle) {
        Boolean stale = ExpectedConditions.stalenessOf(unwrap(handle)).apply(driver);
        return Boolean.TRUE.equals(stale);
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private boolean await(ElementHandle handle, Duration timeout, ExpectedCondition<WebElement> condition,
                          String state) {
        log.debug("Waiting up to {} ms for {} to be {}", timeout.toMillis(), handle.describe(), state);
        try {
            new WebDriverWait(driver, timeout, pollInterval).until(condition);
            return true;
        } catch (TimeoutException e) {
            log.debug("{} not {} within {} ms", handle.describe(), state, timeout.toMillis());
            return false;
        } catch (StaleElementReferenceException e) {
            throw new CandidateStaleException("Element went stale while waiting to be " + state + ": "
                    + handle.describe(), e);
        } catch (WebDriverException e) {
            if (isInterruption(e)) {
                throw new CandidateTimeoutException("Interrupted while waiting for " + handle.describe()
                        + " to be " + state, e);
            }
            throw new TransientDriverException("Wait for " + state + " failed on " + handle.describe()
                    + ": " + e.getMessage(), e);
        }
    }

    /** FluentWait restores the interrupt flag and rethrows an interrupted sleep as a plain WebDriverException. */
    private static boolean isInterruption(WebDriverException e) {
        return Thread.currentThread().isInterrupted() || e.getCause() instanceof InterruptedException;
    }

    private static WebElement unwrap(ElementHandle handle) {
        if (!(handle instanceof SeleniumElementHandle)) {
            throw new IllegalArgumentException("Handle was not produced by SeleniumBrowserDriver: " + handle);
        }
        return ((SeleniumElementHandle) handle).element();
    }
}
