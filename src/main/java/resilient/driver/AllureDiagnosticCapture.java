package resilient.driver;

import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;

/**
 * Attaches the failure report, and a screenshot when available, to the Allure test
 * currently running on this thread.
 */
public class AllureDiagnosticCapture implements DiagnosticCapture {

    private static final Logger log = LoggerFactory.getLogger(AllureDiagnosticCapture.class);

    static final String REPORT_ATTACHMENT     = "Locator failure";
    static final String SCREENSHOT_ATTACHMENT = "Locator failure screenshot";

    private final WebDriver driver;

    /**
     * @param driver session to screenshot; may be {@code null} to attach the report only
     */
    public AllureDiagnosticCapture(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public String captureFailure(String description) {
        Allure.addAttachment(REPORT_ATTACHMENT, "text/plain", description, "txt");

        if (driver instanceof TakesScreenshot) {
            try {
                byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(SCREENSHOT_ATTACHMENT, "image/png", new ByteArrayInputStream(png), "png");
                log.debug("Attached failure screenshot ({} bytes)", png.length);
            } catch (Exception e) {
                log.warn("Could not attach failure screenshot: {}", e.getMessage());
            }
        }
        return "allure:" + REPORT_ATTACHMENT;
    }
}
