package resilient.driver;

import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes failure evidence to disk:
 * <pre>{evidenceBaseDir}/{timestamp}-{seq}/</pre>
 * containing {@code report.txt} (the diagnostic report), {@code screenshot.png} and
 * {@code page-source.html} when the driver supports them. Individual artifact failures
 * are logged as warnings and do not abort the capture.
 */
public class ScreenshotDiagnosticCapture implements DiagnosticCapture {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotDiagnosticCapture.class);

    private static final DateTimeFormatter DIR_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneId.of("UTC"));

    private final WebDriver driver;
    private final String evidenceBaseDir;
    private final Clock clock;
    private final AtomicInteger sequence = new AtomicInteger();

    public ScreenshotDiagnosticCapture(WebDriver driver, String evidenceBaseDir) {
        this(driver, evidenceBaseDir, Clock.systemUTC());
    }

    ScreenshotDiagnosticCapture(WebDriver driver, String evidenceBaseDir, Clock clock) {
        this.driver          = driver;
        this.evidenceBaseDir = evidenceBaseDir;
        this.clock           = clock;
    }

    /**
     * @return the evidence directory path, or {@code null} when it could not be created
     */
    @Override
    public String captureFailure(String description) {
        Path dir = Paths.get(evidenceBaseDir,
                DIR_FMT.format(clock.instant()) + "-" + sequence.incrementAndGet());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Cannot create evidence directory {}: {}", dir, e.getMessage());
            return null;
        }

        writeReport(dir, description);
        writeScreenshot(dir);
        writePageSource(dir);

        log.info("Failure evidence written to {}", dir);
        return dir.toString();
    }

    private void writeReport(Path dir, String description) {
        try {
            Files.writeString(dir.resolve("report.txt"), description, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to write failure report: {}", e.getMessage());
        }
    }

    private void writeScreenshot(Path dir) {
        if (!(driver instanceof TakesScreenshot)) {
            log.debug("Driver does not support TakesScreenshot - skipping screenshot");
            return;
        }
        try {
            byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
            Files.write(dir.resolve("screenshot.png"), png);
        } catch (Exception e) {
            log.warn("Failed to capture screenshot: {}", e.getMessage());
        }
    }

    private void writePageSource(Path dir) {
        try {
            String source = driver.getPageSource();
            if (source != null) {
                Files.writeString(dir.resolve("page-source.html"), source, StandardCharsets.UTF_8);
            }
        } catch (Exception e) {
            log.warn("Failed to capture page source: {}", e.getMessage());
        }
    }
}
