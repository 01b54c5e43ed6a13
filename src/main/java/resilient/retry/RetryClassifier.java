package resilient.retry;

import resilient.resolver.LocatorException;

import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Default split between retryable and fatal errors.
 *
 * <p>Fatal: every {@link Error} (including {@link AssertionError}) and the JDK's logic-error
 * exceptions. Retryable: locator failures, Selenium timeouts and stale/missing element
 * errors, I/O and network errors. Anything else is retryable only when a message in its
 * cause chain mentions a known transient condition.
 */
public final class RetryClassifier {

    private static final List<Class<? extends Throwable>> FATAL = List.of(
            IllegalArgumentException.class,
            IllegalStateException.class,
            NullPointerException.class,
            UnsupportedOperationException.class,
            ClassCastException.class,
            IndexOutOfBoundsException.class);

    private static final List<Class<? extends Throwable>> RETRYABLE = List.of(
            LocatorException.class,
            TimeoutException.class,
            StaleElementReferenceException.class,
            NoSuchElementException.class,
            java.util.concurrent.TimeoutException.class,
            IOException.class,
            UncheckedIOException.class);

    private static final List<String> TRANSIENT_KEYWORDS = List.of(
            "timeout", "timed out", "detached", "stale", "network", "connection",
            "refused", "reset", "no such element", "element not found");

    private RetryClassifier() { }

    public static boolean isRetryable(Throwable error) {
        if (error == null || error instanceof Error) {
            return false;
        }
        for (Class<? extends Throwable> type : FATAL) {
            if (type.isInstance(error)) {
                return false;
            }
        }
        for (Class<? extends Throwable> type : RETRYABLE) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            String msg = t.getMessage();
            if (msg == null) {
                continue;
            }
            String lower = msg.toLowerCase(Locale.ROOT);
            for (String keyword : TRANSIENT_KEYWORDS) {
                if (lower.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }
}
