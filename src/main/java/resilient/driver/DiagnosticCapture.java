package resilient.driver;

/**
 * Hook invoked once when a chain is fully exhausted, to persist whatever evidence the
 * automation layer can gather (screenshot, page source, report attachment).
 */
@FunctionalInterface
public interface DiagnosticCapture {

    /** Capture hook that records nothing. */
    DiagnosticCapture NONE = description -> null;

    /**
     * @param description multi-line failure report
     * @return a reference to the stored evidence (path, attachment name, ...), or {@code null}
     */
    String captureFailure(String description);
}
