package resilient.driver;

/**
 * Opaque reference to a live element returned by {@link BrowserDriver#exists}.
 * Only the driver implementation that produced a handle knows how to use it.
 */
public interface ElementHandle {

    /** Short description for logs. */
    String describe();
}
