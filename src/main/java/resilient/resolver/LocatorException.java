package resilient.resolver;

/**
 * Unchecked base exception for every failure raised by the resolution engine:
 * per-candidate lookup failures, terminal exhaustion and failed interactions.
 */
public class LocatorException extends RuntimeException {

    public LocatorException(String msg) {
        super(msg);
    }

    public LocatorException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
