package resilient.resolver;

/** A matching element never satisfied its visibility or state condition in time. */
public class CandidateTimeoutException extends LocatorException {

    public CandidateTimeoutException(String msg) {
        super(msg);
    }

    public CandidateTimeoutException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
