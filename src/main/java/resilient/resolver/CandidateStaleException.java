package resilient.resolver;

/**
 * An element reference was invalidated by a DOM mutation between lookup and use.
 * Recovered locally with one in-place retry of the same candidate.
 */
public class CandidateStaleException extends LocatorException {

    public CandidateStaleException(String msg) {
        super(msg);
    }

    public CandidateStaleException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
