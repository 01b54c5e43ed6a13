package resilient.resolver;

/** A candidate's expression matched nothing within its timeout. Recovered by moving on. */
public class CandidateNotFoundException extends LocatorException {

    public CandidateNotFoundException(String msg) {
        super(msg);
    }
}
