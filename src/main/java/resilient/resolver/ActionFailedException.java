package resilient.resolver;

import resilient.model.ResolutionAttempt;

import java.util.List;

/**
 * Resolution succeeded but the interaction itself failed, twice: once on the original
 * handle and once more after a fresh resolution.
 */
public class ActionFailedException extends LocatorException {

    private final String chainId;
    private final Interaction interaction;
    private final transient List<ResolutionAttempt> attempts;

    public ActionFailedException(String chainId, Interaction interaction,
                                 List<ResolutionAttempt> attempts, Throwable cause) {
        super(String.format("%s failed on '%s' after re-resolution: %s",
                interaction, chainId, cause.getMessage()), cause);
        this.chainId     = chainId;
        this.interaction = interaction;
        this.attempts    = List.copyOf(attempts);
    }

    public String chainId()                   { return chainId; }
    public Interaction interaction()          { return interaction; }

    /** Resolution attempts of both cycles, in order. */
    public List<ResolutionAttempt> attempts() { return attempts; }
}
