package resilient.reporting;

import resilient.model.ResolutionAttempt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits one JSON line per resolution attempt through the {@value #LOGGER_NAME} logger.
 *
 * <pre>{@code
 * {"chainId":"search.submit","attemptIndex":0,"totalCandidates":4,
 *  "strategyKind":"ATTRIBUTE","expression":"[data-testid='search-submit']",
 *  "outcome":"NOT_FOUND","latencyMs":3004}
 * }</pre>
 *
 * <p>logback.xml routes the logger to {@code logs/attempts.log} only.
 */
public class AttemptLog {

    public static final String LOGGER_NAME = "resilient.attempts";

    /** Log that drops every event. */
    public static final AttemptLog DISABLED = new AttemptLog(null);

    private final Logger logger;
    private final ObjectMapper mapper = new ObjectMapper();

    public AttemptLog() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    AttemptLog(Logger logger) {
        this.logger = logger;
    }

    public void record(String chainId, int totalCandidates, ResolutionAttempt attempt) {
        if (logger == null || !logger.isInfoEnabled()) {
            return;
        }
        logger.info(toJson(chainId, totalCandidates, attempt));
    }

    /** Serializes one attempt event; field order is stable. */
    public String toJson(String chainId, int totalCandidates, ResolutionAttempt attempt) {
        ObjectNode node = mapper.createObjectNode();
        node.put("chainId", chainId);
        node.put("attemptIndex", attempt.attemptIndex());
        node.put("totalCandidates", totalCandidates);
        node.put("strategyKind", attempt.candidate().kind().name());
        node.put("expression", attempt.candidate().expression());
        node.put("outcome", attempt.outcome().name());
        node.put("latencyMs", attempt.latencyMs());
        if (attempt.tries() > 1) {
            node.put("tries", attempt.tries());
        }
        if (attempt.candidate().isHealed()) {
            node.put("healed", true);
        }
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize attempt for chain '" + chainId + "'", e);
        }
    }
}
