package resilient.healing;

import resilient.driver.BrowserDriver;
import resilient.model.HealingAttempt;
import resilient.model.LocatorCandidate;
import resilient.model.LocatorChain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Last-resort discovery of working candidates once a chain's declared candidates are
 * exhausted.
 *
 * <p>Strategies run in registration order; the first one whose proposal passes the
 * verifier wins. The winner is cached under the chain id for the rest of the session so
 * the resolver can try it first next time, and can be invalidated explicitly.
 *
 * <p>Healing events are logged at INFO/WARN through this class's logger, which logback
 * routes to {@code logs/healing.log} as well as the console.
 */
public class SelfHealingRegistry {

    private static final Logger log = LoggerFactory.getLogger(SelfHealingRegistry.class);

    private final List<NamedStrategy> strategies = new CopyOnWriteArrayList<>();
    private final Map<String, LocatorCandidate> cache = new ConcurrentHashMap<>();

    /** Registry pre-loaded with the attribute-hint and text-hint strategies, in that order. */
    public static SelfHealingRegistry withBuiltInStrategies() {
        SelfHealingRegistry registry = new SelfHealingRegistry();
        registry.registerStrategy("attribute-hint", new AttributeHintStrategy());
        registry.registerStrategy("text-hint", new TextHintStrategy());
        return registry;
    }

    public void registerStrategy(HealingStrategy strategy) {
        registerStrategy("strategy-" + (strategies.size() + 1), strategy);
    }

    public void registerStrategy(String name, HealingStrategy strategy) {
        strategies.add(new NamedStrategy(name, strategy));
        log.debug("Registered healing strategy '{}' ({} total)", name, strategies.size());
    }

    public boolean hasStrategies() {
        return !strategies.isEmpty();
    }

    public List<String> strategyNames() {
        List<String> names = new ArrayList<>();
        for (NamedStrategy s : strategies) {
            names.add(s.name());
        }
        return names;
    }

    /**
     * Runs the strategies for an exhausted chain.
     *
     * @param chain    the chain whose declared candidates all failed
     * @param hint     semantic description handed to every strategy
     * @param page     live page handed to every strategy
     * @param verifier checks each proposal against the live page
     * @return the winning candidate and handle, or a failed outcome listing every attempt
     */
    public HealingOutcome heal(LocatorChain chain, String hint, BrowserDriver page, CandidateVerifier verifier) {
        List<HealingAttempt> attempts = new ArrayList<>();
        for (NamedStrategy s : strategies) {
            Optional<LocatorCandidate> proposed;
            try {
                proposed = s.strategy().discover(page, hint);
            } catch (RuntimeException e) {
                log.warn("HEALING ERROR | chain={} | strategy={} | {}", chain.id(), s.name(), e.toString());
                attempts.add(HealingAttempt.failed(s.name(), null, "strategy threw " + e));
                continue;
            }
            if (proposed.isEmpty()) {
                attempts.add(HealingAttempt.failed(s.name(), null, "no match for hint '" + hint + "'"));
                continue;
            }

            LocatorCandidate candidate = asHealed(proposed.get());
            log.info("HEALING ATTEMPT | chain={} | strategy={} | candidate={}", chain.id(), s.name(), candidate);
            Verification verification = verifier.verify(candidate);
            if (verification.isResolved()) {
                cache.put(chain.id(), candidate);
                attempts.add(HealingAttempt.success(s.name(), candidate));
                log.warn("HEALING SUCCESS | chain={} | strategy={} | candidate={} - the page has likely changed",
                        chain.id(), s.name(), candidate);
                return new HealingOutcome(candidate, verification.handle(), attempts);
            }
            log.info("HEALING REJECTED | chain={} | strategy={} | candidate={} | {}",
                    chain.id(), s.name(), candidate, verification.outcome());
            attempts.add(HealingAttempt.rejected(s.name(), candidate, verification.outcome(),
                    "proposed candidate did not resolve: " + verification.reason()));
        }

        if (!strategies.isEmpty()) {
            log.error("HEALING EXHAUSTED | chain={} | {} strategies tried", chain.id(), strategies.size());
        }
        return HealingOutcome.failed(attempts);
    }

    /** The rescue candidate cached for a chain during this session, if any. */
    public Optional<LocatorCandidate> cached(String chainId) {
        return Optional.ofNullable(cache.get(chainId));
    }

    public void invalidate(String chainId) {
        if (cache.remove(chainId) != null) {
            log.info("Healing cache invalidated for '{}'", chainId);
        }
    }

    public void clear() {
        cache.clear();
        log.debug("Healing cache cleared");
    }

    private static LocatorCandidate asHealed(LocatorCandidate c) {
        return c.isHealed() ? c : LocatorCandidate.healed(c.kind(), c.expression(), c.description());
    }

    private record NamedStrategy(String name, HealingStrategy strategy) { }
}
