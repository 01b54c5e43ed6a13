package resilient.resolver;

import resilient.driver.BrowserDriver;
import resilient.driver.DiagnosticCapture;
import resilient.driver.ElementHandle;
import resilient.driver.FixedDelayTimingHooks;
import resilient.driver.ScreenshotDiagnosticCapture;
import resilient.driver.SeleniumBrowserDriver;
import resilient.driver.TimingHooks;
import resilient.healing.HealingOutcome;
import resilient.healing.SelfHealingRegistry;
import resilient.healing.Verification;
import resilient.metrics.MetricsLedger;
import resilient.model.AttemptOutcome;
import resilient.model.DiagnosticBundle;
import resilient.model.HealingAttempt;
import resilient.model.LocatorCandidate;
import resilient.model.LocatorChain;
import resilient.model.ResolutionAttempt;
import resilient.model.ResolutionResult;
import resilient.monitor.FailureMonitor;
import resilient.ordering.AdaptiveOrderingEngine;
import resilient.ordering.CandidateMetrics;
import resilient.reporting.AttemptLog;
import resilient.retry.RetryExecutor;
import resilient.retry.RetryExhaustedException;
import resilient.retry.RetryPolicy;
import resilient.retry.Sleeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a {@link LocatorChain} to a live element by trying its candidates in the
 * order the {@link AdaptiveOrderingEngine} currently recommends, stopping at the first
 * one that is present and visible.
 *
 * <p>Per candidate: the driver is polled until a match appears or the per-candidate
 * timeout (clipped to the caller's {@link Deadline}) runs out, then the match must not be
 * stale and must become visible within what is left. A stale reference is retried once in
 * place; any other failure moves on to the next candidate. Every attempt is fed to the
 * ordering engine's ledger and to the structured {@link AttemptLog}; failed attempts also
 * go to the {@link FailureMonitor}.
 *
 * <p>When every candidate fails, the {@link SelfHealingRegistry} gets one chance to
 * discover a replacement. If that fails too, the {@link DiagnosticCapture} hook runs once
 * and {@link AllCandidatesExhaustedException} is thrown with the full attempt trail.
 *
 * <pre>{@code
 * LocatorResolver resolver = LocatorResolver.fromConfig(
 *         new SeleniumBrowserDriver(webDriver), new ResolverConfig());
 * resolver.interact(searchButton, Interaction.click());
 * }</pre>
 */
public class LocatorResolver {

    private static final Logger log = LoggerFactory.getLogger(LocatorResolver.class);

    /** Immediate single retry of a stale reference. */
    static final RetryPolicy STALE_RETRY = RetryPolicy.builder()
            .maxAttempts(2)
            .initialDelay(Duration.ZERO)
            .maxDelay(Duration.ZERO)
            .retryOn(e -> e instanceof CandidateStaleException)
            .build();

    private final BrowserDriver driver;
    private final AdaptiveOrderingEngine ordering;
    private final FailureMonitor monitor;
    private final SelfHealingRegistry healing;
    private final RetryExecutor retryExecutor;
    private final DiagnosticCapture capture;
    private final TimingHooks timing;
    private final AttemptLog attemptLog;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Duration perCandidateTimeout;
    private final Duration pollInterval;
    private final boolean healingEnabled;
    private final RetryPolicy retryPolicy;

    private LocatorResolver(Builder b) {
        this.driver              = b.driver;
        this.ordering            = b.ordering;
        this.monitor             = b.monitor;
        this.healing             = b.healing;
        this.retryExecutor       = b.retryExecutor;
        this.capture             = b.capture;
        this.timing              = b.timing;
        this.attemptLog          = b.attemptLog;
        this.sleeper             = b.sleeper;
        this.clock               = b.clock != null ? b.clock : b.monitor.clock();
        this.perCandidateTimeout = b.perCandidateTimeout;
        this.pollInterval        = b.pollInterval;
        this.healingEnabled      = b.healingEnabled;
        this.retryPolicy         = b.retryPolicy;
    }

    public static Builder builder(BrowserDriver driver) {
        return new Builder(driver);
    }

    /**
     * Wires a resolver from configuration: ledger decay, ordering weights, monitor window,
     * timing delays, the {@code retry.*} policy used by {@link #resolveWithRetry(LocatorChain)},
     * built-in healing strategies and, for a Selenium driver, screenshot evidence under
     * {@link ResolverConfig#getEvidenceDir()}.
     */
    public static LocatorResolver fromConfig(BrowserDriver driver, ResolverConfig config) {
        Clock clock = Clock.systemUTC();
        AdaptiveOrderingEngine ordering = new AdaptiveOrderingEngine(
                new MetricsLedger(config.getDecayFactor()), config.getLatencyWeight(), config.getMinSamples(), clock);
        FailureMonitor monitor = new FailureMonitor(config.getFailureWindow(), config.getFailureThreshold(), clock);

        DiagnosticCapture capture = driver instanceof SeleniumBrowserDriver
                ? new ScreenshotDiagnosticCapture(((SeleniumBrowserDriver) driver).getWebDriver(), config.getEvidenceDir())
                : DiagnosticCapture.NONE;

        return builder(driver)
                .orderingEngine(ordering)
                .failureMonitor(monitor)
                .healingRegistry(SelfHealingRegistry.withBuiltInStrategies())
                .diagnosticCapture(capture)
                .timingHooks(new FixedDelayTimingHooks(config.getPreActionDelay(), config.getPostActionDelay()))
                .perCandidateTimeout(config.getPerCandidateTimeout())
                .pollInterval(config.getPollInterval())
                .healingEnabled(config.isHealingEnabled())
                .retryPolicy(config.retryPolicy())
                .clock(clock)
                .build();
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Resolves with the configured per-candidate timeout and no overall deadline. */
    public ResolutionResult resolve(LocatorChain chain) {
        return resolve(chain, perCandidateTimeout, Deadline.none());
    }

    public ResolutionResult resolve(LocatorChain chain, Duration perCandidateTimeout) {
        return resolve(chain, perCandidateTimeout, Deadline.none());
    }

    /**
     * Tries the chain's candidates in effective order.
     *
     * @param chain               the element to find
     * @param perCandidateTimeout budget for each candidate (lookup plus visibility)
     * @param deadline            overall limit; expiry stops the loop and skips healing
     * @return the winning candidate, its live handle and every attempt made
     * @throws AllCandidatesExhaustedException if no candidate, declared or healed, resolved
     */
    public ResolutionResult resolve(LocatorChain chain, Duration perCandidateTimeout, Deadline deadline) {
        Objects.requireNonNull(chain, "chain");
        long start = System.nanoTime();
        List<LocatorCandidate> order = tryOrder(chain);
        List<ResolutionAttempt> attempts = new ArrayList<>();
        boolean cutShort = false;

        log.debug("Resolving '{}' over {} candidate(s)", chain.id(), order.size());
        for (LocatorCandidate candidate : order) {
            if (isCutShort(deadline)) {
                cutShort = true;
                break;
            }
            Probe probe = probe(candidate, attempts.size(), perCandidateTimeout, deadline);
            attempts.add(probe.attempt());
            report(chain, order.size(), probe.attempt());

            if (probe.handle() != null) {
                if (probe.attempt().attemptIndex() > 0) {
                    log.warn("Fallback used for '{}': {} succeeded after {} failed candidate(s)",
                            chain.id(), candidate, probe.attempt().attemptIndex());
                }
                return new ResolutionResult(chain.id(), candidate, probe.handle(), attempts, List.of(),
                        elapsedSince(start), candidate.isHealed());
            }
            if (candidate.isHealed()) {
                healing.invalidate(chain.id());
            }
            if (isCutShort(deadline)) {
                cutShort = true;
                break;
            }
        }

        List<HealingAttempt> healingAttempts = List.of();
        if (!cutShort && healingEnabled && healing.hasStrategies()) {
            log.warn("All {} candidate(s) of '{}' failed - attempting self-healing with hint '{}'",
                    attempts.size(), chain.id(), chain.healingHint());
            HealingOutcome outcome = healing.heal(chain, chain.healingHint(), driver, candidate -> {
                Probe probe = probe(candidate, attempts.size(), perCandidateTimeout, deadline);
                if (probe.handle() == null) {
                    attemptLog.record(chain.id(), order.size() + 1, probe.attempt());
                    return Verification.rejected(probe.attempt().outcome(), probe.attempt().reason());
                }
                attempts.add(probe.attempt());
                report(chain, order.size() + 1, probe.attempt());
                return Verification.resolved(probe.handle());
            });
            if (outcome.healed()) {
                return new ResolutionResult(chain.id(), outcome.candidate(), outcome.handle(), attempts,
                        outcome.attempts(), elapsedSince(start), true);
            }
            healingAttempts = outcome.attempts();
        }

        throw exhausted(chain, order.size(), attempts, healingAttempts, elapsedSince(start), cutShort);
    }

    /** Resolves repeatedly under the resolver's configured {@link RetryPolicy}. */
    public ResolutionResult resolveWithRetry(LocatorChain chain) {
        return resolveWithRetry(chain, retryPolicy);
    }

    /**
     * Resolves repeatedly under {@code policy}, for pages that are still loading.
     *
     * @throws RetryExhaustedException with the last {@link AllCandidatesExhaustedException} as cause
     */
    public ResolutionResult resolveWithRetry(LocatorChain chain, RetryPolicy policy) {
        return retryExecutor.execute("resolve '" + chain.id() + "'", () -> resolve(chain), policy).value();
    }

    public ResolutionResult interact(LocatorChain chain, Interaction interaction) {
        return interact(chain, interaction, Deadline.none());
    }

    /**
     * Resolves the chain and performs {@code interaction} on it, surrounded by the timing
     * hooks. A failed action triggers exactly one more resolve-and-act cycle.
     *
     * @return the resolution the action finally succeeded on
     * @throws AllCandidatesExhaustedException if a resolution fails
     * @throws ActionFailedException           if the action fails in both cycles
     */
    public ResolutionResult interact(LocatorChain chain, Interaction interaction, Deadline deadline) {
        List<ResolutionAttempt> allAttempts = new ArrayList<>();

        ResolutionResult first = resolve(chain, perCandidateTimeout, deadline);
        allAttempts.addAll(first.attempts());
        try {
            perform(first, interaction, deadline);
            return first;
        } catch (LocatorException e) {
            recordActionFailure(chain, interaction, e);
            log.warn("{} on '{}' failed: {} - re-resolving once", interaction, chain.id(), e.getMessage());
        }

        ResolutionResult second = resolve(chain, perCandidateTimeout, deadline);
        allAttempts.addAll(second.attempts());
        try {
            perform(second, interaction, deadline);
            log.info("{} on '{}' succeeded after re-resolution", interaction, chain.id());
            return second;
        } catch (LocatorException e) {
            recordActionFailure(chain, interaction, e);
            log.error("{} on '{}' failed again after re-resolution: {}", interaction, chain.id(), e.getMessage());
            throw new ActionFailedException(chain.id(), interaction, allAttempts, e);
        }
    }

    public boolean isDegraded(LocatorChain chain) {
        return monitor.isDegraded(chain.id());
    }

    public List<CandidateMetrics> metricsReport(LocatorChain chain) {
        return ordering.metricsReport(chain);
    }

    /** Forgets the healed candidate cached for {@code chain}, if any. */
    public void invalidateHealing(LocatorChain chain) {
        healing.invalidate(chain.id());
    }

    public AdaptiveOrderingEngine orderingEngine()  { return ordering; }
    public FailureMonitor failureMonitor()          { return monitor; }
    public SelfHealingRegistry healingRegistry()    { return healing; }
    public Duration perCandidateTimeout()           { return perCandidateTimeout; }
    public RetryPolicy retryPolicy()                { return retryPolicy; }

    // ── Internal helpers ─────────────────────────────────────────────────

    /** Result of trying one candidate: the attempt record plus the handle on success. */
    private record Probe(ResolutionAttempt attempt, ElementHandle handle) { }

    /** Healed candidate cached for the chain (if any) followed by the engine's effective order. */
    private List<LocatorCandidate> tryOrder(LocatorChain chain) {
        List<LocatorCandidate> effective = ordering.effectiveOrder(chain);
        Optional<LocatorCandidate> cached = healing.cached(chain.id());
        if (cached.isEmpty()) {
            return effective;
        }
        List<LocatorCandidate> order = new ArrayList<>(effective.size() + 1);
        Set<String> keys = new HashSet<>();
        order.add(cached.get());
        keys.add(cached.get().key());
        for (LocatorCandidate c : effective) {
            if (keys.add(c.key())) {
                order.add(c);
            }
        }
        return order;
    }

    private Probe probe(LocatorCandidate candidate, int attemptIndex, Duration timeout, Deadline deadline) {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        int[] tries = {0};
        ElementHandle handle = null;
        AttemptOutcome outcome;
        String reason = null;

        try {
            handle = retryExecutor.execute("probe " + candidate.key(), () -> {
                tries[0]++;
                return locate(candidate, timeout, deadline);
            }, STALE_RETRY).value();
            outcome = AttemptOutcome.SUCCESS;
        } catch (RetryExhaustedException e) {
            outcome = outcomeOf(e.getCause());
            reason  = e.getCause().getMessage();
        } catch (RuntimeException e) {
            outcome = outcomeOf(e);
            reason  = e.getMessage();
        }

        long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        ResolutionAttempt attempt = new ResolutionAttempt(candidate, attemptIndex, startedAt, clock.instant(),
                outcome, latencyMs, tries[0], reason);
        log.debug("Attempt {}", attempt.summary());
        return new Probe(attempt, handle);
    }

    /** One try of one candidate: poll for presence, then require a fresh, visible element. */
    private ElementHandle locate(LocatorCandidate candidate, Duration timeout, Deadline deadline) {
        long budgetEnd = System.nanoTime() + deadline.clip(timeout).toNanos();

        Optional<ElementHandle> found = driver.exists(candidate.kind(), candidate.expression());
        while (found.isEmpty()) {
            long remaining = budgetEnd - System.nanoTime();
            if (remaining <= 0) {
                if (deadline.isExpired()) {
                    throw new CandidateTimeoutException("Caller deadline exceeded while looking up " + candidate.key());
                }
                throw new CandidateNotFoundException("No match for " + candidate.key()
                        + " within " + timeout.toMillis() + " ms");
            }
            pause(Duration.ofNanos(Math.min(pollInterval.toNanos(), remaining)), candidate);
            found = driver.exists(candidate.kind(), candidate.expression());
        }

        ElementHandle handle = found.get();
        if (driver.isStale(handle)) {
            throw new CandidateStaleException("Stale reference for " + candidate.key());
        }
        Duration left = Duration.ofNanos(Math.max(0L, budgetEnd - System.nanoTime()));
        if (!driver.waitUntilVisible(handle, left)) {
            throw new CandidateTimeoutException(deadline.isExpired()
                    ? "Caller deadline exceeded waiting for " + candidate.key() + " to become visible"
                    : candidate.key() + " present but not visible within " + timeout.toMillis() + " ms");
        }
        return handle;
    }

    private void pause(Duration delay, LocatorCandidate candidate) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CandidateTimeoutException("Interrupted while looking up " + candidate.key(), e);
        }
    }

    private void perform(ResolutionResult result, Interaction interaction, Deadline deadline) {
        ElementHandle handle = result.handle();
        timing.preActionDelay();
        switch (interaction.kind()) {
            case LOCATE -> { }
            case CLICK  -> driver.performClick(handle);
            case TYPE   -> driver.performType(handle, interaction.text());
            case WAIT_FOR_STATE -> {
                Duration timeout = deadline.clip(perCandidateTimeout);
                boolean reached = interaction.state() == Interaction.ElementState.ENABLED
                        ? driver.waitUntilEnabled(handle, timeout)
                        : driver.waitUntilVisible(handle, timeout);
                if (!reached) {
                    throw new CandidateTimeoutException(result.candidate().key() + " did not become "
                            + interaction.state() + " within " + timeout.toMillis() + " ms");
                }
            }
        }
        timing.postActionDelay();
        log.debug("{} performed on '{}' via {}", interaction, result.chainId(), result.candidate());
    }

    /** Feeds one attempt to the ledger, the monitor (failures only) and the attempt log. */
    private void report(LocatorChain chain, int totalCandidates, ResolutionAttempt attempt) {
        ordering.record(chain.id(), attempt.candidate(), attempt.outcome(), Duration.ofMillis(attempt.latencyMs()));
        if (attempt.outcome().isFailure()) {
            monitor.recordFailure(chain.id(), attempt.outcome(), attempt.reason(), attempt.endedAt());
        }
        attemptLog.record(chain.id(), totalCandidates, attempt);
    }

    private void recordActionFailure(LocatorChain chain, Interaction interaction, LocatorException e) {
        monitor.recordFailure(chain.id(), outcomeOf(e), interaction + " failed: " + e.getMessage(), clock.instant());
    }

    private AllCandidatesExhaustedException exhausted(LocatorChain chain, int totalCandidates,
                                                      List<ResolutionAttempt> attempts,
                                                      List<HealingAttempt> healingAttempts,
                                                      Duration elapsed, boolean deadlineExceeded) {
        DiagnosticBundle bundle = new DiagnosticBundle(chain.id(), chain.description(), totalCandidates,
                attempts, healingAttempts, null, elapsed, monitor.isDegraded(chain.id()), deadlineExceeded);

        String reference = null;
        try {
            reference = capture.captureFailure(bundle.describe());
        } catch (RuntimeException e) {
            log.warn("Diagnostic capture failed for '{}': {}", chain.id(), e.toString());
        }
        bundle = bundle.withCaptureReference(reference);

        log.error("All candidates exhausted for '{}' ({} attempt(s), {} healing attempt(s), {} ms{})",
                chain.id(), attempts.size(), healingAttempts.size(), elapsed.toMillis(),
                deadlineExceeded ? ", deadline exceeded" : "");
        return new AllCandidatesExhaustedException(bundle);
    }

    private static boolean isCutShort(Deadline deadline) {
        return deadline.isExpired() || Thread.currentThread().isInterrupted();
    }

    static AttemptOutcome outcomeOf(Throwable error) {
        if (error instanceof CandidateNotFoundException) return AttemptOutcome.NOT_FOUND;
        if (error instanceof CandidateTimeoutException)  return AttemptOutcome.TIMEOUT;
        if (error instanceof CandidateStaleException)    return AttemptOutcome.STALE;
        return AttemptOutcome.TRANSIENT_ERROR;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /** Collaborators default to fresh in-memory instances and no-op hooks. */
    public static final class Builder {

        private final BrowserDriver driver;
        private AdaptiveOrderingEngine ordering = new AdaptiveOrderingEngine();
        private FailureMonitor monitor = new FailureMonitor();
        private SelfHealingRegistry healing = new SelfHealingRegistry();
        private RetryExecutor retryExecutor = new RetryExecutor();
        private DiagnosticCapture capture = DiagnosticCapture.NONE;
        private TimingHooks timing = TimingHooks.NONE;
        private AttemptLog attemptLog = new AttemptLog();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Clock clock;
        private Duration perCandidateTimeout = Duration.ofMillis(3000);
        private Duration pollInterval = SeleniumBrowserDriver.DEFAULT_POLL_INTERVAL;
        private boolean healingEnabled = true;
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;

        private Builder(BrowserDriver driver) {
            this.driver = Objects.requireNonNull(driver, "driver");
        }

        public Builder orderingEngine(AdaptiveOrderingEngine ordering) {
            this.ordering = Objects.requireNonNull(ordering, "ordering");
            return this;
        }

        public Builder failureMonitor(FailureMonitor monitor) {
            this.monitor = Objects.requireNonNull(monitor, "monitor");
            return this;
        }

        public Builder healingRegistry(SelfHealingRegistry healing) {
            this.healing = Objects.requireNonNull(healing, "healing");
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
            return this;
        }

        public Builder diagnosticCapture(DiagnosticCapture capture) {
            this.capture = Objects.requireNonNull(capture, "capture");
            return this;
        }

        public Builder timingHooks(TimingHooks timing) {
            this.timing = Objects.requireNonNull(timing, "timing");
            return this;
        }

        public Builder attemptLog(AttemptLog attemptLog) {
            this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog");
            return this;
        }

        /** Sleeper used between lookups while polling for a candidate. */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        /** Clock for attempt timestamps; defaults to the failure monitor's clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder perCandidateTimeout(Duration timeout) {
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("perCandidateTimeout must not be negative");
            }
            this.perCandidateTimeout = timeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder healingEnabled(boolean healingEnabled) {
            this.healingEnabled = healingEnabled;
            return this;
        }

        /** Policy used by {@link LocatorResolver#resolveWithRetry(LocatorChain)}. */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public LocatorResolver build() {
            return new LocatorResolver(this);
        }
    }
}
