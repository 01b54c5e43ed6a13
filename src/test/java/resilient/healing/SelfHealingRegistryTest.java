package resilient.healing;

import resilient.driver.FakeBrowserDriver;
import resilient.model.AttemptOutcome;
import resilient.model.HealingAttempt;
import resilient.model.LocatorCandidate;
import resilient.model.LocatorChain;
import resilient.model.StrategyKind;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SelfHealingRegistry}.
 */
public class SelfHealingRegistryTest {

    private SelfHealingRegistry registry;
    private FakeBrowserDriver page;
    private LocatorChain chain;
    private List<LocatorCandidate> verified;

    @BeforeMethod
    public void setUp() {
        registry = new SelfHealingRegistry();
        page = new FakeBrowserDriver();
        chain = LocatorChain.builder("login.submit").description("Sign in").css("#login").build();
        verified = new ArrayList<>();
    }

    /** Verifier that accepts whatever is present on the fake page. */
    private Verification verify(LocatorCandidate candidate) {
        verified.add(candidate);
        return page.exists(candidate.kind(), candidate.expression())
                .map(Verification::resolved)
                .orElseGet(() -> Verification.rejected(AttemptOutcome.NOT_FOUND, "no match on page"));
    }

    @Test(description = "Strategies run in registration order and the first verified proposal wins")
    public void testFirstVerifiedProposalWins() {
        page.present(StrategyKind.TEXT, "Sign in");
        registry.registerStrategy("ghost", (p, hint) -> Optional.of(LocatorCandidate.of(StrategyKind.CSS, "#ghost")));
        registry.registerStrategy("text", (p, hint) -> Optional.of(LocatorCandidate.of(StrategyKind.TEXT, hint)));
        registry.registerStrategy("never", (p, hint) -> {
            throw new AssertionError("must not run after a winner");
        });

        HealingOutcome outcome = registry.heal(chain, "Sign in", page, this::verify);

        assertThat(outcome.healed()).isTrue();
        assertThat(outcome.candidate().kind()).isEqualTo(StrategyKind.TEXT);
        assertThat(outcome.candidate().isHealed()).isTrue();
        assertThat(outcome.handle()).isNotNull();
        assertThat(outcome.attempts()).extracting(HealingAttempt::strategyName).containsExactly("ghost", "text");
        assertThat(outcome.attempts()).extracting(HealingAttempt::healed).containsExactly(false, true);
        assertThat(verified).hasSize(2);
        assertThat(registry.cached("login.submit")).contains(outcome.candidate());
    }

    @Test(description = "A throwing strategy is recorded as a failed attempt and the next one runs")
    public void testThrowingStrategyRecorded() {
        page.present(StrategyKind.CSS, "#rescued");
        registry.registerStrategy("broken", (p, hint) -> {
            throw new IllegalStateException("vision service offline");
        });
        registry.registerStrategy("css", (p, hint) -> Optional.of(LocatorCandidate.of(StrategyKind.CSS, "#rescued")));

        HealingOutcome outcome = registry.heal(chain, "Sign in", page, this::verify);

        assertThat(outcome.healed()).isTrue();
        assertThat(outcome.attempts().get(0).healed()).isFalse();
        assertThat(outcome.attempts().get(0).reason()).contains("vision service offline");
    }

    @Test(description = "A rejected proposal keeps the outcome and reason its verification failed with")
    public void testRejectedProposalKeepsOutcome() {
        registry.registerStrategy("hidden", (p, hint) -> Optional.of(LocatorCandidate.of(StrategyKind.CSS, "#hidden")));
        CandidateVerifier neverVisible = candidate ->
                Verification.rejected(AttemptOutcome.TIMEOUT, "present but not visible within 3000 ms");

        HealingOutcome outcome = registry.heal(chain, "Sign in", page, neverVisible);

        assertThat(outcome.healed()).isFalse();
        HealingAttempt attempt = outcome.attempts().get(0);
        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.TIMEOUT);
        assertThat(attempt.reason()).contains("not visible within 3000 ms");
        assertThat(attempt.summary()).startsWith("healing[hidden] TIMEOUT CSS='#hidden'");
        assertThat(registry.cached("login.submit")).isEmpty();
    }

    @Test(description = "No successful strategy yields a failed outcome and nothing is cached")
    public void testNothingFound() {
        registry.registerStrategy((p, hint) -> Optional.empty());

        HealingOutcome outcome = registry.heal(chain, "Sign in", page, this::verify);

        assertThat(outcome.healed()).isFalse();
        assertThat(outcome.handle()).isNull();
        assertThat(outcome.attempts()).singleElement()
                .satisfies(a -> assertThat(a.summary()).contains("healing[strategy-1] FAILED no candidate"));
        assertThat(verified).isEmpty();
        assertThat(registry.cached("login.submit")).isEmpty();
    }

    @Test(description = "The cache can be invalidated per chain or cleared wholesale")
    public void testCacheInvalidation() {
        page.present(StrategyKind.CSS, "#a");
        registry.registerStrategy((p, hint) -> Optional.of(LocatorCandidate.of(StrategyKind.CSS, "#a")));
        LocatorChain other = LocatorChain.builder("other").css("#other").build();
        registry.heal(chain, "Sign in", page, this::verify);
        registry.heal(other, "Other", page, this::verify);

        registry.invalidate("login.submit");
        assertThat(registry.cached("login.submit")).isEmpty();
        assertThat(registry.cached("other")).isPresent();

        registry.clear();
        assertThat(registry.cached("other")).isEmpty();
    }

    @Test(description = "Built-in registry holds the attribute and text strategies in that order")
    public void testBuiltInStrategies() {
        SelfHealingRegistry builtIn = SelfHealingRegistry.withBuiltInStrategies();

        assertThat(builtIn.hasStrategies()).isTrue();
        assertThat(builtIn.strategyNames()).containsExactly("attribute-hint", "text-hint");
        assertThat(new SelfHealingRegistry().hasStrategies()).isFalse();
    }
}
