package resilient.resolver;

import resilient.retry.RetryPolicy;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResolverConfig}.
 *
 * <p>Most tests use the {@code ResolverConfig(Properties)} constructor to avoid classpath
 * file I/O and allow precise value injection.
 */
public class ResolverConfigTest {

    // ── Default value tests ───────────────────────────────────────────────

    @Test(description = "All accessor methods return documented defaults when properties are empty")
    public void testAllDefaults() {
        ResolverConfig cfg = new ResolverConfig(new Properties());

        assertThat(cfg.getPerCandidateTimeout()).as("per-candidate timeout").isEqualTo(Duration.ofMillis(3000));
        assertThat(cfg.getPollInterval()).as("poll interval").isEqualTo(Duration.ofMillis(100));
        assertThat(cfg.getRetryMaxAttempts()).as("retry attempts").isEqualTo(3);
        assertThat(cfg.getRetryInitialDelay()).as("retry initial delay").isEqualTo(Duration.ofMillis(500));
        assertThat(cfg.getRetryMultiplier()).as("retry multiplier").isEqualTo(2.0);
        assertThat(cfg.getRetryMaxDelay()).as("retry max delay").isEqualTo(Duration.ofMillis(5000));
        assertThat(cfg.getRetryJitter()).as("retry jitter").isZero();
        assertThat(cfg.getFailureWindow()).as("failure window").isEqualTo(Duration.ofSeconds(60));
        assertThat(cfg.getFailureThreshold()).as("failure threshold").isEqualTo(5);
        assertThat(cfg.getDecayFactor()).as("decay factor").isEqualTo(0.8);
        assertThat(cfg.getLatencyWeight()).as("latency weight").isEqualTo(0.2);
        assertThat(cfg.getMinSamples()).as("min samples").isEqualTo(1);
        assertThat(cfg.getPreActionDelay()).as("pre delay").isZero();
        assertThat(cfg.getPostActionDelay()).as("post delay").isZero();
        assertThat(cfg.isHealingEnabled()).as("healing enabled").isTrue();
        assertThat(cfg.getEvidenceDir()).as("evidence dir").isEqualTo("evidence");
    }

    @Test(description = "The classpath resilient.properties loads and matches the defaults")
    public void testClasspathConfig() {
        ResolverConfig cfg = new ResolverConfig();

        assertThat(cfg.getPerCandidateTimeout()).isEqualTo(Duration.ofMillis(3000));
        assertThat(cfg.getFailureThreshold()).isEqualTo(5);
        assertThat(cfg.isHealingEnabled()).isTrue();
    }

    // ── Override tests ────────────────────────────────────────────────────

    @Test(description = "Values are read from properties")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty(ResolverConfig.KEY_CANDIDATE_TIMEOUT, "1500");
        p.setProperty(ResolverConfig.KEY_FAILURE_WINDOW, "30");
        p.setProperty(ResolverConfig.KEY_FAILURE_THRESHOLD, "2");
        p.setProperty(ResolverConfig.KEY_DECAY_FACTOR, "0.5");
        p.setProperty(ResolverConfig.KEY_HEALING_ENABLED, "false");
        p.setProperty(ResolverConfig.KEY_EVIDENCE_DIR, "  target/evidence  ");
        p.setProperty(ResolverConfig.KEY_PRE_DELAY, "150");

        ResolverConfig cfg = new ResolverConfig(p);

        assertThat(cfg.getPerCandidateTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(cfg.getFailureWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.getFailureThreshold()).isEqualTo(2);
        assertThat(cfg.getDecayFactor()).isEqualTo(0.5);
        assertThat(cfg.isHealingEnabled()).isFalse();
        assertThat(cfg.getEvidenceDir()).isEqualTo("target/evidence");
        assertThat(cfg.getPreActionDelay()).isEqualTo(Duration.ofMillis(150));
    }

    @Test(description = "Malformed and out-of-range values fall back to defaults")
    public void testInvalidValuesFallBack() {
        Properties p = new Properties();
        p.setProperty(ResolverConfig.KEY_CANDIDATE_TIMEOUT, "soon");
        p.setProperty(ResolverConfig.KEY_POLL_INTERVAL, "0");
        p.setProperty(ResolverConfig.KEY_RETRY_ATTEMPTS, "-2");
        p.setProperty(ResolverConfig.KEY_RETRY_JITTER, "1.5");
        p.setProperty(ResolverConfig.KEY_DECAY_FACTOR, "0");
        p.setProperty(ResolverConfig.KEY_LATENCY_WEIGHT, "NaN");

        ResolverConfig cfg = new ResolverConfig(p);

        assertThat(cfg.getPerCandidateTimeout()).isEqualTo(Duration.ofMillis(3000));
        assertThat(cfg.getPollInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(cfg.getRetryMaxAttempts()).isEqualTo(3);
        assertThat(cfg.getRetryJitter()).isZero();
        assertThat(cfg.getDecayFactor()).isEqualTo(0.8);
        assertThat(cfg.getLatencyWeight()).isEqualTo(0.2);
    }

    @Test(description = "Retry policy is assembled from the retry keys")
    public void testRetryPolicy() {
        Properties p = new Properties();
        p.setProperty(ResolverConfig.KEY_RETRY_ATTEMPTS, "4");
        p.setProperty(ResolverConfig.KEY_RETRY_INITIAL, "250");
        p.setProperty(ResolverConfig.KEY_RETRY_MULTIPLIER, "3");
        p.setProperty(ResolverConfig.KEY_RETRY_MAX, "2000");

        RetryPolicy policy = new ResolverConfig(p).retryPolicy();

        assertThat(policy.maxAttempts()).isEqualTo(4);
        assertThat(policy.baseDelay(0)).isEqualTo(Duration.ofMillis(250));
        assertThat(policy.baseDelay(1)).isEqualTo(Duration.ofMillis(750));
        assertThat(policy.baseDelay(2)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test(description = "A max delay below the initial delay is raised instead of failing")
    public void testInconsistentBackoffRepaired() {
        Properties p = new Properties();
        p.setProperty(ResolverConfig.KEY_RETRY_INITIAL, "800");
        p.setProperty(ResolverConfig.KEY_RETRY_MAX, "200");

        RetryPolicy policy = new ResolverConfig(p).retryPolicy();

        assertThat(policy.maxDelay()).isEqualTo(Duration.ofMillis(800));
    }
}
