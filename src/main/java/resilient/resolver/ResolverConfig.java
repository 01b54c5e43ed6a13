package resilient.resolver;

import resilient.retry.RetryPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Reads {@code resilient.properties} from the classpath and exposes typed resolver
 * configuration values with defaults.
 *
 * <p>All values can be overridden by placing a {@code resilient.local.properties}
 * file on the classpath (higher priority, not committed to VCS). Missing, malformed or
 * out-of-range values fall back to the default with a WARN.
 */
public class ResolverConfig {

    private static final Logger log = LoggerFactory.getLogger(ResolverConfig.class);

    private static final String CONFIG_FILE       = "resilient.properties";
    private static final String CONFIG_LOCAL_FILE = "resilient.local.properties";

    // Property keys
    static final String KEY_CANDIDATE_TIMEOUT = "locator.per.candidate.timeout.ms";
    static final String KEY_POLL_INTERVAL     = "locator.poll.interval.ms";
    static final String KEY_RETRY_ATTEMPTS    = "retry.max.attempts";
    static final String KEY_RETRY_INITIAL     = "retry.backoff.initial.ms";
    static final String KEY_RETRY_MULTIPLIER  = "retry.backoff.multiplier";
    static final String KEY_RETRY_MAX         = "retry.backoff.max.ms";
    static final String KEY_RETRY_JITTER      = "retry.backoff.jitter";
    static final String KEY_FAILURE_WINDOW    = "monitor.failure.window.sec";
    static final String KEY_FAILURE_THRESHOLD = "monitor.failure.threshold";
    static final String KEY_DECAY_FACTOR      = "ordering.decay.factor";
    static final String KEY_LATENCY_WEIGHT    = "ordering.latency.weight";
    static final String KEY_MIN_SAMPLES       = "ordering.min.samples";
    static final String KEY_PRE_DELAY         = "action.pre.delay.ms";
    static final String KEY_POST_DELAY        = "action.post.delay.ms";
    static final String KEY_HEALING_ENABLED   = "healing.enabled";
    static final String KEY_EVIDENCE_DIR      = "evidence.dir";

    // Defaults
    private static final long    DEFAULT_CANDIDATE_TIMEOUT = 3000L;
    private static final long    DEFAULT_POLL_INTERVAL     = 100L;
    private static final int     DEFAULT_RETRY_ATTEMPTS    = 3;
    private static final long    DEFAULT_RETRY_INITIAL     = 500L;
    private static final double  DEFAULT_RETRY_MULTIPLIER  = 2.0;
    private static final long    DEFAULT_RETRY_MAX         = 5000L;
    private static final double  DEFAULT_RETRY_JITTER      = 0.0;
    private static final long    DEFAULT_FAILURE_WINDOW    = 60L;
    private static final int     DEFAULT_FAILURE_THRESHOLD = 5;
    private static final double  DEFAULT_DECAY_FACTOR      = 0.8;
    private static final double  DEFAULT_LATENCY_WEIGHT    = 0.2;
    private static final int     DEFAULT_MIN_SAMPLES       = 1;
    private static final long    DEFAULT_PRE_DELAY         = 0L;
    private static final long    DEFAULT_POST_DELAY        = 0L;
    private static final boolean DEFAULT_HEALING_ENABLED   = true;
    private static final String  DEFAULT_EVIDENCE_DIR      = "evidence";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code resilient.local.properties} values override {@code resilient.properties}.
     *
     * @throws IllegalStateException if the base resilient.properties cannot be loaded
     */
    public ResolverConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} - using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** Test constructor: accepts an already-populated {@link Properties} instance. */
    ResolverConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Time budget for each candidate, lookup plus visibility (default: 3000 ms). */
    public Duration getPerCandidateTimeout() {
        return Duration.ofMillis(getLong(KEY_CANDIDATE_TIMEOUT, DEFAULT_CANDIDATE_TIMEOUT, 0L));
    }

    /** Interval between lookups while a candidate has not appeared yet (default: 100 ms). */
    public Duration getPollInterval() {
        return Duration.ofMillis(getLong(KEY_POLL_INTERVAL, DEFAULT_POLL_INTERVAL, 1L));
    }

    public int getRetryMaxAttempts() {
        return getInt(KEY_RETRY_ATTEMPTS, DEFAULT_RETRY_ATTEMPTS, 1);
    }

    public Duration getRetryInitialDelay() {
        return Duration.ofMillis(getLong(KEY_RETRY_INITIAL, DEFAULT_RETRY_INITIAL, 0L));
    }

    public double getRetryMultiplier() {
        return getDouble(KEY_RETRY_MULTIPLIER, DEFAULT_RETRY_MULTIPLIER, 1.0, Double.MAX_VALUE);
    }

    public Duration getRetryMaxDelay() {
        return Duration.ofMillis(getLong(KEY_RETRY_MAX, DEFAULT_RETRY_MAX, 0L));
    }

    public double getRetryJitter() {
        return getDouble(KEY_RETRY_JITTER, DEFAULT_RETRY_JITTER, 0.0, 1.0);
    }

    /**
     * Retry policy assembled from the {@code retry.*} keys. A max delay below the
     * initial delay is raised to the initial delay.
     */
    public RetryPolicy retryPolicy() {
        Duration initial = getRetryInitialDelay();
        Duration max = getRetryMaxDelay();
        if (max.compareTo(initial) < 0) {
            log.warn("'{}' ({} ms) is below '{}' ({} ms) - using {} ms",
                    KEY_RETRY_MAX, max.toMillis(), KEY_RETRY_INITIAL, initial.toMillis(), initial.toMillis());
            max = initial;
        }
        return RetryPolicy.builder()
                .maxAttempts(getRetryMaxAttempts())
                .initialDelay(initial)
                .multiplier(getRetryMultiplier())
                .maxDelay(max)
                .jitter(getRetryJitter())
                .build();
    }

    /** Sliding window of the failure monitor (default: 60 s). */
    public Duration getFailureWindow() {
        return Duration.ofSeconds(getLong(KEY_FAILURE_WINDOW, DEFAULT_FAILURE_WINDOW, 1L));
    }

    /** Failures within the window that mark a chain degraded (default: 5). */
    public int getFailureThreshold() {
        return getInt(KEY_FAILURE_THRESHOLD, DEFAULT_FAILURE_THRESHOLD, 1);
    }

    /** Per-observation decay of the recency-weighted success rate, in (0, 1] (default: 0.8). */
    public double getDecayFactor() {
        double value = getDouble(KEY_DECAY_FACTOR, DEFAULT_DECAY_FACTOR, 0.0, 1.0);
        if (value == 0.0) {
            log.warn("'{}' must be above 0 - using default {}", KEY_DECAY_FACTOR, DEFAULT_DECAY_FACTOR);
            return DEFAULT_DECAY_FACTOR;
        }
        return value;
    }

    /** Weight of normalized latency in the ordering score (default: 0.2). */
    public double getLatencyWeight() {
        return getDouble(KEY_LATENCY_WEIGHT, DEFAULT_LATENCY_WEIGHT, 0.0, Double.MAX_VALUE);
    }

    /** Observations a candidate needs before it leaves its declared slot (default: 1). */
    public int getMinSamples() {
        return getInt(KEY_MIN_SAMPLES, DEFAULT_MIN_SAMPLES, 1);
    }

    public Duration getPreActionDelay() {
        return Duration.ofMillis(getLong(KEY_PRE_DELAY, DEFAULT_PRE_DELAY, 0L));
    }

    public Duration getPostActionDelay() {
        return Duration.ofMillis(getLong(KEY_POST_DELAY, DEFAULT_POST_DELAY, 0L));
    }

    /** Whether exhausted chains are handed to the self-healing registry (default: true). */
    public boolean isHealingEnabled() {
        return getBool(KEY_HEALING_ENABLED, DEFAULT_HEALING_ENABLED);
    }

    /** Directory where failure evidence is written (default: "evidence"). */
    public String getEvidenceDir() {
        String raw = props.getProperty(KEY_EVIDENCE_DIR);
        return raw == null || raw.isBlank() ? DEFAULT_EVIDENCE_DIR : raw.trim();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue, int min) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min) {
                log.warn("Value for key '{}' must be >= {}: '{}' - using default {}", key, min, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}' - using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue, long min) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min) {
                log.warn("Value for key '{}' must be >= {}: '{}' - using default {}", key, min, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}' - using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue, double min, double max) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || value < min || value > max) {
                log.warn("Value for key '{}' is out of range: '{}' - using default {}", key, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}' - using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
