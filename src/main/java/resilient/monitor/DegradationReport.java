package resilient.monitor;

import java.time.Instant;

/**
 * Snapshot line of {@link FailureMonitor#report()} for one degraded chain.
 *
 * @param chainId      chain identity
 * @param failureCount failures currently inside the window
 * @param firstFailure oldest failure still inside the window
 * @param lastFailure  most recent failure
 * @param lastMessage  detail of the most recent failure
 */
public record DegradationReport(String chainId, int failureCount, Instant firstFailure,
                                Instant lastFailure, String lastMessage) { }
