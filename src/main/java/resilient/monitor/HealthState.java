package resilient.monitor;

/** Degradation state of a chain as seen by {@link FailureMonitor}. */
public enum HealthState {
    HEALTHY,
    DEGRADED
}
