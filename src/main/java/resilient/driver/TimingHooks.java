package resilient.driver;

/**
 * Delays run around every interaction. Both default to zero.
 */
public interface TimingHooks {

    /** Hooks that never delay. */
    TimingHooks NONE = new TimingHooks() { };

    default void preActionDelay() { }

    default void postActionDelay() { }
}
