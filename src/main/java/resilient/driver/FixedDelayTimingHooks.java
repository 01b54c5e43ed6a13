package resilient.driver;

import resilient.retry.Sleeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * {@link TimingHooks} that sleep a fixed time before and after each action.
 * An interrupt cuts the delay short and is preserved on the thread.
 */
public class FixedDelayTimingHooks implements TimingHooks {

    private static final Logger log = LoggerFactory.getLogger(FixedDelayTimingHooks.class);

    private final Duration preDelay;
    private final Duration postDelay;
    private final Sleeper sleeper;

    public FixedDelayTimingHooks(Duration preDelay, Duration postDelay) {
        this(preDelay, postDelay, Sleeper.SYSTEM);
    }

    public FixedDelayTimingHooks(Duration preDelay, Duration postDelay, Sleeper sleeper) {
        this.preDelay  = preDelay;
        this.postDelay = postDelay;
        this.sleeper   = sleeper;
    }

    @Override
    public void preActionDelay() {
        pause(preDelay);
    }

    @Override
    public void postActionDelay() {
        pause(postDelay);
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Action delay interrupted after less than {} ms", delay.toMillis());
        }
    }
}
