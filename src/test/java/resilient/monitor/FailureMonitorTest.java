package resilient.monitor;

import resilient.model.AttemptOutcome;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FailureMonitor} driven by a {@link MutableClock}.
 */
public class FailureMonitorTest {

    private MutableClock clock;
    private FailureMonitor monitor;
    private ListAppender<ILoggingEvent> appender;
    private Logger monitorLogger;

    @BeforeMethod
    public void setUp() {
        clock = MutableClock.atEpoch();
        monitor = new FailureMonitor(Duration.ofSeconds(60), 3, clock);

        monitorLogger = (Logger) LoggerFactory.getLogger(FailureMonitor.class);
        appender = new ListAppender<>();
        appender.start();
        monitorLogger.addAppender(appender);
    }

    @AfterMethod
    public void tearDown() {
        monitorLogger.detachAppender(appender);
    }

    private void fail(String chainId, int times) {
        for (int i = 0; i < times; i++) {
            monitor.recordFailure(chainId, AttemptOutcome.NOT_FOUND, "no match", clock.instant());
            clock.advance(Duration.ofSeconds(1));
        }
    }

    @Test(description = "An unknown chain is healthy")
    public void testUnknownChainHealthy() {
        assertThat(monitor.isDegraded("never.seen")).isFalse();
        assertThat(monitor.state("never.seen")).isEqualTo(HealthState.HEALTHY);
        assertThat(monitor.failures("never.seen")).isEmpty();
    }

    @Test(description = "Reaching the threshold inside the window marks the chain degraded")
    public void testThresholdDegrades() {
        fail("search.submit", 2);
        assertThat(monitor.isDegraded("search.submit")).isFalse();

        fail("search.submit", 1);
        assertThat(monitor.isDegraded("search.submit")).isTrue();
        assertThat(monitor.state("search.submit")).isEqualTo(HealthState.DEGRADED);
    }

    @Test(description = "A degraded chain becomes healthy once its failures age out, with no new failures")
    public void testRecoveryAfterWindow() {
        fail("search.submit", 3);
        assertThat(monitor.isDegraded("search.submit")).isTrue();

        clock.advance(Duration.ofSeconds(58));
        assertThat(monitor.isDegraded("search.submit")).isFalse();
        assertThat(monitor.failures("search.submit")).hasSize(1);

        clock.advance(Duration.ofSeconds(10));
        assertThat(monitor.failures("search.submit")).isEmpty();
    }

    @Test(description = "Failures spread wider than the window never degrade the chain")
    public void testSpreadFailuresStayHealthy() {
        for (int i = 0; i < 5; i++) {
            monitor.recordFailure("cart.total", "slow", clock.instant());
            clock.advance(Duration.ofSeconds(31));
        }

        assertThat(monitor.isDegraded("cart.total")).isFalse();
    }

    @Test(description = "Transitions are logged: WARN alert on degradation, INFO on recovery")
    public void testTransitionsLogged() {
        fail("login.button", 3);
        clock.advance(Duration.ofSeconds(120));
        monitor.isDegraded("login.button");

        assertThat(appender.list).anySatisfy(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.WARN);
            assertThat(e.getFormattedMessage()).startsWith("ALERT: 'login.button' failed 3 times");
        });
        assertThat(appender.list).anySatisfy(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.INFO);
            assertThat(e.getFormattedMessage()).contains("recovered");
        });
    }

    @Test(description = "Report lists only degraded chains, most failures first")
    public void testReportSorted() {
        Instant t = clock.instant();
        for (int i = 0; i < 4; i++) {
            monitor.recordFailure("a.busy", "x" + i, t);
        }
        for (int i = 0; i < 3; i++) {
            monitor.recordFailure("b.calm", "y" + i, t);
        }
        monitor.recordFailure("c.fine", "z", t);

        assertThat(monitor.report()).extracting(DegradationReport::chainId).containsExactly("a.busy", "b.calm");
        DegradationReport top = monitor.report().get(0);
        assertThat(top.failureCount()).isEqualTo(4);
        assertThat(top.firstFailure()).isEqualTo(t);
        assertThat(top.lastMessage()).isEqualTo("x3");
    }

    @Test(description = "Out-of-order timestamps are kept in time order")
    public void testOutOfOrderTimestamps() {
        Instant t = clock.instant();
        monitor.recordFailure("grid", "late", t.plusSeconds(5));
        monitor.recordFailure("grid", "early", t);

        assertThat(monitor.failures("grid")).extracting(FailureRecord::message).containsExactly("early", "late");
    }

    @Test(description = "reset clears one chain or all chains")
    public void testReset() {
        fail("a", 3);
        fail("b", 3);

        monitor.reset("a");
        assertThat(monitor.isDegraded("a")).isFalse();
        assertThat(monitor.isDegraded("b")).isTrue();

        monitor.reset();
        assertThat(monitor.report()).isEmpty();
    }

    @Test(description = "Window and threshold are validated")
    public void testValidation() {
        assertThatThrownBy(() -> new FailureMonitor(Duration.ZERO, 3, clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FailureMonitor(Duration.ofSeconds(10), 0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
