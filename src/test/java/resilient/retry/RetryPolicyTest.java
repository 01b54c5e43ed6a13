package resilient.retry;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetryPolicy}.
 */
public class RetryPolicyTest {

    @Test(description = "Defaults: 3 attempts, 500 ms doubling, capped at 5 s, no jitter")
    public void testDefaults() {
        RetryPolicy p = RetryPolicy.DEFAULT;

        assertThat(p.maxAttempts()).isEqualTo(3);
        assertThat(p.initialDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(p.multiplier()).isEqualTo(2.0);
        assertThat(p.maxDelay()).isEqualTo(Duration.ofMillis(5000));
        assertThat(p.jitter()).isZero();
    }

    @Test(description = "Base delay grows geometrically and is capped at maxDelay")
    public void testBaseDelayFormula() {
        RetryPolicy p = RetryPolicy.builder()
                .initialDelay(Duration.ofMillis(100))
                .multiplier(3.0)
                .maxDelay(Duration.ofMillis(1000))
                .build();

        assertThat(p.baseDelay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(p.baseDelay(1)).isEqualTo(Duration.ofMillis(300));
        assertThat(p.baseDelay(2)).isEqualTo(Duration.ofMillis(900));
        assertThat(p.baseDelay(3)).isEqualTo(Duration.ofMillis(1000));
        assertThat(p.baseDelay(10)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test(description = "Jittered delays stay within the symmetric band and never exceed maxDelay")
    public void testJitterBounds() {
        RetryPolicy p = RetryPolicy.builder()
                .initialDelay(Duration.ofMillis(1000))
                .maxDelay(Duration.ofMillis(1500))
                .jitter(0.25)
                .build();
        Random random = new Random(42);

        for (int i = 0; i < 200; i++) {
            long first = p.delayFor(0, random).toMillis();
            assertThat(first).isBetween(750L, 1250L);
            long capped = p.delayFor(1, random).toMillis();
            assertThat(capped).isBetween(1125L, 1500L);
        }
    }

    @Test(description = "Invalid settings are rejected by the builder")
    public void testValidation() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().multiplier(0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().jitter(1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().initialDelay(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder()
                .initialDelay(Duration.ofSeconds(2)).maxDelay(Duration.ofSeconds(1)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDelay");
    }

    @Test(description = "toBuilder copies every setting")
    public void testToBuilder() {
        RetryPolicy original = RetryPolicy.builder().maxAttempts(5).jitter(0.1).build();

        RetryPolicy copy = original.toBuilder().build();

        assertThat(copy.toString()).isEqualTo(original.toString());
    }
}
