package in.nextopen.infrastructure.broker.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BackoffPolicy.
 */
class BackoffPolicyTest {

    @Test
    void testDefaultsMatchGatewayDefaults() {
        BackoffPolicy policy = BackoffPolicy.builder().build();

        assertEquals(Duration.ofSeconds(2), policy.getNextDelay());
        assertEquals(8, policy.getMaxAttempts());
        assertEquals(0, policy.getAttemptCount());
        assertTrue(policy.shouldRetry());
    }

    @Test
    void testExponentialBackoffCapped() {
        BackoffPolicy policy = BackoffPolicy.builder()
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(60))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();

        long[] expected = {2, 4, 8, 16, 32, 60, 60};
        for (long seconds : expected) {
            assertEquals(Duration.ofSeconds(seconds), policy.getNextDelay());
            policy.recordFailure();
        }
    }

    @Test
    void testStopsAfterMaxAttempts() {
        BackoffPolicy policy = BackoffPolicy.builder()
            .initialDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(100))
            .maxAttempts(3)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        assertTrue(policy.shouldRetry(), "Two failures of three allowed");

        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "Third failure exhausts the budget");
        assertEquals(3, policy.getAttemptCount());
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.builder()
                .initialDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(5))
                .build());
    }
}
