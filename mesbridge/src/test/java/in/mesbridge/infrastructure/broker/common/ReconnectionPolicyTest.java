package in.mesbridge.infrastructure.broker.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Linear backoff calculations
 * - Exhaustion after max attempts
 * - Reset on success
 * - Builder validation
 */
class ReconnectionPolicyTest {

    @Test
    void testInitialState() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(5))
            .increment(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(60))
            .maxAttempts(10)
            .build();

        assertTrue(policy.shouldRetry(), "Should allow initial attempt");
        assertEquals(0, policy.getAttemptCount(), "Initial attempt count should be 0");
        assertFalse(policy.isExhausted(), "Policy should not be exhausted initially");
        assertNull(policy.getLastAttemptTime(), "No attempts made yet");
        assertEquals(Duration.ZERO, policy.getNextDelay(), "First attempt should be immediate");
    }

    @Test
    void testLinearBackoff() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(5))
            .increment(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(60))
            .maxAttempts(20)
            .build();

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(5), policy.getNextDelay(), "After 1 failure delay should be 5s");

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(10), policy.getNextDelay(), "After 2 failures delay should be 10s");

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(15), policy.getNextDelay(), "After 3 failures delay should be 15s");
    }

    @Test
    void testMaxDelayRespected() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(5))
            .increment(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(60))
            .maxAttempts(50)
            .build();

        for (int i = 0; i < 12; i++) {
            policy.recordFailure();
        }
        assertEquals(Duration.ofSeconds(60), policy.getNextDelay(), "12 failures hit the 60s cap exactly");

        for (int i = 0; i < 10; i++) {
            policy.recordFailure();
        }
        assertEquals(Duration.ofSeconds(60), policy.getNextDelay(), "Delay stays capped");
    }

    @Test
    void testZeroIncrementKeepsDelayConstant() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(200))
            .increment(Duration.ZERO)
            .maxDelay(Duration.ofSeconds(1))
            .maxAttempts(5)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        policy.recordFailure();
        assertEquals(Duration.ofMillis(200), policy.getNextDelay());
    }

    @Test
    void testExhaustedAfterMaxAttempts() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .increment(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(5))
            .maxAttempts(3)
            .build();

        policy.recordFailure();
        assertTrue(policy.shouldRetry(), "Should still retry (1/3)");

        policy.recordFailure();
        assertTrue(policy.shouldRetry(), "Should still retry (2/3)");
        assertFalse(policy.isExhausted());

        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "Should NOT retry after max attempts");
        assertTrue(policy.isExhausted(), "Policy should be exhausted");
        assertEquals(3, policy.getMaxAttempts());
    }

    @Test
    void testSuccessResetsPolicy() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .increment(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(1))
            .maxAttempts(2)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        assertTrue(policy.isExhausted());

        policy.recordSuccess();
        assertEquals(0, policy.getAttemptCount(), "Attempt count should reset");
        assertEquals(Duration.ZERO, policy.getNextDelay(), "Delay should reset to immediate");
        assertFalse(policy.isExhausted(), "Policy should allow retries again");
        assertNull(policy.getLastAttemptTime(), "Last attempt time should be cleared");
    }

    @Test
    void testLastAttemptTimeTracking() {
        ReconnectionPolicy policy = ReconnectionPolicy.forIronbeam();

        assertNull(policy.getLastAttemptTime(), "No attempts yet");
        policy.recordFailure();
        assertNotNull(policy.getLastAttemptTime(), "Last attempt time should be set");
    }

    @Test
    void testIronbeamDefaults() {
        ReconnectionPolicy policy = ReconnectionPolicy.forIronbeam();

        assertEquals(10, policy.getMaxAttempts());
        policy.recordFailure();
        assertEquals(Duration.ofSeconds(5), policy.getNextDelay());

        for (int i = 0; i < 8; i++) {
            policy.recordFailure();
        }
        assertEquals(Duration.ofSeconds(45), policy.getNextDelay(), "9 failures: 5 + 8 * 5");
        assertTrue(policy.shouldRetry());

        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "10 failures exhaust the default budget");
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().initialDelay(Duration.ZERO).build(),
            "Should reject zero initial delay");

        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().increment(Duration.ofSeconds(-1)).build(),
            "Should reject negative increment");

        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().maxAttempts(0).build(),
            "Should reject zero max attempts");

        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder()
                .initialDelay(Duration.ofMinutes(2))
                .maxDelay(Duration.ofMinutes(1))
                .build(),
            "Should reject initial delay above max delay");
    }
}
