package me.golemcore.datapilot.adapter.outbound.provider;

import me.golemcore.datapilot.infrastructure.config.DataPilotProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void shouldMatchConfiguredPolicyByDefault() {
        RetryPolicy policy = new RetryPolicy(new DataPilotProperties().getRetry());

        assertEquals(4, policy.getMaxRetries());
        assertEquals(2_000, policy.backoffMs(0, -1));
        assertEquals(4_000, policy.backoffMs(1, -1));
        assertEquals(16_000, policy.backoffMs(3, -1));
        assertEquals(30_000, policy.backoffMs(4, -1));
    }

    @Test
    void shouldStopRetryingAtMaxRetries() {
        RetryPolicy policy = new RetryPolicy(2, 100, 2.0, 1_000);

        assertTrue(policy.canRetry(0));
        assertTrue(policy.canRetry(1));
        assertFalse(policy.canRetry(2));
    }

    @Test
    void shouldExtendBackoffWithinCapForResetHint() {
        RetryPolicy policy = new RetryPolicy(4, 2_000, 2.0, 30_000);

        assertEquals(6_000, policy.backoffMs(0, 5));
        assertEquals(8_000, policy.backoffMs(2, 1));
        assertEquals(30_000, policy.backoffMs(0, 120));
    }

    @Test
    void shouldClampNonsensicalSettings() {
        RetryPolicy policy = new RetryPolicy(-1, 500, 0.5, 10);

        assertEquals(0, policy.getMaxRetries());
        assertFalse(policy.canRetry(0));
        assertEquals(500, policy.backoffMs(3, -1));
    }
}
