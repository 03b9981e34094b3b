package com.tango.stream.raffle.ingest;

import com.tango.stream.raffle.service.impl.ConfigurationService;
import org.junit.jupiter.api.Test;
import org.springframework.core.env.StandardEnvironment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffPolicyTest {

    @Test
    void shouldGrowExponentiallyUpToCap() {
        assertEquals(1000, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0, 1, 0.5));
        assertEquals(2000, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0, 2, 0.5));
        assertEquals(16000, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0, 5, 0.5));
        assertEquals(60000, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0, 7, 0.5));
        assertEquals(60000, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0, 500, 0.5));
    }

    @Test
    void shouldApplySymmetricJitter() {
        assertEquals(800, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0.2, 1, -1.0));
        assertEquals(1000, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0.2, 1, 0.0));
        assertEquals(1100, BackoffPolicy.computeDelayMs(1000, 2.0, 60000, 0.2, 1, 0.5));
    }

    @Test
    void shouldStayWithinJitterBounds() {
        ConfigurationService configurationService = new ConfigurationService(new StandardEnvironment(), "", 5000);
        BackoffPolicy policy = new BackoffPolicy(configurationService);

        for (int attempt = 1; attempt <= 10; attempt++) {
            long capped = Math.min(1000L << (attempt - 1), 60000L);
            long delay = policy.delayMs(attempt);
            assertTrue(delay >= capped * 0.8 - 1 && delay <= capped * 1.2, "attempt " + attempt + " delay " + delay);
        }
    }

    @Test
    void shouldFollowReloadedSettings() {
        ConfigurationService configurationService = new ConfigurationService(new StandardEnvironment(), "", 5000);
        BackoffPolicy policy = new BackoffPolicy(configurationService);
        configurationService.update(configuration -> {
            configuration.setProperty(BackoffPolicy.INITIAL_DELAY_MS.getKey(), 50L);
            configuration.setProperty(BackoffPolicy.JITTER.getKey(), 0.0);
        });

        assertEquals(50, policy.delayMs(1));
        assertEquals(100, policy.delayMs(2));
    }
}
