package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.model.TenantSession;
import com.tango.stream.raffle.util.TestClock;
import org.junit.jupiter.api.Test;
import org.springframework.core.env.StandardEnvironment;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LivenessDetectorImplTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final Duration WINDOW = Duration.ofMinutes(5);

    @Test
    void shouldNeedEnoughRecentChatters() {
        TenantSession session = new TenantSession("t1", NOW);
        session.recordChat("alice", NOW.minusSeconds(10));

        assertFalse(LivenessDetectorImpl.evaluate(session, NOW, WINDOW, 2));

        session.recordChat("bob", NOW.minusSeconds(20));

        assertTrue(LivenessDetectorImpl.evaluate(session, NOW, WINDOW, 2));
    }

    @Test
    void shouldIgnoreChattersOutsideWindow() {
        TenantSession session = new TenantSession("t1", NOW);
        session.recordChat("alice", NOW.minus(Duration.ofMinutes(6)));
        session.recordChat("bob", NOW.minusSeconds(5));

        assertFalse(LivenessDetectorImpl.evaluate(session, NOW, WINDOW, 2));
        assertTrue(LivenessDetectorImpl.evaluate(session, NOW, WINDOW, 1));
    }

    @Test
    void shouldGoOfflineWhenChatIsQuiet() {
        TenantSession session = new TenantSession("t1", NOW);
        session.recordChat("alice", NOW.minus(Duration.ofMinutes(10)));
        session.recordChat("bob", NOW.minus(Duration.ofMinutes(10)));

        assertFalse(LivenessDetectorImpl.evaluate(session, NOW, WINDOW, 1));
    }

    @Test
    void shouldHonorForceLive() {
        TenantSession session = new TenantSession("t1", NOW);
        session.setForceLive(true);

        assertTrue(LivenessDetectorImpl.evaluate(session, NOW, WINDOW, 5));
    }

    @Test
    void shouldUseConfiguredThresholds() {
        TenantSessionStoreImpl store = new TenantSessionStoreImpl(new TestClock(Clock.systemUTC()));
        ConfigurationService configurationService = new ConfigurationService(new StandardEnvironment(), "", 5000);
        LivenessDetectorImpl detector = new LivenessDetectorImpl(store, configurationService);
        store.recordChatActivity("t1", "alice", NOW.minusSeconds(30));

        assertEquals(Duration.ofSeconds(300), detector.getWindow());
        assertFalse(detector.isLive("t1", NOW));
        assertFalse(detector.isLive("t2", NOW));

        configurationService.update(configuration -> configuration.setProperty(LivenessDetectorImpl.LIVENESS_MIN_UNIQUE_CHATTERS.getKey(), 1));

        assertTrue(detector.isLive("t1", NOW));
    }
}
