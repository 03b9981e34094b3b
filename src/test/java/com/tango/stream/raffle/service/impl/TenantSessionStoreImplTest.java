package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.model.TenantSession;
import com.tango.stream.raffle.util.TestClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TenantSessionStoreImplTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final TestClock clock = new TestClock(Clock.systemUTC());
    private final TenantSessionStoreImpl store = new TenantSessionStoreImpl(clock);

    @Test
    void shouldKeepSessionsApart() {
        store.recordChatActivity("t1", "alice", NOW);
        store.recordChatActivity("t2", "bob", NOW);

        assertEquals(2, store.activeTenants().size());
        assertEquals(1, store.getSession("t1").map(session -> session.getActiveViewers().size()).orElse(0));
        assertTrue(store.getSession("t1").map(session -> session.getActiveViewers().containsKey("alice")).orElse(false));
        assertFalse(store.getSession("t1").map(session -> session.getActiveViewers().containsKey("bob")).orElse(true));
    }

    @Test
    void shouldReturnSameSessionOnReopen() {
        clock.setFixed(NOW);
        TenantSession first = store.openSession("t1");
        store.recordChatActivity("t1", "alice", NOW);

        TenantSession second = store.openSession("t1");

        assertSame(first, second);
        assertEquals(NOW, second.getOpenedAt());
        assertEquals(1, second.getRecentChatters().size());
    }

    @Test
    void shouldKeepLatestActivity() {
        store.recordChatActivity("t1", "alice", NOW);
        store.recordChatActivity("t1", "alice", NOW.minusSeconds(30));

        TenantSession session = store.getSession("t1").orElseThrow(AssertionError::new);
        assertEquals(NOW, session.getActiveViewers().get("alice"));
        assertEquals(NOW, session.getLastActivityAt());
    }

    @Test
    void shouldPruneEntriesOlderThanTwoWindows() {
        Duration window = Duration.ofMinutes(5);
        store.recordChatActivity("t1", "old", NOW.minus(Duration.ofMinutes(11)));
        store.recordChatActivity("t1", "recent", NOW.minus(Duration.ofMinutes(9)));

        int evicted = store.prune("t1", NOW, window);

        assertEquals(2, evicted);
        TenantSession session = store.getSession("t1").orElseThrow(AssertionError::new);
        assertEquals(1, session.getActiveViewers().size());
        assertTrue(session.getActiveViewers().containsKey("recent"));
        assertEquals(0, store.prune("unknown", NOW, window));
    }

    @Test
    void shouldDiscardSession() {
        store.recordChatActivity("t1", "alice", NOW);
        store.setForceLive("t1", true);

        store.discard("t1");

        assertFalse(store.getSession("t1").isPresent());
        assertTrue(store.activeTenants().isEmpty());
        assertFalse(store.openSession("t1").isForceLive());
    }
}
