package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.util.TestClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CooldownServiceImplTest {
    private final TestClock clock = new TestClock(Clock.systemUTC());
    private final CooldownServiceImpl cooldownService = new CooldownServiceImpl(clock);

    @Test
    void shouldBlockUntilCooldownPasses() {
        clock.setFixed(Instant.parse("2024-06-01T12:00:00Z"));

        assertTrue(cooldownService.allow("t1", "alice", 30));
        assertFalse(cooldownService.allow("t1", "alice", 30));

        clock.advance(Duration.ofSeconds(29));
        assertFalse(cooldownService.allow("t1", "alice", 30));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cooldownService.allow("t1", "alice", 30));
    }

    @Test
    void shouldTrackUsersAndTenantsSeparately() {
        clock.setFixed(Instant.parse("2024-06-01T12:00:00Z"));

        assertTrue(cooldownService.allow("t1", "alice", 30));
        assertTrue(cooldownService.allow("t1", "bob", 30));
        assertTrue(cooldownService.allow("t2", "alice", 30));
    }
}
