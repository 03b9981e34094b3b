package com.tango.stream.raffle.service.impl;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.tango.stream.raffle.service.CooldownService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class CooldownServiceImpl implements CooldownService {
    private final Cache<String, Instant> lastAllowed;
    private final Clock clock;

    @Autowired
    public CooldownServiceImpl(Clock clock) {
        this.clock = clock;
        this.lastAllowed = CacheBuilder.newBuilder()
                .expireAfterWrite(Duration.ofHours(6L))
                .build();
    }

    @Override
    public boolean allow(@Nonnull String tenantId, @Nonnull String userKey, long cooldownSeconds) {
        Instant now = clock.instant();
        AtomicBoolean allowed = new AtomicBoolean();
        lastAllowed.asMap().compute(tenantId + ":" + userKey, (key, previous) -> {
            if (previous == null || !now.isBefore(previous.plusSeconds(cooldownSeconds))) {
                allowed.set(true);
                return now;
            }
            return previous;
        });
        return allowed.get();
    }
}
