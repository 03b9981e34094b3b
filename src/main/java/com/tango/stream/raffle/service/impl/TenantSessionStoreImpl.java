package com.tango.stream.raffle.service.impl;

import com.google.common.collect.ImmutableSet;
import com.tango.stream.raffle.model.TenantSession;
import com.tango.stream.raffle.service.TenantSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Slf4j
@Service
public class TenantSessionStoreImpl implements TenantSessionStore {
    private final ConcurrentMap<String, TenantSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public TenantSessionStoreImpl(Clock clock) {
        this.clock = clock;
    }

    @Nonnull
    @Override
    public TenantSession openSession(@Nonnull String tenantId) {
        return sessions.computeIfAbsent(tenantId, id -> {
            log.info("openSession(): new session for tenant {}", id);
            return new TenantSession(id, clock.instant());
        });
    }

    @Nonnull
    @Override
    public Optional<TenantSession> getSession(@Nonnull String tenantId) {
        return Optional.ofNullable(sessions.get(tenantId));
    }

    @Override
    public void discard(@Nonnull String tenantId) {
        if (sessions.remove(tenantId) != null) {
            log.info("discard(): session of tenant {} discarded", tenantId);
        }
    }

    @Override
    public void recordChatActivity(@Nonnull String tenantId, @Nonnull String userKey, @Nonnull Instant at) {
        openSession(tenantId).recordChat(userKey, at);
    }

    @Override
    public void setForceLive(@Nonnull String tenantId, boolean forceLive) {
        openSession(tenantId).setForceLive(forceLive);
        log.info("setForceLive(): tenant {} force live {}", tenantId, forceLive);
    }

    @Override
    public int prune(@Nonnull String tenantId, @Nonnull Instant now, @Nonnull Duration window) {
        TenantSession session = sessions.get(tenantId);
        if (session == null) {
            return 0;
        }
        int evicted = session.evictOlderThan(now.minus(window.multipliedBy(2)));
        if (evicted > 0) {
            log.debug("prune(): evicted {} entries of tenant {}", evicted, tenantId);
        }
        return evicted;
    }

    @Nonnull
    @Override
    public Set<String> activeTenants() {
        return ImmutableSet.copyOf(sessions.keySet());
    }
}
