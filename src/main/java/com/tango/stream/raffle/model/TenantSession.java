package com.tango.stream.raffle.model;

import com.google.common.collect.ImmutableMap;
import lombok.Getter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable viewer state of one connected tenant. Written by the tenant's own receive loop,
 * read by the accrual job.
 */
public class TenantSession {
    @Getter
    private final String tenantId;
    @Getter
    private final Instant openedAt;
    private final Map<String, Instant> activeViewers = new ConcurrentHashMap<>();
    private final Map<String, Instant> recentChatters = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastActivityAt = new AtomicReference<>();
    private final AtomicBoolean forceLive = new AtomicBoolean();

    public TenantSession(@Nonnull String tenantId, @Nonnull Instant openedAt) {
        this.tenantId = tenantId;
        this.openedAt = openedAt;
    }

    public void recordChat(@Nonnull String userKey, @Nonnull Instant at) {
        activeViewers.merge(userKey, at, TenantSession::latest);
        recentChatters.merge(userKey, at, TenantSession::latest);
        lastActivityAt.accumulateAndGet(at, TenantSession::latest);
    }

    @Nullable
    public Instant getLastActivityAt() {
        return lastActivityAt.get();
    }

    public boolean isForceLive() {
        return forceLive.get();
    }

    public void setForceLive(boolean value) {
        forceLive.set(value);
    }

    @Nonnull
    public Map<String, Instant> getActiveViewers() {
        return ImmutableMap.copyOf(activeViewers);
    }

    @Nonnull
    public Map<String, Instant> getRecentChatters() {
        return ImmutableMap.copyOf(recentChatters);
    }

    /**
     * @return number of evicted entries
     */
    public int evictOlderThan(@Nonnull Instant horizon) {
        int before = activeViewers.size() + recentChatters.size();
        recentChatters.values().removeIf(seen -> seen.isBefore(horizon));
        activeViewers.values().removeIf(seen -> seen.isBefore(horizon));
        return before - activeViewers.size() - recentChatters.size();
    }

    private static Instant latest(Instant left, Instant right) {
        if (left == null) {
            return right;
        }
        return right.isAfter(left) ? right : left;
    }
}
