package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.TenantSession;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory viewer state per connected tenant.
 */
public interface TenantSessionStore {

    /**
     * Returns the existing session of the tenant or creates a new one.
     */
    @Nonnull
    TenantSession openSession(@Nonnull String tenantId);

    @Nonnull
    Optional<TenantSession> getSession(@Nonnull String tenantId);

    void discard(@Nonnull String tenantId);

    void recordChatActivity(@Nonnull String tenantId, @Nonnull String userKey, @Nonnull Instant at);

    void setForceLive(@Nonnull String tenantId, boolean forceLive);

    /**
     * Evicts chatters and viewers not seen within {@code 2 * window} before {@code now}.
     *
     * @return number of evicted entries
     */
    int prune(@Nonnull String tenantId, @Nonnull Instant now, @Nonnull Duration window);

    @Nonnull
    Set<String> activeTenants();
}
