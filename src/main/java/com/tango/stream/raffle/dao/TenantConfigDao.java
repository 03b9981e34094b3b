package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.TenantConfig;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

public interface TenantConfigDao {

    @Nonnull
    Optional<TenantConfig> find(@Nonnull String tenantId);

    @Nonnull
    List<TenantConfig> findAllEnabled();

    /**
     * Caches the chatroom of {@code slug}. Nothing is written if the tenant's slug has changed meanwhile.
     *
     * @return false if the row was not updated
     */
    boolean saveChatroomId(@Nonnull String tenantId, @Nonnull String slug, long chatroomId);
}
