package com.tango.stream.raffle.service;

import com.tango.stream.raffle.exceptions.ChannelResolveException;
import com.tango.stream.raffle.model.TenantConfig;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

public interface TenantConfigService {

    @Nonnull
    Optional<TenantConfig> getConfig(@Nonnull String tenantId);

    @Nonnull
    List<TenantConfig> getEnabledTenants();

    /**
     * Fills in the chatroom id from the platform API if it is not stored yet, caching it.
     */
    @Nonnull
    TenantConfig resolve(@Nonnull TenantConfig config) throws ChannelResolveException;
}
