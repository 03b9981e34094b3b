package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.GiftedSubRecord;

import javax.annotation.Nonnull;

public interface GiftedSubDao {

    /**
     * @return false if the event id is already recorded for the tenant
     */
    boolean insertIfAbsent(@Nonnull GiftedSubRecord record);

    boolean exists(@Nonnull String tenantId, @Nonnull String kickEventId);

    int deleteForTenant(@Nonnull String tenantId);
}
