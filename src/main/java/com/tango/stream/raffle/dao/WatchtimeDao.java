package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.LinkedWatchtime;
import com.tango.stream.raffle.model.WatchtimeEntry;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface WatchtimeDao {

    /**
     * Adds {@code seconds} to every viewer of the map, updating last activity to the map value.
     */
    void addSeconds(@Nonnull String tenantId, @Nonnull Map<String, Instant> viewers, long seconds);

    @Nonnull
    List<WatchtimeEntry> findAll(@Nonnull String tenantId);

    @Nonnull
    List<LinkedWatchtime> findLinked(@Nonnull String tenantId);
}
