package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.Period;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PeriodDao {

    @Nonnull
    Optional<Period> findActive(@Nonnull String tenantId);

    @Nonnull
    Optional<Period> find(long periodId);

    @Nonnull
    Optional<Period> findForUpdate(long periodId);

    /**
     * @return id of the new ACTIVE period
     */
    long insertActive(@Nonnull String tenantId, @Nonnull Instant start, @Nonnull Instant end, @Nonnull Instant now);

    /**
     * @return false if the period was not ACTIVE
     */
    boolean end(long periodId, long totalTickets);

    @Nonnull
    List<Period> findRecent(@Nonnull String tenantId, int limit);
}
