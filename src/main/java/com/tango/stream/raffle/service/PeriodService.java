package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.Period;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PeriodService {

    enum Transition {
        NONE,
        CREATED,
        DRAWN,
        TRANSITIONED
    }

    @Nonnull
    Optional<Period> getActivePeriod(@Nonnull String tenantId);

    /**
     * Ends the active period, resets the tenant's ledger and snapshots current watchtime as the
     * conversion baseline of the new period.
     */
    @Nonnull
    Period startNewPeriod(@Nonnull String tenantId, @Nonnull Instant start, @Nonnull Instant end);

    boolean endPeriod(@Nonnull String tenantId, long periodId);

    @Nonnull
    Period createMonthlyPeriod(@Nonnull String tenantId, @Nonnull Instant now);

    @Nonnull
    List<Period> getRecentPeriods(@Nonnull String tenantId, int limit);

    @Nonnull
    Transition checkPeriodTransition(@Nonnull String tenantId, @Nonnull Instant now);
}
