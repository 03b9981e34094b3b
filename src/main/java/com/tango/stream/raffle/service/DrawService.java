package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.DrawOutcome;
import com.tango.stream.raffle.model.DrawResult;
import com.tango.stream.raffle.model.SimulationResult;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

public interface DrawService {

    @Nonnull
    DrawOutcome draw(@Nonnull String tenantId, @Nullable Long periodId, @Nonnull String drawnBy, @Nullable String prize);

    /**
     * Runs {@code rounds} selections over the current balances without recording anything.
     */
    @Nonnull
    SimulationResult simulate(@Nonnull String tenantId, @Nullable Long periodId, int rounds);

    @Nonnull
    List<DrawResult> getHistory(@Nonnull String tenantId, int limit);

    @Nonnull
    Optional<Double> getWinProbability(@Nonnull String tenantId, long userId, @Nullable Long periodId);

    @Nonnull
    Optional<DrawResult> findDraw(long periodId);

    /**
     * Recomputes the winning ticket and proof hash from the stored seeds.
     */
    boolean verify(@Nonnull DrawResult result);
}
