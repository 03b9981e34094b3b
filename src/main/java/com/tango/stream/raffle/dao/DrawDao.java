package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.DrawResult;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

public interface DrawDao {

    @Nonnull
    Optional<DrawResult> findByPeriod(long periodId);

    long insert(@Nonnull DrawResult result);

    @Nonnull
    List<DrawResult> history(@Nonnull String tenantId, int limit);
}
