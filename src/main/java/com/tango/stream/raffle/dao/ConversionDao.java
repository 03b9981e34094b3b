package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.ConversionRecord;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;

public interface ConversionDao {

    /**
     * @return false if a record with the same period, name and basis key exists
     */
    boolean insertIfAbsent(@Nonnull String tenantId, @Nonnull ConversionRecord record, @Nonnull Instant now);

    void insertBatch(@Nonnull String tenantId, @Nonnull List<ConversionRecord> records, @Nonnull Instant now);

    /**
     * Minutes already converted from watchtime, the baseline included.
     */
    long sumWatchtimeUnits(long periodId, @Nonnull String kickName);

    @Nonnull
    List<ConversionRecord> find(long periodId, @Nonnull String kickName);

    int deleteForTenant(@Nonnull String tenantId);
}
