package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.*;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TicketDao {

    /**
     * Creates the balance row or increments the source bucket and the total of the existing one.
     */
    void upsertAward(@Nonnull String tenantId, long periodId, long userId, @Nonnull String kickName,
                     @Nonnull TicketSource source, long amount, @Nonnull Instant now);

    @Nonnull
    Optional<TicketBalance> find(long periodId, long userId);

    /**
     * Locks the row until the end of the current transaction.
     */
    @Nonnull
    Optional<TicketBalance> findForUpdate(long periodId, long userId);

    void updateBuckets(@Nonnull TicketBalance balance);

    void appendLog(@Nonnull String tenantId, @Nonnull TicketLogEntry entry);

    @Nonnull
    List<TicketLogEntry> findLog(long periodId, long userId);

    @Nonnull
    List<TicketBalance> leaderboard(long periodId, int limit);

    /**
     * 1-based rank by total descending, ties broken by row id.
     */
    @Nonnull
    Optional<Integer> rank(long periodId, long userId);

    @Nonnull
    PeriodStats stats(long periodId);

    /**
     * Balances with tickets, in row id order.
     */
    @Nonnull
    List<Participant> participants(long periodId);

    long sumTotal(long periodId);

    int deleteForTenant(@Nonnull String tenantId);
}
