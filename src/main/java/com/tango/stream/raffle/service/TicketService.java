package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.*;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * Ticket ledger. A {@code null} period id means the tenant's active period.
 */
public interface TicketService {
    String REMOVAL_SOURCE = "admin_removal";

    @Nonnull
    LedgerOutcome award(@Nonnull String tenantId, long userId, @Nonnull String kickName, long amount,
                        @Nonnull TicketSource source, @Nullable String description, @Nullable Long periodId);

    /**
     * Removes up to {@code amount} tickets, scaling every source bucket proportionally.
     */
    @Nonnull
    LedgerOutcome remove(@Nonnull String tenantId, long userId, long amount, @Nullable String reason, @Nullable Long periodId);

    /**
     * Records the conversion and awards its tickets atomically; a known basis key is a no-op.
     */
    @Nonnull
    LedgerOutcome convert(@Nonnull String tenantId, long userId, @Nonnull String kickName, long periodId,
                          @Nonnull String basisKey, long units, long tickets, @Nonnull TicketSource source,
                          @Nullable String description);

    @Nonnull
    Optional<TicketBalance> getBalance(@Nonnull String tenantId, long userId, @Nullable Long periodId);

    @Nonnull
    List<LeaderboardEntry> getLeaderboard(@Nonnull String tenantId, int limit, @Nullable Long periodId);

    @Nonnull
    Optional<Integer> getUserRank(@Nonnull String tenantId, long userId, @Nullable Long periodId);

    @Nonnull
    Optional<PeriodStats> getPeriodStats(@Nonnull String tenantId, @Nullable Long periodId);

    @Nonnull
    List<TicketLogEntry> getLog(long periodId, long userId);
}
