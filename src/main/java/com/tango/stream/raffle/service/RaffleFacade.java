package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.DrawOutcome;
import com.tango.stream.raffle.model.LedgerOutcome;
import com.tango.stream.raffle.model.TicketBalance;
import com.tango.stream.raffle.model.TicketSource;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Entry points used by the chat-command, admin and shop collaborators.
 */
public interface RaffleFacade {

    @Nonnull
    LedgerOutcome awardTickets(@Nonnull String tenantId, long userId, @Nonnull String kickName, long amount,
                               @Nonnull TicketSource source, @Nullable String description);

    void recordChatActivity(@Nonnull String tenantId, @Nonnull String userKey);

    boolean isLive(@Nonnull String tenantId);

    /**
     * Draws {@code periodId}, or the active period when it is null. An ended period without a draw can still be drawn.
     */
    @Nonnull
    DrawOutcome runDraw(@Nonnull String tenantId, @Nullable Long periodId, @Nullable String prize, @Nonnull String drawnBy);

    @Nonnull
    Optional<TicketBalance> getBalance(@Nonnull String tenantId, long userId);
}
