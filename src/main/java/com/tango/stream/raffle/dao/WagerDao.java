package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.WagerLink;
import com.tango.stream.raffle.model.WagerTracking;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

public interface WagerDao {

    @Nonnull
    Optional<WagerLink> findVerifiedLink(@Nonnull String tenantId, @Nonnull String platformUsername);

    @Nonnull
    Optional<WagerTracking> findForUpdate(long periodId, @Nonnull String platformUsername);

    /**
     * @return false if the player is already tracked in the period
     */
    boolean insertIfAbsent(@Nonnull WagerTracking tracking, @Nonnull Instant now);

    /**
     * Moves the settled wager of the player forward and adds {@code tickets} to its award count.
     */
    void advance(long periodId, @Nonnull String platformUsername, @Nonnull BigDecimal wager, long tickets, @Nonnull Instant now);
}
