package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.model.DrawOutcome;
import com.tango.stream.raffle.model.LedgerOutcome;
import com.tango.stream.raffle.model.TicketBalance;
import com.tango.stream.raffle.model.TicketSource;
import com.tango.stream.raffle.service.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

@Service
public class RaffleFacadeImpl implements RaffleFacade {
    private final TicketService ticketService;
    private final TenantSessionStore sessionStore;
    private final LivenessDetector livenessDetector;
    private final DrawService drawService;
    private final Clock clock;

    @Autowired
    public RaffleFacadeImpl(TicketService ticketService,
                            TenantSessionStore sessionStore,
                            LivenessDetector livenessDetector,
                            DrawService drawService,
                            Clock clock) {
        this.ticketService = ticketService;
        this.sessionStore = sessionStore;
        this.livenessDetector = livenessDetector;
        this.drawService = drawService;
        this.clock = clock;
    }

    @Nonnull
    @Override
    public LedgerOutcome awardTickets(@Nonnull String tenantId, long userId, @Nonnull String kickName, long amount,
                                      @Nonnull TicketSource source, @Nullable String description) {
        return ticketService.award(tenantId, userId, kickName, amount, source, description, null);
    }

    @Override
    public void recordChatActivity(@Nonnull String tenantId, @Nonnull String userKey) {
        sessionStore.recordChatActivity(tenantId, userKey.toLowerCase(Locale.ROOT), clock.instant());
    }

    @Override
    public boolean isLive(@Nonnull String tenantId) {
        return livenessDetector.isLive(tenantId, clock.instant());
    }

    @Nonnull
    @Override
    public DrawOutcome runDraw(@Nonnull String tenantId, @Nullable Long periodId, @Nullable String prize, @Nonnull String drawnBy) {
        return drawService.draw(tenantId, periodId, drawnBy, prize);
    }

    @Nonnull
    @Override
    public Optional<TicketBalance> getBalance(@Nonnull String tenantId, long userId) {
        return ticketService.getBalance(tenantId, userId, null);
    }
}
