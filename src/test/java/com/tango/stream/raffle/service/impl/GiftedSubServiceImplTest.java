package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.BaseTest;
import com.tango.stream.raffle.model.GiftOutcome;
import com.tango.stream.raffle.model.TicketBalance;
import com.tango.stream.raffle.model.events.GiftSubscription;
import com.tango.stream.raffle.service.GiftedSubService;
import com.tango.stream.raffle.service.PeriodService;
import com.tango.stream.raffle.service.TicketService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GiftedSubServiceImplTest extends BaseTest {
    @Autowired
    private GiftedSubService giftedSubService;
    @Autowired
    private TicketService ticketService;
    @Autowired
    private PeriodService periodService;

    @Test
    void shouldAwardReplayedGiftOnlyOnce() {
        String tenantId = tenantWithPeriod();
        linkAccount(tenantId, "Generous", 77L);
        GiftSubscription gift = new GiftSubscription("generous", 3, "evt-1", clock.instant());

        assertEquals(GiftOutcome.AWARDED, giftedSubService.handleGift(tenantId, gift));
        assertEquals(GiftOutcome.DUPLICATE, giftedSubService.handleGift(tenantId, gift));

        TicketBalance balance = ticketService.getBalance(tenantId, 77L, null).orElseThrow(AssertionError::new);
        assertEquals(45, balance.getGiftedSubTickets());
        assertEquals(45, balance.getTotalTickets());
    }

    @Test
    void shouldReportReplayAfterPeriodEndAsDuplicate() {
        String tenantId = tenantWithPeriod();
        linkAccount(tenantId, "generous", 80L);
        GiftSubscription gift = new GiftSubscription("generous", 1, "evt-late", clock.instant());
        assertEquals(GiftOutcome.AWARDED, giftedSubService.handleGift(tenantId, gift));
        long periodId = periodService.getActivePeriod(tenantId).orElseThrow(AssertionError::new).getId();
        periodService.endPeriod(tenantId, periodId);

        assertEquals(GiftOutcome.DUPLICATE, giftedSubService.handleGift(tenantId, gift));
        assertEquals(GiftOutcome.NO_ACTIVE_PERIOD,
                giftedSubService.handleGift(tenantId, new GiftSubscription("generous", 1, "evt-new", clock.instant())));
    }

    @Test
    void shouldRecordUnlinkedGifterWithoutTickets() {
        String tenantId = tenantWithPeriod();
        GiftSubscription gift = new GiftSubscription("stranger", 1, "evt-2", clock.instant());

        assertEquals(GiftOutcome.NOT_LINKED, giftedSubService.handleGift(tenantId, gift));
        assertEquals(GiftOutcome.DUPLICATE, giftedSubService.handleGift(tenantId, gift));
    }

    @Test
    void shouldDropGiftWithoutActivePeriod() {
        String tenantId = newTenant();
        linkAccount(tenantId, "generous", 78L);

        GiftOutcome outcome = giftedSubService.handleGift(tenantId, new GiftSubscription("generous", 2, "evt-3", clock.instant()));

        assertEquals(GiftOutcome.NO_ACTIVE_PERIOD, outcome);
    }

    @Test
    void shouldRejectEmptyGift() {
        String tenantId = tenantWithPeriod();

        assertEquals(GiftOutcome.INVALID, giftedSubService.handleGift(tenantId, new GiftSubscription("generous", 0, "evt-4", clock.instant())));
        assertEquals(GiftOutcome.INVALID, giftedSubService.handleGift(tenantId, new GiftSubscription(" ", 1, "evt-5", clock.instant())));
    }

    @Test
    void shouldTreatGiftsWithoutIdAsDistinct() {
        String tenantId = tenantWithPeriod();
        linkAccount(tenantId, "generous", 79L);
        Instant at = clock.instant();

        assertEquals(GiftOutcome.AWARDED, giftedSubService.handleGift(tenantId, new GiftSubscription("generous", 1, null, at)));
        assertEquals(GiftOutcome.AWARDED, giftedSubService.handleGift(tenantId, new GiftSubscription("generous", 1, null, at)));

        assertEquals(30, ticketService.getBalance(tenantId, 79L, null).map(TicketBalance::getTotalTickets).orElse(0L));
    }

    @Test
    void shouldUseConfiguredTicketsPerSub() {
        setProperty(GiftedSubServiceImpl.TICKETS_PER_GIFTED_SUB.getKey(), 20L);

        assertEquals(100, giftedSubService.ticketsFor(5));
        assertEquals(20, giftedSubService.ticketsFor(1));
    }

    private String tenantWithPeriod() {
        String tenantId = newTenant();
        Instant now = clock.instant();
        periodService.startNewPeriod(tenantId, now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(10)));
        return tenantId;
    }
}
