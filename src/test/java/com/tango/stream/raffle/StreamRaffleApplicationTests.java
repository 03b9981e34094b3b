package com.tango.stream.raffle;

import com.tango.stream.raffle.model.DrawOutcome;
import com.tango.stream.raffle.model.LedgerOutcome;
import com.tango.stream.raffle.model.TicketBalance;
import com.tango.stream.raffle.model.TicketSource;
import com.tango.stream.raffle.service.PeriodService;
import com.tango.stream.raffle.service.RaffleFacade;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StreamRaffleApplicationTests extends BaseTest {
    @Autowired
    private RaffleFacade raffleFacade;
    @Autowired
    private PeriodService periodService;

    @Test
    void contextLoads() {
        assertNotNull(raffleFacade);
    }

    @Test
    void shouldRunRaffleThroughFacade() {
        String tenantId = newTenant();
        Instant now = clock.instant();
        periodService.startNewPeriod(tenantId, now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(1)));

        LedgerOutcome outcome = raffleFacade.awardTickets(tenantId, 1L, "alice", 12, TicketSource.WAGER, "bet won");
        raffleFacade.recordChatActivity(tenantId, "Alice");
        raffleFacade.recordChatActivity(tenantId, "bob");

        assertEquals(LedgerOutcome.Status.AWARDED, outcome.getStatus());
        assertEquals(12, raffleFacade.getBalance(tenantId, 1L).map(TicketBalance::getWagerTickets).orElse(0L));
        assertTrue(raffleFacade.isLive(tenantId));

        DrawOutcome draw = raffleFacade.runDraw(tenantId, null, "Mouse", "admin");

        assertEquals(DrawOutcome.Status.DRAWN, draw.getStatus());
        assertEquals(1L, draw.getDrawResult().map(result -> result.getWinnerUserId()).orElse(-1L));
        assertFalse(raffleFacade.getBalance(tenantId, 1L).isPresent());
    }

    @Test
    void shouldDrawEndedPeriodById() {
        String tenantId = newTenant();
        Instant now = clock.instant();
        long periodId = periodService.startNewPeriod(tenantId, now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(1))).getId();
        raffleFacade.awardTickets(tenantId, 5L, "erin", 3, TicketSource.BONUS, null);
        assertTrue(periodService.endPeriod(tenantId, periodId));

        assertEquals(DrawOutcome.Status.PERIOD_NOT_FOUND, raffleFacade.runDraw(tenantId, null, "Mouse", "admin").getStatus());
        DrawOutcome draw = raffleFacade.runDraw(tenantId, periodId, "Mouse", "admin");

        assertEquals(DrawOutcome.Status.DRAWN, draw.getStatus());
        assertEquals(periodId, draw.getDrawResult().map(result -> result.getPeriodId()).orElse(-1L));
        assertEquals(DrawOutcome.Status.ALREADY_DRAWN, raffleFacade.runDraw(tenantId, periodId, "Mouse", "admin").getStatus());
    }
}
