package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.dao.DrawDao;
import com.tango.stream.raffle.dao.ExclusionDao;
import com.tango.stream.raffle.dao.PeriodDao;
import com.tango.stream.raffle.dao.TicketDao;
import com.tango.stream.raffle.draw.TicketRangeAllocator;
import com.tango.stream.raffle.draw.WinningTicketSelector;
import com.tango.stream.raffle.model.*;
import com.tango.stream.raffle.service.DrawNotifier;
import com.tango.stream.raffle.service.DrawService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.*;
import java.util.stream.Collectors;

import static com.tango.stream.raffle.model.Metrics.Counters.DRAWS;
import static com.tango.stream.raffle.model.Metrics.Counters.DRAW_NOTIFY_ERRORS;
import static com.tango.stream.raffle.model.Metrics.Tags.OUTCOME;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;

@Slf4j
@Service
public class DrawServiceImpl implements DrawService {
    private final PeriodDao periodDao;
    private final TicketDao ticketDao;
    private final DrawDao drawDao;
    private final ExclusionDao exclusionDao;
    private final WinningTicketSelector ticketSelector;
    private final DrawNotifier drawNotifier;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public DrawServiceImpl(PeriodDao periodDao,
                           TicketDao ticketDao,
                           DrawDao drawDao,
                           ExclusionDao exclusionDao,
                           WinningTicketSelector ticketSelector,
                           DrawNotifier drawNotifier,
                           TransactionTemplate transactionTemplate,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.periodDao = periodDao;
        this.ticketDao = ticketDao;
        this.drawDao = drawDao;
        this.exclusionDao = exclusionDao;
        this.ticketSelector = ticketSelector;
        this.drawNotifier = drawNotifier;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Nonnull
    @Override
    public DrawOutcome draw(@Nonnull String tenantId, @Nullable Long periodId, @Nonnull String drawnBy, @Nullable String prize) {
        DrawOutcome outcome = transactionTemplate.execute(status -> {
            Optional<Period> period = lockPeriod(tenantId, periodId);
            if (!period.isPresent()) {
                return DrawOutcome.of(DrawOutcome.Status.PERIOD_NOT_FOUND);
            }
            long id = period.get().getId();
            Optional<DrawResult> existing = drawDao.findByPeriod(id);
            if (existing.isPresent()) {
                return DrawOutcome.alreadyDrawn(existing.get());
            }
            List<TicketRange> ranges = TicketRangeAllocator.allocate(eligibleParticipants(tenantId, id));
            if (ranges.isEmpty()) {
                return DrawOutcome.of(DrawOutcome.Status.NO_PARTICIPANTS);
            }
            long totalTickets = TicketRangeAllocator.totalTickets(ranges);
            WinningTicket winningTicket = ticketSelector.select(id, totalTickets, ranges.size());
            TicketRange winner = TicketRangeAllocator.findOwner(ranges, winningTicket.getTicket())
                    .orElseThrow(() -> new IllegalStateException(String.format(
                            "Ticket %d of period %d has no owner among %d ranges", winningTicket.getTicket(), id, ranges.size())));

            DrawResult result = DrawResult.builder()
                    .tenantId(tenantId)
                    .periodId(id)
                    .totalTickets(totalTickets)
                    .totalParticipants(ranges.size())
                    .winnerUserId(winner.getUserId())
                    .winnerKickName(winner.getKickName())
                    .winningTicket(winningTicket.getTicket())
                    .winnerTickets(winner.getTickets())
                    .winProbability(winner.getTickets() / (double) totalTickets)
                    .prizeDescription(prize)
                    .drawnBy(drawnBy)
                    .serverSeed(winningTicket.getServerSeed())
                    .clientSeed(winningTicket.getClientSeed())
                    .nonce(winningTicket.getNonce())
                    .proofHash(winningTicket.getProofHash())
                    .drawnAt(clock.instant())
                    .build();
            result.setId(drawDao.insert(result));
            periodDao.end(id, ticketDao.sumTotal(id));
            return DrawOutcome.drawn(result);
        });
        if (outcome == null) {
            throw new IllegalStateException("Draw of tenant " + tenantId + " returned nothing");
        }
        meterRegistry.counter(DRAWS, Tags.of(TENANT, tenantId, OUTCOME, outcome.getStatus().name())).increment();
        if (outcome.getStatus() == DrawOutcome.Status.DRAWN && outcome.getResult() != null) {
            DrawResult result = outcome.getResult();
            log.info("draw(): period {} of tenant {} won by {} ({}) with ticket {} of {}, chance {}",
                    result.getPeriodId(), tenantId, result.getWinnerKickName(), result.getWinnerUserId(),
                    result.getWinningTicket(), result.getTotalTickets(), result.getWinProbability());
            notifyDraw(result);
        } else {
            log.info("draw(): tenant {} period {} not drawn: {}", tenantId, periodId, outcome.getStatus());
        }
        return outcome;
    }

    private void notifyDraw(DrawResult result) {
        try {
            drawNotifier.onDraw(result);
        } catch (RuntimeException e) {
            // the draw is committed at this point
            log.error("notifyDraw(): couldn't publish draw of period {}", result.getPeriodId(), e);
            meterRegistry.counter(DRAW_NOTIFY_ERRORS, Tags.of(TENANT, result.getTenantId())).increment();
        }
    }

    @Nonnull
    @Override
    public SimulationResult simulate(@Nonnull String tenantId, @Nullable Long periodId, int rounds) {
        Optional<Period> period = findPeriod(tenantId, periodId);
        long id = period.map(Period::getId).orElse(0L);
        List<TicketRange> ranges = period.isPresent()
                ? TicketRangeAllocator.allocate(eligibleParticipants(tenantId, id))
                : Collections.emptyList();
        long totalTickets = TicketRangeAllocator.totalTickets(ranges);
        SimulationResult.SimulationResultBuilder builder = SimulationResult.builder()
                .periodId(id)
                .rounds(ranges.isEmpty() ? 0 : rounds)
                .totalTickets(totalTickets);
        if (ranges.isEmpty()) {
            return builder.build();
        }
        Map<Long, Long> wins = new HashMap<>();
        for (int round = 0; round < rounds; round++) {
            long ticket = ticketSelector.select(id, totalTickets, ranges.size()).getTicket();
            TicketRangeAllocator.findOwner(ranges, ticket)
                    .ifPresent(owner -> wins.merge(owner.getUserId(), 1L, Long::sum));
        }
        ranges.forEach(range -> builder.expectedShare(range.getUserId(), range.getTickets() / (double) totalTickets));
        return builder.wins(wins).build();
    }

    @Nonnull
    @Override
    public List<DrawResult> getHistory(@Nonnull String tenantId, int limit) {
        return drawDao.history(tenantId, limit);
    }

    @Nonnull
    @Override
    public Optional<Double> getWinProbability(@Nonnull String tenantId, long userId, @Nullable Long periodId) {
        return findPeriod(tenantId, periodId).flatMap(period -> {
            List<Participant> participants = eligibleParticipants(tenantId, period.getId());
            long total = participants.stream().mapToLong(Participant::getTickets).sum();
            return participants.stream()
                    .filter(participant -> participant.getUserId() == userId)
                    .findFirst()
                    .map(participant -> participant.getTickets() / (double) total);
        });
    }

    @Nonnull
    @Override
    public Optional<DrawResult> findDraw(long periodId) {
        return drawDao.findByPeriod(periodId);
    }

    @Override
    public boolean verify(@Nonnull DrawResult result) {
        return ticketSelector.verify(WinningTicket.builder()
                .ticket(result.getWinningTicket())
                .serverSeed(result.getServerSeed())
                .clientSeed(result.getClientSeed())
                .nonce(result.getNonce())
                .proofHash(result.getProofHash())
                .build(), result.getTotalTickets());
    }

    private List<Participant> eligibleParticipants(String tenantId, long periodId) {
        List<Exclusion> exclusions = exclusionDao.find(tenantId);
        List<Participant> participants = ticketDao.participants(periodId);
        if (exclusions.isEmpty()) {
            return participants;
        }
        return participants.stream()
                .filter(participant -> exclusions.stream().noneMatch(exclusion -> exclusion.matches(participant)))
                .collect(Collectors.toList());
    }

    private Optional<Period> lockPeriod(String tenantId, @Nullable Long periodId) {
        Optional<Long> id = periodId != null
                ? Optional.of(periodId)
                : periodDao.findActive(tenantId).map(Period::getId);
        return id.flatMap(periodDao::findForUpdate)
                .filter(period -> period.getTenantId().equals(tenantId));
    }

    private Optional<Period> findPeriod(String tenantId, @Nullable Long periodId) {
        if (periodId == null) {
            return periodDao.findActive(tenantId);
        }
        return periodDao.find(periodId)
                .filter(period -> period.getTenantId().equals(tenantId));
    }
}
