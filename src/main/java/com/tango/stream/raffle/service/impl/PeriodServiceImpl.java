package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.dao.*;
import com.tango.stream.raffle.model.*;
import com.tango.stream.raffle.service.DrawService;
import com.tango.stream.raffle.service.PeriodService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
public class PeriodServiceImpl implements PeriodService {
    static final Pair<String, String> PERIOD_ZONE = Pair.of("raffle.period.zone", "UTC");
    static final Pair<String, Boolean> AUTO_DRAW = Pair.of("raffle.auto.draw", true);
    static final Pair<String, Long> AUTO_DRAW_BEFORE_END_MINUTES = Pair.of("raffle.auto.draw.before.end.minutes", 10L);
    static final Pair<String, String> AUTO_DRAW_PRIZE = Pair.of("raffle.auto.draw.prize", "Monthly raffle prize");
    static final String AUTO_DRAWN_BY = "auto";

    private final PeriodDao periodDao;
    private final TicketDao ticketDao;
    private final ConversionDao conversionDao;
    private final GiftedSubDao giftedSubDao;
    private final WatchtimeDao watchtimeDao;
    private final DrawService drawService;
    private final TransactionTemplate transactionTemplate;
    private final ConfigurationService configurationService;
    private final Clock clock;

    @Autowired
    public PeriodServiceImpl(PeriodDao periodDao,
                             TicketDao ticketDao,
                             ConversionDao conversionDao,
                             GiftedSubDao giftedSubDao,
                             WatchtimeDao watchtimeDao,
                             DrawService drawService,
                             TransactionTemplate transactionTemplate,
                             ConfigurationService configurationService,
                             Clock clock) {
        this.periodDao = periodDao;
        this.ticketDao = ticketDao;
        this.conversionDao = conversionDao;
        this.giftedSubDao = giftedSubDao;
        this.watchtimeDao = watchtimeDao;
        this.drawService = drawService;
        this.transactionTemplate = transactionTemplate;
        this.configurationService = configurationService;
        this.clock = clock;
    }

    @Nonnull
    @Override
    public Optional<Period> getActivePeriod(@Nonnull String tenantId) {
        return periodDao.findActive(tenantId);
    }

    @Nonnull
    @Override
    public Period startNewPeriod(@Nonnull String tenantId, @Nonnull Instant start, @Nonnull Instant end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException(String.format("Period end %s is not after start %s", end, start));
        }
        Period period = transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            periodDao.findActive(tenantId).ifPresent(active -> {
                periodDao.end(active.getId(), ticketDao.sumTotal(active.getId()));
                log.info("startNewPeriod(): ended period {} of tenant {}", active.getId(), tenantId);
            });
            long periodId = periodDao.insertActive(tenantId, start, end, now);

            int tickets = ticketDao.deleteForTenant(tenantId);
            int conversions = conversionDao.deleteForTenant(tenantId);
            int gifts = giftedSubDao.deleteForTenant(tenantId);

            List<ConversionRecord> baseline = watchtimeDao.findAll(tenantId).stream()
                    .filter(entry -> entry.getMinutes() > 0)
                    .map(entry -> ConversionRecord.builder()
                            .periodId(periodId)
                            .kickName(entry.getUsername())
                            .basisKey(ConversionRecord.BASELINE_KEY)
                            .unitsConverted(entry.getMinutes())
                            .ticketsAwarded(0)
                            .build())
                    .collect(Collectors.toList());
            conversionDao.insertBatch(tenantId, baseline, now);

            log.info("startNewPeriod(): period {} of tenant {} [{} - {}] started, cleared {} balances, {} conversions, {} gifts, {} baseline rows",
                    periodId, tenantId, start, end, tickets, conversions, gifts, baseline.size());
            return Period.builder()
                    .id(periodId)
                    .tenantId(tenantId)
                    .startDate(start)
                    .endDate(end)
                    .status(PeriodStatus.ACTIVE)
                    .build();
        });
        if (period == null) {
            throw new IllegalStateException("Period of tenant " + tenantId + " was not created");
        }
        return period;
    }

    @Override
    public boolean endPeriod(@Nonnull String tenantId, long periodId) {
        Boolean ended = transactionTemplate.execute(status -> periodDao.findForUpdate(periodId)
                .filter(period -> period.getTenantId().equals(tenantId))
                .map(period -> periodDao.end(periodId, ticketDao.sumTotal(periodId)))
                .orElse(false));
        if (Boolean.TRUE.equals(ended)) {
            log.info("endPeriod(): period {} of tenant {} ended", periodId, tenantId);
            return true;
        }
        return false;
    }

    @Nonnull
    @Override
    public Period createMonthlyPeriod(@Nonnull String tenantId, @Nonnull Instant now) {
        ZoneId zone = ZoneId.of(configurationService.getString(PERIOD_ZONE));
        ZonedDateTime monthStart = now.atZone(zone).toLocalDate().withDayOfMonth(1).atStartOfDay(zone);
        Instant start = monthStart.toInstant();
        Instant end = monthStart.plusMonths(1).toInstant().minusSeconds(1);
        return startNewPeriod(tenantId, start, end);
    }

    @Nonnull
    @Override
    public List<Period> getRecentPeriods(@Nonnull String tenantId, int limit) {
        return periodDao.findRecent(tenantId, limit);
    }

    @Nonnull
    @Override
    public Transition checkPeriodTransition(@Nonnull String tenantId, @Nonnull Instant now) {
        Optional<Period> active = periodDao.findActive(tenantId);
        if (!active.isPresent()) {
            Optional<Period> latest = periodDao.findRecent(tenantId, 1).stream().findFirst();
            if (latest.isPresent() && !latest.get().hasEndedBy(now)) {
                // drawn early, the next period starts when this one runs out
                return Transition.NONE;
            }
            Period created = createMonthlyPeriod(tenantId, now);
            log.info("checkPeriodTransition(): created period {} for tenant {}", created.getId(), tenantId);
            return Transition.CREATED;
        }

        Period period = active.get();
        boolean autoDraw = configurationService.getBoolean(AUTO_DRAW);
        if (period.hasEndedBy(now)) {
            if (autoDraw) {
                autoDraw(tenantId, period);
            }
            endPeriod(tenantId, period.getId());
            Period next = createMonthlyPeriod(tenantId, now);
            log.info("checkPeriodTransition(): tenant {} moved from period {} to {}", tenantId, period.getId(), next.getId());
            return Transition.TRANSITIONED;
        }

        Duration beforeEnd = Duration.ofMinutes(configurationService.getLong(AUTO_DRAW_BEFORE_END_MINUTES));
        if (autoDraw && !now.isBefore(period.getEndDate().minus(beforeEnd))) {
            DrawOutcome outcome = autoDraw(tenantId, period);
            if (outcome.getStatus() == DrawOutcome.Status.DRAWN) {
                return Transition.DRAWN;
            }
        }
        return Transition.NONE;
    }

    private DrawOutcome autoDraw(String tenantId, Period period) {
        if (drawService.findDraw(period.getId()).isPresent()) {
            return DrawOutcome.of(DrawOutcome.Status.ALREADY_DRAWN);
        }
        DrawOutcome outcome = drawService.draw(tenantId, period.getId(), AUTO_DRAWN_BY, configurationService.getString(AUTO_DRAW_PRIZE));
        log.info("autoDraw(): period {} of tenant {} drawn with {}", period.getId(), tenantId, outcome.getStatus());
        return outcome;
    }
}
