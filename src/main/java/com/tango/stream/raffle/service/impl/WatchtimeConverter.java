package com.tango.stream.raffle.service.impl;

import com.google.common.annotations.VisibleForTesting;
import com.tango.stream.raffle.dao.ConversionDao;
import com.tango.stream.raffle.dao.PeriodDao;
import com.tango.stream.raffle.dao.WatchtimeDao;
import com.tango.stream.raffle.model.ConversionRecord;
import com.tango.stream.raffle.model.ConversionSummary;
import com.tango.stream.raffle.model.LedgerOutcome;
import com.tango.stream.raffle.model.LinkedWatchtime;
import com.tango.stream.raffle.model.Period;
import com.tango.stream.raffle.model.TicketSource;
import com.tango.stream.raffle.service.TicketService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.Optional;

import static com.tango.stream.raffle.model.Metrics.Counters.ACCRUAL_USER_FAILURES;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;

/**
 * Turns watched minutes of linked viewers into tickets of the active period. Minutes already
 * converted in the period, the baseline snapshot included, are never converted twice.
 */
@Slf4j
@Service
public class WatchtimeConverter {
    static final Pair<String, Long> MINUTES_PER_UNIT = Pair.of("raffle.watchtime.minutes.per.unit", 60L);
    static final Pair<String, Long> TICKETS_PER_UNIT = Pair.of("raffle.watchtime.tickets.per.unit", 10L);

    private final WatchtimeDao watchtimeDao;
    private final ConversionDao conversionDao;
    private final PeriodDao periodDao;
    private final TicketService ticketService;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;

    @Autowired
    public WatchtimeConverter(WatchtimeDao watchtimeDao,
                              ConversionDao conversionDao,
                              PeriodDao periodDao,
                              TicketService ticketService,
                              ConfigurationService configurationService,
                              MeterRegistry meterRegistry) {
        this.watchtimeDao = watchtimeDao;
        this.conversionDao = conversionDao;
        this.periodDao = periodDao;
        this.ticketService = ticketService;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
    }

    @Nonnull
    public ConversionSummary convert(@Nonnull String tenantId) {
        Optional<Period> period = periodDao.findActive(tenantId);
        if (!period.isPresent()) {
            log.debug("convert(): tenant {} has no active period", tenantId);
            return ConversionSummary.EMPTY;
        }
        long periodId = period.get().getId();
        long minutesPerUnit = Math.max(1L, configurationService.getLong(MINUTES_PER_UNIT));
        long ticketsPerUnit = configurationService.getLong(TICKETS_PER_UNIT);

        int users = 0;
        long tickets = 0;
        int failures = 0;
        for (LinkedWatchtime watchtime : watchtimeDao.findLinked(tenantId)) {
            try {
                LedgerOutcome outcome = convertUser(tenantId, periodId, watchtime, minutesPerUnit, ticketsPerUnit);
                if (outcome.getStatus() == LedgerOutcome.Status.AWARDED) {
                    users++;
                    tickets += outcome.getDelta();
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("convert(): watchtime of {} in tenant {} not converted", watchtime.getKickName(), tenantId, e);
                meterRegistry.counter(ACCRUAL_USER_FAILURES, Tags.of(TENANT, tenantId)).increment();
            }
        }
        return new ConversionSummary(users, tickets, failures);
    }

    @VisibleForTesting
    LedgerOutcome convertUser(@Nonnull String tenantId,
                              long periodId,
                              @Nonnull LinkedWatchtime watchtime,
                              long minutesPerUnit,
                              long ticketsPerUnit) {
        long converted = conversionDao.sumWatchtimeUnits(periodId, watchtime.getKickName());
        long units = unconvertedUnits(watchtime.getTotalMinutes(), converted, minutesPerUnit);
        if (units <= 0) {
            return LedgerOutcome.of(LedgerOutcome.Status.INVALID);
        }
        long minutes = units * minutesPerUnit;
        String basisKey = ConversionRecord.watchtimeKey(converted + minutes);
        return ticketService.convert(tenantId, watchtime.getUserId(), watchtime.getKickName(), periodId,
                basisKey, minutes, units * ticketsPerUnit, TicketSource.WATCHTIME,
                String.format("%d minutes watched", minutes));
    }

    static long unconvertedUnits(long totalMinutes, long convertedMinutes, long minutesPerUnit) {
        if (totalMinutes <= convertedMinutes) {
            return 0;
        }
        return (totalMinutes - convertedMinutes) / minutesPerUnit;
    }
}
