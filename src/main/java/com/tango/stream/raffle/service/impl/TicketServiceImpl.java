package com.tango.stream.raffle.service.impl;

import com.google.common.annotations.VisibleForTesting;
import com.tango.stream.raffle.dao.ConversionDao;
import com.tango.stream.raffle.dao.PeriodDao;
import com.tango.stream.raffle.dao.TicketDao;
import com.tango.stream.raffle.exceptions.LedgerInvariantViolation;
import com.tango.stream.raffle.model.*;
import com.tango.stream.raffle.service.TicketService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static com.tango.stream.raffle.model.Metrics.Counters.TICKETS_AWARDED;
import static com.tango.stream.raffle.model.Metrics.Counters.TICKETS_REMOVED;
import static com.tango.stream.raffle.model.Metrics.Tags.SOURCE;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;

@Slf4j
@Service
public class TicketServiceImpl implements TicketService {
    private final TicketDao ticketDao;
    private final PeriodDao periodDao;
    private final ConversionDao conversionDao;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public TicketServiceImpl(TicketDao ticketDao,
                             PeriodDao periodDao,
                             ConversionDao conversionDao,
                             TransactionTemplate transactionTemplate,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.ticketDao = ticketDao;
        this.periodDao = periodDao;
        this.conversionDao = conversionDao;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Nonnull
    @Override
    public LedgerOutcome award(@Nonnull String tenantId, long userId, @Nonnull String kickName, long amount,
                               @Nonnull TicketSource source, @Nullable String description, @Nullable Long periodId) {
        if (amount <= 0) {
            log.warn("award(): rejected non positive amount {} for user {} of tenant {}", amount, userId, tenantId);
            return LedgerOutcome.of(LedgerOutcome.Status.INVALID);
        }
        return transactionTemplate.execute(status -> {
            Optional<Period> period = lockPeriodForWrite(tenantId, periodId);
            if (!period.isPresent()) {
                log.warn("award(): no active period for tenant {}, {} tickets of {} dropped", tenantId, amount, kickName);
                return LedgerOutcome.of(LedgerOutcome.Status.NO_ACTIVE_PERIOD);
            }
            if (!period.get().isActive()) {
                log.warn("award(): period {} of tenant {} is closed, {} tickets of {} dropped", period.get().getId(), tenantId, amount, kickName);
                return LedgerOutcome.closed(period.get().getId());
            }
            return awardInPeriod(tenantId, period.get().getId(), userId, kickName, amount, source, description);
        });
    }

    private LedgerOutcome awardInPeriod(String tenantId, long periodId, long userId, String kickName, long amount,
                                        TicketSource source, @Nullable String description) {
        Instant now = clock.instant();
        ticketDao.upsertAward(tenantId, periodId, userId, kickName, source, amount, now);
        ticketDao.appendLog(tenantId, TicketLogEntry.builder()
                .periodId(periodId)
                .userId(userId)
                .kickName(kickName)
                .delta(amount)
                .source(source.getCode())
                .description(description)
                .createdAt(now)
                .build());
        TicketBalance balance = ticketDao.find(periodId, userId)
                .orElseThrow(() -> new LedgerInvariantViolation(String.format(
                        "Balance of user %d in period %d missing right after award", userId, periodId)));
        checkConsistent(balance);

        meterRegistry.counter(TICKETS_AWARDED, Tags.of(TENANT, tenantId, SOURCE, source.getCode())).increment(amount);
        log.info("awardInPeriod(): +{} {} tickets to {} ({}) in period {} of tenant {}, total {}",
                amount, source.getCode(), kickName, userId, periodId, tenantId, balance.getTotalTickets());
        return LedgerOutcome.awarded(periodId, amount, balance.getTotalTickets());
    }

    @Nonnull
    @Override
    public LedgerOutcome remove(@Nonnull String tenantId, long userId, long amount, @Nullable String reason, @Nullable Long periodId) {
        if (amount <= 0) {
            return LedgerOutcome.of(LedgerOutcome.Status.INVALID);
        }
        return transactionTemplate.execute(status -> {
            Optional<Period> resolvedPeriod = lockPeriodForWrite(tenantId, periodId);
            if (!resolvedPeriod.isPresent()) {
                return LedgerOutcome.of(LedgerOutcome.Status.NO_ACTIVE_PERIOD);
            }
            long period = resolvedPeriod.get().getId();
            if (!resolvedPeriod.get().isActive()) {
                log.warn("remove(): period {} of tenant {} is closed, removal of {} from user {} refused", period, tenantId, amount, userId);
                return LedgerOutcome.closed(period);
            }
            Optional<TicketBalance> locked = ticketDao.findForUpdate(period, userId);
            if (!locked.isPresent() || locked.get().getTotalTickets() <= 0) {
                return LedgerOutcome.of(LedgerOutcome.Status.NO_BALANCE);
            }
            TicketBalance balance = locked.get();
            checkConsistent(balance);

            long removed = Math.min(amount, balance.getTotalTickets());
            Instant now = clock.instant();
            TicketBalance scaled = scaleDown(balance, balance.getTotalTickets() - removed).toBuilder()
                    .lastUpdated(now)
                    .build();
            ticketDao.updateBuckets(scaled);
            ticketDao.appendLog(tenantId, TicketLogEntry.builder()
                    .periodId(period)
                    .userId(userId)
                    .kickName(balance.getKickName())
                    .delta(-removed)
                    .source(REMOVAL_SOURCE)
                    .description(reason)
                    .createdAt(now)
                    .build());

            meterRegistry.counter(TICKETS_REMOVED, Tags.of(TENANT, tenantId)).increment(removed);
            log.info("remove(): -{} tickets from user {} in period {} of tenant {}, total {} -> {}, reason: {}",
                    removed, userId, period, tenantId, balance.getTotalTickets(), scaled.getTotalTickets(), reason);
            return LedgerOutcome.removed(period, removed, scaled.getTotalTickets());
        });
    }

    /**
     * Scales every bucket by {@code newTotal / oldTotal}, rounding down, then hands the rounding
     * remainder back in {@link TicketSource} order without exceeding any original bucket.
     */
    @VisibleForTesting
    static TicketBalance scaleDown(@Nonnull TicketBalance balance, long newTotal) {
        long oldTotal = balance.getTotalTickets();
        Map<TicketSource, Long> scaled = new EnumMap<>(TicketSource.class);
        long assigned = 0;
        for (TicketSource source : TicketSource.values()) {
            long bucket = balance.get(source);
            long value = oldTotal == 0 ? 0 : Math.multiplyExact(bucket, newTotal) / oldTotal;
            scaled.put(source, value);
            assigned += value;
        }
        long remainder = newTotal - assigned;
        for (TicketSource source : TicketSource.values()) {
            if (remainder <= 0) {
                break;
            }
            long room = balance.get(source) - scaled.get(source);
            long extra = Math.min(room, remainder);
            scaled.put(source, scaled.get(source) + extra);
            remainder -= extra;
        }
        TicketBalance result = balance.toBuilder()
                .watchtimeTickets(scaled.get(TicketSource.WATCHTIME))
                .giftedSubTickets(scaled.get(TicketSource.GIFTED_SUB))
                .wagerTickets(scaled.get(TicketSource.WAGER))
                .bonusTickets(scaled.get(TicketSource.BONUS))
                .totalTickets(newTotal)
                .build();
        checkConsistent(result);
        return result;
    }

    @Nonnull
    @Override
    public LedgerOutcome convert(@Nonnull String tenantId, long userId, @Nonnull String kickName, long periodId,
                                 @Nonnull String basisKey, long units, long tickets, @Nonnull TicketSource source,
                                 @Nullable String description) {
        if (units <= 0 || tickets < 0) {
            return LedgerOutcome.of(LedgerOutcome.Status.INVALID);
        }
        return transactionTemplate.execute(status -> {
            Optional<Period> period = lockPeriodForWrite(tenantId, periodId);
            if (!period.isPresent()) {
                return LedgerOutcome.of(LedgerOutcome.Status.NO_ACTIVE_PERIOD);
            }
            if (!period.get().isActive()) {
                log.info("convert(): period {} of tenant {} is closed, {} of {} not converted", periodId, tenantId, basisKey, kickName);
                return LedgerOutcome.closed(periodId);
            }
            ConversionRecord record = ConversionRecord.builder()
                    .periodId(periodId)
                    .kickName(kickName)
                    .basisKey(basisKey)
                    .unitsConverted(units)
                    .ticketsAwarded(tickets)
                    .build();
            if (!conversionDao.insertIfAbsent(tenantId, record, clock.instant())) {
                log.info("convert(): {} of {} in period {} already converted", basisKey, kickName, periodId);
                return LedgerOutcome.duplicate(periodId);
            }
            if (tickets == 0) {
                return LedgerOutcome.awarded(periodId, 0, ticketDao.find(periodId, userId)
                        .map(TicketBalance::getTotalTickets)
                        .orElse(0L));
            }
            return awardInPeriod(tenantId, periodId, userId, kickName, tickets, source, description);
        });
    }

    @Nonnull
    @Override
    public Optional<TicketBalance> getBalance(@Nonnull String tenantId, long userId, @Nullable Long periodId) {
        return resolvePeriod(tenantId, periodId)
                .flatMap(period -> ticketDao.find(period, userId));
    }

    @Nonnull
    @Override
    public List<LeaderboardEntry> getLeaderboard(@Nonnull String tenantId, int limit, @Nullable Long periodId) {
        Optional<Long> period = resolvePeriod(tenantId, periodId);
        if (!period.isPresent() || limit <= 0) {
            return Collections.emptyList();
        }
        List<TicketBalance> balances = ticketDao.leaderboard(period.get(), limit);
        List<LeaderboardEntry> entries = new ArrayList<>(balances.size());
        for (int i = 0; i < balances.size(); i++) {
            entries.add(new LeaderboardEntry(i + 1, balances.get(i)));
        }
        return entries;
    }

    @Nonnull
    @Override
    public Optional<Integer> getUserRank(@Nonnull String tenantId, long userId, @Nullable Long periodId) {
        return resolvePeriod(tenantId, periodId)
                .flatMap(period -> ticketDao.rank(period, userId));
    }

    @Nonnull
    @Override
    public Optional<PeriodStats> getPeriodStats(@Nonnull String tenantId, @Nullable Long periodId) {
        return resolvePeriod(tenantId, periodId)
                .map(ticketDao::stats);
    }

    @Nonnull
    @Override
    public List<TicketLogEntry> getLog(long periodId, long userId) {
        return ticketDao.findLog(periodId, userId);
    }

    /**
     * Locks the period row so a write cannot interleave with the draw or the end of the period.
     */
    private Optional<Period> lockPeriodForWrite(String tenantId, @Nullable Long periodId) {
        Optional<Long> id = periodId != null
                ? Optional.of(periodId)
                : periodDao.findActive(tenantId).map(Period::getId);
        return id.flatMap(periodDao::findForUpdate)
                .filter(period -> period.getTenantId().equals(tenantId));
    }

    private Optional<Long> resolvePeriod(String tenantId, @Nullable Long periodId) {
        if (periodId == null) {
            return periodDao.findActive(tenantId).map(Period::getId);
        }
        return periodDao.find(periodId)
                .filter(period -> period.getTenantId().equals(tenantId))
                .map(Period::getId);
    }

    private static void checkConsistent(TicketBalance balance) {
        if (balance.getTotalTickets() != balance.sumOfSources()) {
            String message = String.format("Total %d of user %d in period %d differs from source sum %d: %s",
                    balance.getTotalTickets(), balance.getUserId(), balance.getPeriodId(), balance.sumOfSources(),
                    balance.getBreakdown().entrySet().stream()
                            .map(entry -> entry.getKey().getCode() + "=" + entry.getValue())
                            .collect(Collectors.joining(", ")));
            log.error("checkConsistent(): ledger invariant violated, rolling back: {}", message);
            throw new LedgerInvariantViolation(message);
        }
    }
}
