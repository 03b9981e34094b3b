package com.tango.stream.raffle.service.impl;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.tango.stream.raffle.dao.PeriodDao;
import com.tango.stream.raffle.dao.WagerDao;
import com.tango.stream.raffle.exceptions.LockAcquiringFail;
import com.tango.stream.raffle.model.AffiliateWager;
import com.tango.stream.raffle.model.CallSpec;
import com.tango.stream.raffle.model.ConversionRecord;
import com.tango.stream.raffle.model.LedgerOutcome;
import com.tango.stream.raffle.model.Period;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.model.TicketSource;
import com.tango.stream.raffle.model.WagerLink;
import com.tango.stream.raffle.model.WagerReport;
import com.tango.stream.raffle.model.WagerTracking;
import com.tango.stream.raffle.restClients.AffiliateStatsClient;
import com.tango.stream.raffle.service.LocksService;
import com.tango.stream.raffle.service.TenantConfigService;
import com.tango.stream.raffle.service.TicketService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.LongCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import javax.annotation.Nonnull;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.tango.stream.raffle.model.Metrics.Counters.WAGER_FETCH_FAILURES;
import static com.tango.stream.raffle.model.Metrics.Counters.WAGER_USER_FAILURES;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;
import static com.tango.stream.raffle.model.Metrics.Timers.WAGER_TICK_TIME;
import static com.tango.stream.raffle.utils.NamedLocksHelper.getSchedulerLockName;

/**
 * Polls the affiliate stats of every tenant with wager tracking and turns the growth of the
 * cumulative wager of linked players into tickets of the active period. The first sighting of a
 * player in a period only records a baseline.
 */
@Slf4j
@Service
public class WagerTracker {
    static final Pair<String, Boolean> WAGER_ENABLED = Pair.of("raffle.wager.enable", true);
    static final Pair<String, Long> WAGER_PERIOD_SECONDS = Pair.of("raffle.wager.period.seconds", 900L);
    static final Pair<String, Long> TICKETS_PER_THOUSAND = Pair.of("raffle.wager.tickets.per.1000", 20L);
    static final Pair<String, Long> WAGER_WAIT_TIME = Pair.of("raffle.wager.lock.wait.time.ms", 1000L);
    static final Pair<String, Long> WAGER_LEASE_TIME = Pair.of("raffle.wager.lock.lease.time.ms", 120000L);
    static final String JOB_NAME = "wager";
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final Splitter CODES_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final ScheduledExecutorService wagerExecutorService = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
            .namingPattern("raffle-wager-thread-%d")
            .daemon(true)
            .build());

    private final TenantConfigService tenantConfigService;
    private final AffiliateStatsClient affiliateStatsClient;
    private final PeriodDao periodDao;
    private final WagerDao wagerDao;
    private final TicketService ticketService;
    private final TransactionTemplate transactionTemplate;
    private final LocksService locksService;
    private final RedissonClient redissonClient;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public WagerTracker(TenantConfigService tenantConfigService,
                        AffiliateStatsClient affiliateStatsClient,
                        PeriodDao periodDao,
                        WagerDao wagerDao,
                        TicketService ticketService,
                        TransactionTemplate transactionTemplate,
                        LocksService locksService,
                        RedissonClient redissonClient,
                        ConfigurationService configurationService,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.tenantConfigService = tenantConfigService;
        this.affiliateStatsClient = affiliateStatsClient;
        this.periodDao = periodDao;
        this.wagerDao = wagerDao;
        this.ticketService = ticketService;
        this.transactionTemplate = transactionTemplate;
        this.locksService = locksService;
        this.redissonClient = redissonClient;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        wagerExecutorService.schedule(this::tick, getPeriodSeconds(), TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        wagerExecutorService.shutdownNow();
    }

    void tick() {
        try {
            if (configurationService.getBoolean(WAGER_ENABLED)) {
                runTracking();
            }
        } catch (LockAcquiringFail e) {
            log.debug("tick(): wager tracking runs on another instance");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (Exception e) {
            log.error("tick(): wager tracking failed", e);
        }
        wagerExecutorService.schedule(this::tick, getPeriodSeconds(), TimeUnit.SECONDS);
    }

    /**
     * @return reports of the tenants handled, empty if the tick already ran elsewhere
     */
    @Nonnull
    public List<WagerReport> runTracking() throws Exception {
        long periodSeconds = getPeriodSeconds();
        String lockName = getSchedulerLockName(JOB_NAME);
        return locksService.doUnderLock(CallSpec.<List<WagerReport>>builder()
                .lockNames(ImmutableList.of(lockName))
                .action(() -> runTrackingUnderLock(lockName, periodSeconds))
                .waitTimeMs(configurationService.getLong(WAGER_WAIT_TIME))
                .leaseTimeMs(configurationService.getLong(WAGER_LEASE_TIME))
                .outsideTimer(meterRegistry.timer(WAGER_TICK_TIME))
                .build());
    }

    private List<WagerReport> runTrackingUnderLock(@Nonnull String lockName, long periodSeconds) {
        Instant now = clock.instant();
        RBucket<Long> lastTick = redissonClient.getBucket(lockName + ".lastTick", LongCodec.INSTANCE);
        Long previous = lastTick.get();
        if (previous != null && now.toEpochMilli() - previous < periodSeconds * 900L) {
            log.debug("runTrackingUnderLock(): tick of {} already done", Instant.ofEpochMilli(previous));
            return Collections.emptyList();
        }
        lastTick.set(now.toEpochMilli());

        List<WagerReport> reports = Lists.newArrayList();
        for (TenantConfig config : tenantConfigService.getEnabledTenants()) {
            if (config.hasWagerTracking()) {
                reports.add(trackTenant(config, now));
            }
        }
        log.info("runTrackingUnderLock(): {}", reports);
        return reports;
    }

    @VisibleForTesting
    @Nonnull
    WagerReport trackTenant(@Nonnull TenantConfig config, @Nonnull Instant now) {
        String tenantId = config.getTenantId();
        if (!config.hasWagerTracking()) {
            return WagerReport.of(tenantId, WagerReport.Status.NOT_CONFIGURED);
        }
        try {
            Optional<Period> period = periodDao.findActive(tenantId);
            if (!period.isPresent()) {
                return WagerReport.of(tenantId, WagerReport.Status.NO_ACTIVE_PERIOD);
            }

            List<AffiliateWager> wagers;
            try {
                wagers = affiliateStatsClient.getWagers(URI.create(config.getWagerAffiliateUrl()));
            } catch (RuntimeException e) {
                log.warn("trackTenant(): affiliate stats of tenant {} are unavailable: {}", tenantId, e.getMessage());
                meterRegistry.counter(WAGER_FETCH_FAILURES, Tags.of(TENANT, tenantId)).increment();
                return WagerReport.of(tenantId, WagerReport.Status.FETCH_FAILED);
            }

            Set<String> codes = parseCodes(config.getWagerCampaignCodes());
            long periodId = period.get().getId();
            long rate = configurationService.getLong(TICKETS_PER_THOUSAND);
            int seen = 0;
            int awardedPlayers = 0;
            long ticketsAwarded = 0;
            int failures = 0;
            for (AffiliateWager wager : wagers == null ? Collections.<AffiliateWager>emptyList() : wagers) {
                if (StringUtils.isBlank(wager.getUsername()) || wager.getWagerAmount() == null || !matchesCode(wager, codes)) {
                    continue;
                }
                seen++;
                try {
                    long tickets = trackPlayer(tenantId, periodId, wager, rate, now);
                    if (tickets > 0) {
                        awardedPlayers++;
                        ticketsAwarded += tickets;
                    }
                } catch (RuntimeException e) {
                    failures++;
                    meterRegistry.counter(WAGER_USER_FAILURES, Tags.of(TENANT, tenantId)).increment();
                    log.error("trackTenant(): wager of player {} of tenant {} failed", wager.getUsername(), tenantId, e);
                }
            }
            return WagerReport.builder()
                    .tenantId(tenantId)
                    .status(WagerReport.Status.UPDATED)
                    .playersSeen(seen)
                    .playersAwarded(awardedPlayers)
                    .ticketsAwarded(ticketsAwarded)
                    .failures(failures)
                    .build();
        } catch (RuntimeException e) {
            log.error("trackTenant(): wager tracking of tenant {} failed", tenantId, e);
            return WagerReport.of(tenantId, WagerReport.Status.FAILED);
        }
    }

    /**
     * @return tickets awarded to the player
     */
    private long trackPlayer(@Nonnull String tenantId, long periodId, @Nonnull AffiliateWager wager, long rate, @Nonnull Instant now) {
        String username = wager.getUsername().trim().toLowerCase(Locale.ROOT);
        BigDecimal current = wager.getWagerAmount().setScale(2, RoundingMode.DOWN);
        Long tickets = transactionTemplate.execute(status -> {
            Optional<WagerTracking> tracking = wagerDao.findForUpdate(periodId, username);
            if (!tracking.isPresent()) {
                wagerDao.insertIfAbsent(WagerTracking.builder()
                        .tenantId(tenantId)
                        .periodId(periodId)
                        .platformUsername(username)
                        .lastKnownWager(current)
                        .ticketsAwarded(0)
                        .build(), now);
                log.debug("trackPlayer(): baseline {} of player {} in period {}", current, username, periodId);
                return 0L;
            }

            BigDecimal delta = current.subtract(tracking.get().getLastKnownWager());
            if (delta.signum() <= 0) {
                return 0L;
            }
            Optional<WagerLink> link = wagerDao.findVerifiedLink(tenantId, username);
            if (!link.isPresent()) {
                wagerDao.advance(periodId, username, current, 0, now);
                return 0L;
            }
            long earned = delta.multiply(BigDecimal.valueOf(rate)).divide(THOUSAND, 0, RoundingMode.DOWN).longValueExact();
            if (earned <= 0) {
                // the settled mark stays so that small wagers add up
                return 0L;
            }

            long currentCents = current.movePointRight(2).longValueExact();
            LedgerOutcome outcome = ticketService.convert(tenantId, link.get().getUserId(), link.get().getKickName(), periodId,
                    ConversionRecord.wagerKey(currentCents), delta.movePointRight(2).longValueExact(), earned,
                    TicketSource.WAGER, "Wagered " + delta.toPlainString());
            switch (outcome.getStatus()) {
                case AWARDED:
                    wagerDao.advance(periodId, username, current, earned, now);
                    return earned;
                case DUPLICATE:
                    wagerDao.advance(periodId, username, current, 0, now);
                    return 0L;
                default:
                    log.warn("trackPlayer(): wager of player {} in period {} not converted: {}", username, periodId, outcome.getStatus());
                    return 0L;
            }
        });
        return tickets == null ? 0 : tickets;
    }

    private static Set<String> parseCodes(String codes) {
        if (StringUtils.isBlank(codes)) {
            return Collections.emptySet();
        }
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        CODES_SPLITTER.split(codes).forEach(code -> builder.add(code.toLowerCase(Locale.ROOT)));
        return builder.build();
    }

    private static boolean matchesCode(@Nonnull AffiliateWager wager, @Nonnull Set<String> codes) {
        return codes.isEmpty()
                || (wager.getCampaignCode() != null && codes.contains(wager.getCampaignCode().trim().toLowerCase(Locale.ROOT)));
    }

    private long getPeriodSeconds() {
        return configurationService.getLong(WAGER_PERIOD_SECONDS);
    }
}
