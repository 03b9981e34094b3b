package com.tango.stream.raffle.service.impl;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.tango.stream.raffle.dao.WatchtimeDao;
import com.tango.stream.raffle.exceptions.LockAcquiringFail;
import com.tango.stream.raffle.model.AccrualReport;
import com.tango.stream.raffle.model.CallSpec;
import com.tango.stream.raffle.model.ConversionSummary;
import com.tango.stream.raffle.model.TenantSession;
import com.tango.stream.raffle.service.LivenessDetector;
import com.tango.stream.raffle.service.LocksService;
import com.tango.stream.raffle.service.TenantSessionStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.LongCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.tango.stream.raffle.model.Metrics.Counters.ACCRUAL_SKIPPED;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;
import static com.tango.stream.raffle.model.Metrics.Timers.ACCRUAL_TICK_TIME;
import static com.tango.stream.raffle.utils.NamedLocksHelper.getSchedulerLockName;

/**
 * Credits watchtime to viewers of live tenants once per tick and converts it into tickets.
 * One instance of the cluster does the work per tick.
 */
@Slf4j
@Service
public class AccrualScheduler {
    static final Pair<String, Boolean> ACCRUAL_ENABLED = Pair.of("raffle.accrual.enable", true);
    static final Pair<String, Long> ACCRUAL_PERIOD_SECONDS = Pair.of("raffle.accrual.period.seconds", 60L);
    static final Pair<String, Long> ACCRUAL_WAIT_TIME = Pair.of("raffle.accrual.lock.wait.time.ms", 1000L);
    static final Pair<String, Long> ACCRUAL_LEASE_TIME = Pair.of("raffle.accrual.lock.lease.time.ms", 50000L);
    static final String JOB_NAME = "accrual";

    private final ScheduledExecutorService accrualExecutorService = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
            .namingPattern("raffle-accrual-thread-%d")
            .daemon(true)
            .build());

    private final TenantSessionStore sessionStore;
    private final LivenessDetector livenessDetector;
    private final WatchtimeDao watchtimeDao;
    private final WatchtimeConverter watchtimeConverter;
    private final LocksService locksService;
    private final RedissonClient redissonClient;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public AccrualScheduler(TenantSessionStore sessionStore,
                            LivenessDetector livenessDetector,
                            WatchtimeDao watchtimeDao,
                            WatchtimeConverter watchtimeConverter,
                            LocksService locksService,
                            RedissonClient redissonClient,
                            ConfigurationService configurationService,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.sessionStore = sessionStore;
        this.livenessDetector = livenessDetector;
        this.watchtimeDao = watchtimeDao;
        this.watchtimeConverter = watchtimeConverter;
        this.locksService = locksService;
        this.redissonClient = redissonClient;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        accrualExecutorService.schedule(this::tick, getPeriodSeconds(), TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        accrualExecutorService.shutdownNow();
    }

    void tick() {
        try {
            if (configurationService.getBoolean(ACCRUAL_ENABLED)) {
                runAccrual();
            }
        } catch (LockAcquiringFail e) {
            log.debug("tick(): accrual runs on another instance");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (Exception e) {
            log.error("tick(): accrual failed", e);
        }
        accrualExecutorService.schedule(this::tick, getPeriodSeconds(), TimeUnit.SECONDS);
    }

    /**
     * @return reports of the tenants handled, empty if the tick already ran elsewhere
     */
    @Nonnull
    public List<AccrualReport> runAccrual() throws Exception {
        long periodSeconds = getPeriodSeconds();
        String lockName = getSchedulerLockName(JOB_NAME);
        return locksService.doUnderLock(CallSpec.<List<AccrualReport>>builder()
                .lockNames(ImmutableList.of(lockName))
                .action(() -> runAccrualUnderLock(lockName, periodSeconds))
                .waitTimeMs(configurationService.getLong(ACCRUAL_WAIT_TIME))
                .leaseTimeMs(configurationService.getLong(ACCRUAL_LEASE_TIME))
                .outsideTimer(meterRegistry.timer(ACCRUAL_TICK_TIME))
                .build());
    }

    private List<AccrualReport> runAccrualUnderLock(@Nonnull String lockName, long periodSeconds) {
        Instant now = clock.instant();
        RBucket<Long> lastTick = redissonClient.getBucket(lockName + ".lastTick", LongCodec.INSTANCE);
        Long previous = lastTick.get();
        // every instance ticks, the first one within the period does the work
        if (previous != null && now.toEpochMilli() - previous < periodSeconds * 900L) {
            log.debug("runAccrualUnderLock(): tick of {} already done", Instant.ofEpochMilli(previous));
            return Collections.emptyList();
        }
        lastTick.set(now.toEpochMilli());

        List<AccrualReport> reports = Lists.newArrayList();
        for (String tenantId : sessionStore.activeTenants()) {
            reports.add(accrueTenant(tenantId, now, periodSeconds));
        }
        log.info("runAccrualUnderLock(): {}", reports);
        return reports;
    }

    @VisibleForTesting
    @Nonnull
    AccrualReport accrueTenant(@Nonnull String tenantId, @Nonnull Instant now, long seconds) {
        try {
            Duration window = livenessDetector.getWindow();
            sessionStore.prune(tenantId, now, window);
            Optional<TenantSession> session = sessionStore.getSession(tenantId);
            if (!session.isPresent()) {
                return AccrualReport.of(tenantId, AccrualReport.Status.NO_SESSION);
            }
            if (!livenessDetector.isLive(tenantId, now)) {
                meterRegistry.counter(ACCRUAL_SKIPPED, Tags.of(TENANT, tenantId)).increment();
                return AccrualReport.of(tenantId, AccrualReport.Status.SKIPPED_OFFLINE);
            }

            Instant horizon = now.minus(window);
            Map<String, Instant> viewers = session.get().getActiveViewers().entrySet().stream()
                    .filter(viewer -> !viewer.getValue().isBefore(horizon))
                    .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
            if (!viewers.isEmpty()) {
                watchtimeDao.addSeconds(tenantId, viewers, seconds);
            }
            ConversionSummary conversion = watchtimeConverter.convert(tenantId);
            return AccrualReport.builder()
                    .tenantId(tenantId)
                    .status(AccrualReport.Status.ACCRUED)
                    .viewersCredited(viewers.size())
                    .secondsCredited(viewers.isEmpty() ? 0 : seconds)
                    .usersConverted(conversion.getUsersConverted())
                    .ticketsAwarded(conversion.getTicketsAwarded())
                    .failures(conversion.getFailures())
                    .build();
        } catch (RuntimeException e) {
            log.error("accrueTenant(): accrual of tenant {} failed", tenantId, e);
            return AccrualReport.of(tenantId, AccrualReport.Status.FAILED);
        }
    }

    private long getPeriodSeconds() {
        return configurationService.getLong(ACCRUAL_PERIOD_SECONDS);
    }
}
