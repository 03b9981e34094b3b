package com.tango.stream.raffle.service.impl;

import com.google.common.collect.ImmutableList;
import com.tango.stream.raffle.exceptions.LockAcquiringFail;
import com.tango.stream.raffle.model.CallSpec;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.service.LocksService;
import com.tango.stream.raffle.service.PeriodService;
import com.tango.stream.raffle.service.TenantConfigService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.tango.stream.raffle.model.Metrics.Timers.PERIOD_TRANSITION_TIME;
import static com.tango.stream.raffle.utils.NamedLocksHelper.getSchedulerLockName;

@Slf4j
@Service
public class PeriodTransitionScheduler {
    static final Pair<String, Boolean> TRANSITION_ENABLED = Pair.of("raffle.period.transition.enable", true);
    static final Pair<String, Long> TRANSITION_PERIOD_SECONDS = Pair.of("raffle.period.transition.period.seconds", 60L);
    static final Pair<String, Long> TRANSITION_WAIT_TIME = Pair.of("raffle.period.transition.lock.wait.time.ms", 1000L);
    static final Pair<String, Long> TRANSITION_LEASE_TIME = Pair.of("raffle.period.transition.lock.lease.time.ms", 50000L);
    static final String JOB_NAME = "period-transition";

    private final ScheduledExecutorService transitionExecutorService = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
            .namingPattern("raffle-period-thread-%d")
            .daemon(true)
            .build());

    private final TenantConfigService tenantConfigService;
    private final PeriodService periodService;
    private final LocksService locksService;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public PeriodTransitionScheduler(TenantConfigService tenantConfigService,
                                     PeriodService periodService,
                                     LocksService locksService,
                                     ConfigurationService configurationService,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.tenantConfigService = tenantConfigService;
        this.periodService = periodService;
        this.locksService = locksService;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        transitionExecutorService.schedule(this::tick, 0, TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        transitionExecutorService.shutdownNow();
    }

    void tick() {
        try {
            if (configurationService.getBoolean(TRANSITION_ENABLED)) {
                runTransitions();
            }
        } catch (LockAcquiringFail e) {
            log.debug("tick(): period transitions run on another instance");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (Exception e) {
            log.error("tick(): period transitions failed", e);
        }
        transitionExecutorService.schedule(this::tick, configurationService.getLong(TRANSITION_PERIOD_SECONDS), TimeUnit.SECONDS);
    }

    public Map<PeriodService.Transition, Integer> runTransitions() throws Exception {
        return locksService.doUnderLock(CallSpec.<Map<PeriodService.Transition, Integer>>builder()
                .lockNames(ImmutableList.of(getSchedulerLockName(JOB_NAME)))
                .action(this::runTransitionsUnderLock)
                .waitTimeMs(configurationService.getLong(TRANSITION_WAIT_TIME))
                .leaseTimeMs(configurationService.getLong(TRANSITION_LEASE_TIME))
                .outsideTimer(meterRegistry.timer(PERIOD_TRANSITION_TIME))
                .build());
    }

    private Map<PeriodService.Transition, Integer> runTransitionsUnderLock() {
        Instant now = clock.instant();
        Map<PeriodService.Transition, Integer> transitions = new EnumMap<>(PeriodService.Transition.class);
        for (TenantConfig tenant : tenantConfigService.getEnabledTenants()) {
            try {
                PeriodService.Transition transition = periodService.checkPeriodTransition(tenant.getTenantId(), now);
                transitions.merge(transition, 1, Integer::sum);
            } catch (RuntimeException e) {
                log.error("runTransitionsUnderLock(): period check of tenant {} failed", tenant.getTenantId(), e);
            }
        }
        log.debug("runTransitionsUnderLock(): {}", transitions);
        return transitions;
    }
}
