package com.tango.stream.raffle.service.impl;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.Lists;
import com.tango.stream.raffle.exceptions.LockAcquiringFail;
import com.tango.stream.raffle.model.CallSpec;
import com.tango.stream.raffle.service.LocksService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static com.tango.stream.raffle.model.Metrics.Counters.UNDER_LOCK_ERRORS;
import static com.tango.stream.raffle.model.Metrics.Tags.ERROR_TYPE;

@Slf4j
@Service
public class LocksServiceImpl implements LocksService {
    private final Cache<String, Lock> localNamedLockCache;
    private final RedissonClient redissonClient;
    private final MeterRegistry meterRegistry;

    @Autowired
    public LocksServiceImpl(RedissonClient redissonClient,
                            MeterRegistry meterRegistry) {
        this.redissonClient = redissonClient;
        this.meterRegistry = meterRegistry;
        localNamedLockCache = CacheBuilder.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(10L))
                .build();
    }

    @Override
    public <T> T doUnderLock(@Nonnull CallSpec<T> callSpec) throws Exception {
        if (callSpec.getOutsideTimer() != null) {
            return callSpec.getOutsideTimer().recordCallable(() -> doUnderLocalLock(callSpec));
        }
        return doUnderLocalLock(callSpec);
    }

    private <T> T doUnderLocalLock(@Nonnull CallSpec<T> callSpec) throws Exception {
        List<Lock> localLocks = getOrCreateLocalLocks(callSpec.getLockNames());
        List<Lock> acquiredLocks = Lists.newArrayList();
        try {
            //one scheduler thread per instance competes for the distributed lock
            tryAcquireLocalLocks(localLocks, callSpec.getLockNames(), callSpec.getWaitTimeMs(), acquiredLocks);
            return doUnderDistributedLock(callSpec);
        } catch (InterruptedException e) {
            log.error("doUnderLocalLock(): interrupted when work under lock: {}", callSpec.getLockNames(), e);
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "interrupts")).increment();
            Thread.currentThread().interrupt();
            throw e;
        } catch (LockAcquiringFail e) {
            log.debug("doUnderLocalLock(): couldn't acquire {} lock {}", e.getMessage(), callSpec.getLockNames());
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "not_acquired")).increment();
            throw e;
        } catch (Exception e) {
            log.error("doUnderLocalLock(): unexpected error when work under lock {}", callSpec.getLockNames(), e);
            meterRegistry.counter(UNDER_LOCK_ERRORS, Tags.of(ERROR_TYPE, "logic")).increment();
            throw e;
        } finally {
            releaseLocks(acquiredLocks);
        }
    }

    @SneakyThrows
    private <T> T doUnderDistributedLock(@Nonnull CallSpec<T> callSpec) {
        List<RLock> distributedLocks = callSpec.getLockNames().stream()
                .map(redissonClient::getLock)
                .collect(Collectors.toList());
        List<RLock> acquiredLocks = Lists.newArrayList();
        try {
            for (int i = 0; i < distributedLocks.size(); ++i) {
                RLock lock = distributedLocks.get(i);
                if (!lock.tryLock(callSpec.getWaitTimeMs(), callSpec.getLeaseTimeMs(), TimeUnit.MILLISECONDS)) {
                    throw new LockAcquiringFail("try_rlock_fail: " + callSpec.getLockNames().get(i));
                }
                acquiredLocks.add(lock);
            }
            return callSpec.getAction().call();
        } finally {
            releaseLocks(acquiredLocks);
        }
    }

    private void tryAcquireLocalLocks(@Nonnull List<Lock> localLocks,
                                      @Nonnull List<String> lockNames,
                                      long waitTimeMs,
                                      @Nonnull List<Lock> acquiredLocks) throws InterruptedException {
        for (int i = 0; i < localLocks.size(); ++i) {
            Lock lock = localLocks.get(i);
            if (!lock.tryLock(waitTimeMs, TimeUnit.MILLISECONDS)) {
                throw new LockAcquiringFail("try_llock_fail: " + lockNames.get(i));
            }
            acquiredLocks.add(lock);
        }
    }

    private void releaseLocks(@Nonnull List<? extends Lock> locks) {
        Lists.reverse(locks).forEach(Lock::unlock);
    }

    @Nonnull
    @SneakyThrows
    private Lock getOrCreateLocalLock(@Nonnull String name) {
        return localNamedLockCache.get(name, ReentrantLock::new);
    }

    @Nonnull
    private List<Lock> getOrCreateLocalLocks(@Nonnull List<String> lockNames) {
        return lockNames.stream().map(this::getOrCreateLocalLock).collect(Collectors.toList());
    }
}
