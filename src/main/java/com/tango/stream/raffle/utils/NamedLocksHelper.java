package com.tango.stream.raffle.utils;

import javax.annotation.Nonnull;

public class NamedLocksHelper {
    private static final String DELIMITER = ".";
    private static final String SCHEDULER_LOCK_PREFIX = "RAFFLE_SCHEDULER.";
    private static final String PERIOD_LOCK_PREFIX = "RAFFLE_PERIOD.";

    @Nonnull
    public static String getSchedulerLockName(@Nonnull String job) {
        return SCHEDULER_LOCK_PREFIX + job;
    }

    @Nonnull
    public static String getPeriodLockName(@Nonnull String tenantId, long periodId) {
        return PERIOD_LOCK_PREFIX + String.join(DELIMITER, tenantId, String.valueOf(periodId));
    }
}
