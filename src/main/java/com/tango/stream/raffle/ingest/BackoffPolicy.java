package com.tango.stream.raffle.ingest;

import com.google.common.annotations.VisibleForTesting;
import com.tango.stream.raffle.service.impl.ConfigurationService;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential reconnect delay with symmetric jitter. Settings are re-read on every call.
 */
@Component
public class BackoffPolicy {
    static final Pair<String, Long> INITIAL_DELAY_MS = Pair.of("chat.reconnect.initial.delay.ms", 1000L);
    static final Pair<String, Double> MULTIPLIER = Pair.of("chat.reconnect.multiplier", 2.0);
    static final Pair<String, Long> MAX_DELAY_MS = Pair.of("chat.reconnect.max.delay.ms", 60000L);
    static final Pair<String, Double> JITTER = Pair.of("chat.reconnect.jitter", 0.2);

    private final ConfigurationService configurationService;

    @Autowired
    public BackoffPolicy(ConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    /**
     * @param attempt 1-based number of the failed attempt
     */
    public long delayMs(int attempt) {
        return computeDelayMs(
                configurationService.getLong(INITIAL_DELAY_MS),
                configurationService.getDouble(MULTIPLIER),
                configurationService.getLong(MAX_DELAY_MS),
                configurationService.getDouble(JITTER),
                attempt,
                ThreadLocalRandom.current().nextDouble(-1.0, 1.0));
    }

    /**
     * @param spread value in [-1, 1) scaling the jitter
     */
    @VisibleForTesting
    static long computeDelayMs(long initialMs, double multiplier, long maxMs, double jitter, int attempt, double spread) {
        double raw = initialMs * Math.pow(Math.max(1.0, multiplier), Math.max(0, attempt - 1));
        long capped = (long) Math.min(raw, (double) maxMs);
        if (jitter <= 0) {
            return capped;
        }
        return Math.max(0L, (long) (capped * (1.0 + jitter * spread)));
    }
}
