package com.tango.stream.raffle.service;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;

public interface LivenessDetector {

    /**
     * A tenant is live when it had chat activity within the window and at least
     * {@code minUniqueChatters} distinct users chatted within it, or when forced live.
     */
    boolean isLive(@Nonnull String tenantId, @Nonnull Instant now, @Nonnull Duration window, int minUniqueChatters);

    /**
     * Same as above with the configured window and chatter threshold.
     */
    boolean isLive(@Nonnull String tenantId, @Nonnull Instant now);

    @Nonnull
    Duration getWindow();
}
