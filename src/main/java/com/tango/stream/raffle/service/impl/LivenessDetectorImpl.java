package com.tango.stream.raffle.service.impl;

import com.google.common.annotations.VisibleForTesting;
import com.tango.stream.raffle.model.TenantSession;
import com.tango.stream.raffle.service.LivenessDetector;
import com.tango.stream.raffle.service.TenantSessionStore;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Service
public class LivenessDetectorImpl implements LivenessDetector {
    static final Pair<String, Long> LIVENESS_WINDOW_SECONDS = Pair.of("liveness.window.seconds", 300L);
    static final Pair<String, Integer> LIVENESS_MIN_UNIQUE_CHATTERS = Pair.of("liveness.min.unique.chatters", 2);

    private final TenantSessionStore sessionStore;
    private final ConfigurationService configurationService;

    @Autowired
    public LivenessDetectorImpl(TenantSessionStore sessionStore, ConfigurationService configurationService) {
        this.sessionStore = sessionStore;
        this.configurationService = configurationService;
    }

    @Override
    public boolean isLive(@Nonnull String tenantId, @Nonnull Instant now, @Nonnull Duration window, int minUniqueChatters) {
        Optional<TenantSession> session = sessionStore.getSession(tenantId);
        return session.isPresent() && evaluate(session.get(), now, window, minUniqueChatters);
    }

    @Override
    public boolean isLive(@Nonnull String tenantId, @Nonnull Instant now) {
        return isLive(tenantId, now, getWindow(), configurationService.getInt(LIVENESS_MIN_UNIQUE_CHATTERS));
    }

    @Nonnull
    @Override
    public Duration getWindow() {
        return configurationService.getSeconds(LIVENESS_WINDOW_SECONDS);
    }

    @VisibleForTesting
    static boolean evaluate(@Nonnull TenantSession session, @Nonnull Instant now, @Nonnull Duration window, int minUniqueChatters) {
        if (session.isForceLive()) {
            return true;
        }
        Instant horizon = now.minus(window);
        Instant lastActivity = session.getLastActivityAt();
        if (lastActivity == null || lastActivity.isBefore(horizon)) {
            return false;
        }
        long uniqueChatters = session.getRecentChatters().values().stream()
                .filter(seen -> !seen.isBefore(horizon))
                .count();
        return uniqueChatters >= minUniqueChatters;
    }
}
