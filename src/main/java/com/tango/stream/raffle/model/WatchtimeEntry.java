package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class WatchtimeEntry {
    String tenantId;
    String username;
    long secondsWatched;
    Instant lastActive;

    public long getMinutes() {
        return secondsWatched / 60;
    }
}
