package com.tango.stream.raffle.utils;

import org.jetbrains.annotations.Nullable;

import java.sql.Timestamp;
import java.time.Instant;

public final class TimeUtils {
    private TimeUtils() {
    }

    @Nullable
    public static Timestamp instantToTimestamp(@Nullable Instant instant) {
        return instant == null
                ? null
                : Timestamp.from(instant);
    }

    @Nullable
    public static Instant timestampToInstant(@Nullable Timestamp timestamp) {
        return timestamp == null
                ? null
                : timestamp.toInstant();
    }
}
