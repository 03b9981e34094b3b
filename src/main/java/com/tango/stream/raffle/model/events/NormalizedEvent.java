package com.tango.stream.raffle.model.events;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nonnull;
import java.time.Instant;

/**
 * Platform independent event produced by the chat decoder.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class NormalizedEvent {
    @Nonnull
    private final Instant at;

    protected NormalizedEvent(@Nonnull Instant at) {
        this.at = at;
    }

    @Nonnull
    public abstract EventType getType();
}
