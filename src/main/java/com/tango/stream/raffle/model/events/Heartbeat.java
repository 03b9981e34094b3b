package com.tango.stream.raffle.model.events;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import javax.annotation.Nonnull;
import java.time.Instant;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Heartbeat extends NormalizedEvent {

    public Heartbeat(@Nonnull Instant at) {
        super(at);
    }

    @Nonnull
    @Override
    public EventType getType() {
        return EventType.HEARTBEAT;
    }
}
