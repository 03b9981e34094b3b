package com.tango.stream.raffle.model.events;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class GiftSubscription extends NormalizedEvent {
    @Nonnull
    private final String gifterUser;
    private final int recipientCount;
    @Nullable
    private final String eventId;

    public GiftSubscription(@Nonnull String gifterUser, int recipientCount, @Nullable String eventId, @Nonnull Instant at) {
        super(at);
        this.gifterUser = gifterUser;
        this.recipientCount = recipientCount;
        this.eventId = eventId;
    }

    @Nonnull
    @Override
    public EventType getType() {
        return EventType.GIFT_SUBSCRIPTION;
    }
}
