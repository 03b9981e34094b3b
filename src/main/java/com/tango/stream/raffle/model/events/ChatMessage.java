package com.tango.stream.raffle.model.events;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nonnull;
import java.time.Instant;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ChatMessage extends NormalizedEvent {
    /**
     * Lowercased platform username.
     */
    @Nonnull
    private final String user;
    @Nonnull
    private final String text;

    public ChatMessage(@Nonnull String user, @Nonnull String text, @Nonnull Instant at) {
        super(at);
        this.user = user;
        this.text = text;
    }

    @Nonnull
    @Override
    public EventType getType() {
        return EventType.CHAT_MESSAGE;
    }
}
