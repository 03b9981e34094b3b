package com.tango.stream.raffle.model;

import com.tango.stream.raffle.model.events.NormalizedEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Result of decoding one websocket text frame.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DecodedFrame {
    public enum Kind {
        CONNECTION_ESTABLISHED,
        SUBSCRIPTION_SUCCEEDED,
        PING,
        PONG,
        EVENT,
        UNKNOWN,
        MALFORMED
    }

    @Nonnull
    Kind kind;
    /**
     * Pusher event name, if the frame had one.
     */
    @Nullable
    String eventName;
    @Nullable
    String channel;
    @Nullable
    String socketId;
    @Nullable
    NormalizedEvent event;
    @Nullable
    String error;

    public static DecodedFrame connectionEstablished(@Nullable String socketId) {
        return new DecodedFrame(Kind.CONNECTION_ESTABLISHED, "pusher:connection_established", null, socketId, null, null);
    }

    public static DecodedFrame control(@Nonnull Kind kind, @Nonnull String eventName, @Nullable String channel) {
        return new DecodedFrame(kind, eventName, channel, null, null, null);
    }

    public static DecodedFrame event(@Nonnull String eventName, @Nullable String channel, @Nonnull NormalizedEvent event) {
        return new DecodedFrame(Kind.EVENT, eventName, channel, null, event, null);
    }

    public static DecodedFrame unknown(@Nullable String eventName, @Nullable String channel) {
        return new DecodedFrame(Kind.UNKNOWN, eventName, channel, null, null, null);
    }

    public static DecodedFrame malformed(@Nullable String eventName, @Nonnull String error) {
        return new DecodedFrame(Kind.MALFORMED, eventName, null, null, null, error);
    }
}
