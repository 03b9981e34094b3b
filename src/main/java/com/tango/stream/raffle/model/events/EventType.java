package com.tango.stream.raffle.model.events;

public enum EventType {
    CHAT_MESSAGE,
    GIFT_SUBSCRIPTION,
    HEARTBEAT
}
