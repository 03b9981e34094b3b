package com.tango.stream.raffle.model;

public enum GiftOutcome {
    AWARDED,
    DUPLICATE,
    NOT_LINKED,
    NO_ACTIVE_PERIOD,
    INVALID,
    FAILED
}
