package com.tango.stream.raffle.model;

public enum PeriodStatus {
    ACTIVE,
    ENDED
}
