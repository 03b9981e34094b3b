package com.tango.stream.raffle.model;

import lombok.Value;

@Value
public class ConversionSummary {
    public static final ConversionSummary EMPTY = new ConversionSummary(0, 0, 0);

    int usersConverted;
    long ticketsAwarded;
    int failures;
}
