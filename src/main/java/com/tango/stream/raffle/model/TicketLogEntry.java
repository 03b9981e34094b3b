package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TicketLogEntry {
    long periodId;
    long userId;
    String kickName;
    long delta;
    String source;
    String description;
    Instant createdAt;
}
