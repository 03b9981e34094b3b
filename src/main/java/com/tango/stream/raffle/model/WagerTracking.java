package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class WagerTracking {
    String tenantId;
    long periodId;
    String platformUsername;
    /**
     * Cumulative wager up to which tickets were settled.
     */
    BigDecimal lastKnownWager;
    long ticketsAwarded;
}
