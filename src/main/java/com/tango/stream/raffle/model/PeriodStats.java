package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PeriodStats {
    long periodId;
    long totalParticipants;
    long totalTickets;
    long watchtimeTickets;
    long giftedSubTickets;
    long wagerTickets;
    long bonusTickets;
}
