package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SimulationResult {
    long periodId;
    int rounds;
    long totalTickets;
    /**
     * Observed wins keyed by user id.
     */
    @Singular
    Map<Long, Long> wins;
    /**
     * Ticket share keyed by user id.
     */
    @Singular("expectedShare")
    Map<Long, Double> expectedShares;

    public double observedShare(long userId) {
        return rounds == 0 ? 0.0 : wins.getOrDefault(userId, 0L) / (double) rounds;
    }
}
