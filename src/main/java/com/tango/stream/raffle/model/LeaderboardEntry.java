package com.tango.stream.raffle.model;

import lombok.Value;

@Value
public class LeaderboardEntry {
    int rank;
    TicketBalance balance;
}
