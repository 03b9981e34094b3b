package com.tango.stream.raffle.model;

import lombok.Value;

@Value
public class TicketRange {
    long userId;
    String kickName;
    long tickets;
    long startTicket;
    long endTicket;

    public boolean contains(long ticket) {
        return startTicket <= ticket && ticket <= endTicket;
    }
}
