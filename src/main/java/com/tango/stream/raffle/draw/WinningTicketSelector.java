package com.tango.stream.raffle.draw;

import com.tango.stream.raffle.model.WinningTicket;

import javax.annotation.Nonnull;

public interface WinningTicketSelector {

    /**
     * Picks a ticket uniformly from {@code [1, totalTickets]}.
     */
    @Nonnull
    WinningTicket select(long periodId, long totalTickets, int participants);

    /**
     * @return true if the seeds and nonce reproduce the ticket and the proof hash
     */
    boolean verify(@Nonnull WinningTicket ticket, long totalTickets);
}
