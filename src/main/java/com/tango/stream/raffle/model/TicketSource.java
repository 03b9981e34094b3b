package com.tango.stream.raffle.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ticket buckets of a balance row. The order of constants is the order in which
 * rounding remainders are handed back on removal.
 */
public enum TicketSource {
    WATCHTIME("watchtime", "watchtime_tickets"),
    GIFTED_SUB("gifted_sub", "gifted_sub_tickets"),
    WAGER("wager", "wager_tickets"),
    BONUS("bonus", "bonus_tickets");

    @Getter
    private final String code;
    @Getter
    private final String column;

    TicketSource(String code, String column) {
        this.code = code;
        this.column = column;
    }

    public static Optional<TicketSource> byCode(String code) {
        return Arrays.stream(values())
                .filter(source -> source.code.equalsIgnoreCase(code))
                .findAny();
    }
}
