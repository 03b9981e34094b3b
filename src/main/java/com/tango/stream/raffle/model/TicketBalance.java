package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class TicketBalance {
    long rowId;
    long periodId;
    long userId;
    String kickName;
    long watchtimeTickets;
    long giftedSubTickets;
    long wagerTickets;
    long bonusTickets;
    long totalTickets;
    Instant lastUpdated;

    public long get(@Nonnull TicketSource source) {
        switch (source) {
            case WATCHTIME:
                return watchtimeTickets;
            case GIFTED_SUB:
                return giftedSubTickets;
            case WAGER:
                return wagerTickets;
            case BONUS:
                return bonusTickets;
            default:
                throw new IllegalArgumentException("Unknown source " + source);
        }
    }

    @Nonnull
    public Map<TicketSource, Long> getBreakdown() {
        Map<TicketSource, Long> breakdown = new EnumMap<>(TicketSource.class);
        for (TicketSource source : TicketSource.values()) {
            breakdown.put(source, get(source));
        }
        return breakdown;
    }

    public long sumOfSources() {
        return watchtimeTickets + giftedSubTickets + wagerTickets + bonusTickets;
    }
}
