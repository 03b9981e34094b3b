package com.tango.stream.raffle.draw;

import com.google.common.collect.ImmutableList;
import com.tango.stream.raffle.model.Participant;
import com.tango.stream.raffle.model.TicketRange;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Lays participants out on one ticket line starting at 1: each participant owns
 * {@code [start, start + tickets - 1]} and the next one starts right after.
 */
public final class TicketRangeAllocator {
    private TicketRangeAllocator() {
    }

    @Nonnull
    public static List<TicketRange> allocate(@Nonnull List<Participant> participants) {
        ImmutableList.Builder<TicketRange> ranges = ImmutableList.builder();
        long next = 1;
        for (Participant participant : participants) {
            if (participant.getTickets() <= 0) {
                continue;
            }
            long end = Math.addExact(next, participant.getTickets() - 1);
            ranges.add(new TicketRange(participant.getUserId(), participant.getKickName(), participant.getTickets(), next, end));
            next = end + 1;
        }
        return ranges.build();
    }

    public static long totalTickets(@Nonnull List<TicketRange> ranges) {
        return ranges.isEmpty() ? 0 : ranges.get(ranges.size() - 1).getEndTicket();
    }

    /**
     * Binary search over contiguous ranges.
     */
    @Nonnull
    public static Optional<TicketRange> findOwner(@Nonnull List<TicketRange> ranges, long ticket) {
        int low = 0;
        int high = ranges.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            TicketRange range = ranges.get(mid);
            if (ticket < range.getStartTicket()) {
                high = mid - 1;
            } else if (ticket > range.getEndTicket()) {
                low = mid + 1;
            } else {
                return Optional.of(range);
            }
        }
        return Optional.empty();
    }
}
