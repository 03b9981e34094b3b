package com.tango.stream.raffle.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nonnull;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerOutcome {
    public enum Status {
        AWARDED,
        REMOVED,
        DUPLICATE,
        NO_ACTIVE_PERIOD,
        /**
         * The period has ended or was drawn, its balances are frozen.
         */
        PERIOD_CLOSED,
        NO_BALANCE,
        INVALID
    }

    @Nonnull
    Status status;
    long periodId;
    /**
     * Signed change actually applied to the balance.
     */
    long delta;
    long newTotal;

    public static LedgerOutcome awarded(long periodId, long amount, long newTotal) {
        return new LedgerOutcome(Status.AWARDED, periodId, amount, newTotal);
    }

    public static LedgerOutcome removed(long periodId, long removed, long newTotal) {
        return new LedgerOutcome(Status.REMOVED, periodId, -removed, newTotal);
    }

    public static LedgerOutcome duplicate(long periodId) {
        return new LedgerOutcome(Status.DUPLICATE, periodId, 0, 0);
    }

    public static LedgerOutcome closed(long periodId) {
        return new LedgerOutcome(Status.PERIOD_CLOSED, periodId, 0, 0);
    }

    public static LedgerOutcome of(@Nonnull Status status) {
        return new LedgerOutcome(status, 0, 0, 0);
    }

    public boolean isApplied() {
        return status == Status.AWARDED || status == Status.REMOVED;
    }
}
