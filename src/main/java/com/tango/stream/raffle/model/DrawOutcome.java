package com.tango.stream.raffle.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DrawOutcome {
    public enum Status {
        DRAWN,
        NO_PARTICIPANTS,
        PERIOD_NOT_FOUND,
        ALREADY_DRAWN
    }

    @Nonnull
    Status status;
    @Nullable
    DrawResult result;

    public static DrawOutcome drawn(@Nonnull DrawResult result) {
        return new DrawOutcome(Status.DRAWN, result);
    }

    public static DrawOutcome alreadyDrawn(@Nonnull DrawResult existing) {
        return new DrawOutcome(Status.ALREADY_DRAWN, existing);
    }

    public static DrawOutcome of(@Nonnull Status status) {
        return new DrawOutcome(status, null);
    }

    @Nonnull
    public Optional<DrawResult> getDrawResult() {
        return Optional.ofNullable(result);
    }
}
