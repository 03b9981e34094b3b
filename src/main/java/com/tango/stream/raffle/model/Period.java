package com.tango.stream.raffle.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.annotation.Nonnull;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Period {
    private long id;
    @Nonnull
    private String tenantId;
    @Nonnull
    private Instant startDate;
    @Nonnull
    private Instant endDate;
    @Nonnull
    private PeriodStatus status;
    private long totalTickets;

    public boolean isActive() {
        return status == PeriodStatus.ACTIVE;
    }

    public boolean hasEndedBy(@Nonnull Instant now) {
        return now.isAfter(endDate);
    }
}
