package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccrualReport {
    public enum Status {
        ACCRUED,
        SKIPPED_OFFLINE,
        NO_SESSION,
        FAILED
    }

    String tenantId;
    Status status;
    int viewersCredited;
    long secondsCredited;
    int usersConverted;
    long ticketsAwarded;
    int failures;

    public static AccrualReport of(String tenantId, Status status) {
        return AccrualReport.builder()
                .tenantId(tenantId)
                .status(status)
                .build();
    }
}
