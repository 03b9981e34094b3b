package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WagerReport {
    public enum Status {
        UPDATED,
        NOT_CONFIGURED,
        NO_ACTIVE_PERIOD,
        FETCH_FAILED,
        FAILED
    }

    String tenantId;
    Status status;
    int playersSeen;
    int playersAwarded;
    long ticketsAwarded;
    int failures;

    public static WagerReport of(String tenantId, Status status) {
        return WagerReport.builder()
                .tenantId(tenantId)
                .status(status)
                .build();
    }
}
