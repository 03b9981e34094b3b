package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

@Value
@Builder
public class GiftedSubRecord {
    String tenantId;
    long periodId;
    String gifterKickName;
    @Nullable
    Long gifterUserId;
    int subCount;
    long ticketsAwarded;
    String kickEventId;
    Instant giftedAt;
}
