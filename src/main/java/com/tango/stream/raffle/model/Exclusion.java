package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

@Value
@Builder
public class Exclusion {
    String tenantId;
    @Nullable
    String kickName;
    @Nullable
    Long userId;
    String reason;

    public boolean matches(Participant participant) {
        if (userId != null && userId == participant.getUserId()) {
            return true;
        }
        return kickName != null && kickName.equalsIgnoreCase(participant.getKickName());
    }
}
