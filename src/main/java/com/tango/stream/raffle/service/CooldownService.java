package com.tango.stream.raffle.service;

import javax.annotation.Nonnull;

public interface CooldownService {

    /**
     * @return true and start a new cooldown if the previous allowed call of the user is older than the cooldown
     */
    boolean allow(@Nonnull String tenantId, @Nonnull String userKey, long cooldownSeconds);
}
