package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.events.NormalizedEvent;

import javax.annotation.Nonnull;

public interface EventRouter {

    /**
     * Never throws: failures of consumers are logged and counted.
     */
    void route(@Nonnull String tenantId, @Nonnull NormalizedEvent event);
}
