package com.tango.stream.raffle.service;

import javax.annotation.Nonnull;

public interface ChatSender {

    /**
     * @return false if the message was not delivered
     */
    boolean send(@Nonnull String tenantId, @Nonnull String message);
}
