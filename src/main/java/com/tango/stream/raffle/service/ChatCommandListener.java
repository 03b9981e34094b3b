package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.events.ChatMessage;

import javax.annotation.Nonnull;

/**
 * Receives chat requests that start with the configured prefix and passed the per-user cooldown.
 */
public interface ChatCommandListener {

    void onRequest(@Nonnull String tenantId, @Nonnull ChatMessage message, @Nonnull String arguments);
}
