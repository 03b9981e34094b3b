package com.tango.stream.raffle.ingest.transport;

import com.tango.stream.raffle.exceptions.ChatTransportException;

import javax.annotation.Nonnull;
import java.net.URI;

public interface ChatTransport {
    @Nonnull
    ChatConnection connect(@Nonnull URI uri) throws ChatTransportException, InterruptedException;
}
