package com.tango.stream.raffle.ingest.transport;

import com.tango.stream.raffle.exceptions.ChatTransportException;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Optional;

/**
 * Text frame connection. Implementations are used by a single receiving thread, {@link #close()}
 * may be called from any thread and wakes up a pending {@link #receive(Duration)}.
 */
public interface ChatConnection extends AutoCloseable {
    /**
     * @return next text frame or empty if nothing arrived within {@code timeout}
     * @throws ChatTransportException if the connection is closed or failed
     */
    @Nonnull
    Optional<String> receive(@Nonnull Duration timeout) throws ChatTransportException, InterruptedException;

    void send(@Nonnull String text) throws ChatTransportException;

    boolean isOpen();

    @Override
    void close();
}
