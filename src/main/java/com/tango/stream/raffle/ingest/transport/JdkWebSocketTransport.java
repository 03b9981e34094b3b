package com.tango.stream.raffle.ingest.transport;

import com.tango.stream.raffle.exceptions.ChatTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.Nonnull;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Websocket transport on top of {@link java.net.http.HttpClient}.
 */
@Slf4j
@Component
public class JdkWebSocketTransport implements ChatTransport {
    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketTransport(@Value("${chat.connect.timeout.seconds:10}") long connectTimeoutSeconds) {
        this.connectTimeout = Duration.ofSeconds(connectTimeoutSeconds);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Nonnull
    @Override
    public ChatConnection connect(@Nonnull URI uri) throws ChatTransportException, InterruptedException {
        QueueingListener listener = new QueueingListener();
        try {
            WebSocket webSocket = httpClient.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, listener)
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return new JdkWebSocketConnection(webSocket, listener);
        } catch (ExecutionException e) {
            throw new ChatTransportException("Couldn't connect to " + uri.getHost(), e.getCause());
        } catch (TimeoutException e) {
            throw new ChatTransportException("Connect to " + uri.getHost() + " timed out", e);
        }
    }

    private static class Incoming {
        private final String text;
        private final String closeReason;

        private Incoming(String text, String closeReason) {
            this.text = text;
            this.closeReason = closeReason;
        }
    }

    private static class QueueingListener implements WebSocket.Listener {
        private final BlockingQueue<Incoming> incoming = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                incoming.add(new Incoming(partial.toString(), null));
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            incoming.add(new Incoming(null, "closed by peer: " + statusCode + " " + reason));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("onError(): websocket failed", error);
            incoming.add(new Incoming(null, "error: " + error));
        }
    }

    private static class JdkWebSocketConnection implements ChatConnection {
        private final WebSocket webSocket;
        private final QueueingListener listener;
        private final AtomicBoolean closed = new AtomicBoolean();

        private JdkWebSocketConnection(WebSocket webSocket, QueueingListener listener) {
            this.webSocket = webSocket;
            this.listener = listener;
        }

        @Nonnull
        @Override
        public Optional<String> receive(@Nonnull Duration timeout) throws ChatTransportException, InterruptedException {
            Incoming next = listener.incoming.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (next == null) {
                if (!isOpen()) {
                    throw new ChatTransportException("Connection is closed");
                }
                return Optional.empty();
            }
            if (next.closeReason != null) {
                closed.set(true);
                throw new ChatTransportException("Connection lost, " + next.closeReason);
            }
            return Optional.of(next.text);
        }

        @Override
        public void send(@Nonnull String text) throws ChatTransportException {
            if (!isOpen()) {
                throw new ChatTransportException("Connection is closed");
            }
            try {
                webSocket.sendText(text, true).get(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChatTransportException("Interrupted while sending", e);
            } catch (ExecutionException | TimeoutException e) {
                throw new ChatTransportException("Send failed", e);
            }
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !webSocket.isInputClosed() && !webSocket.isOutputClosed();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            listener.incoming.add(new Incoming(null, "closed locally"));
            if (!webSocket.isOutputClosed()) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                        .exceptionally(e -> {
                            log.debug("close(): close frame not sent", e);
                            webSocket.abort();
                            return webSocket;
                        });
            }
        }
    }
}
