package com.tango.stream.raffle.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.exceptions.ChannelResolveException;
import com.tango.stream.raffle.exceptions.ChatTransportException;
import com.tango.stream.raffle.ingest.transport.ChatConnection;
import com.tango.stream.raffle.ingest.transport.ChatTransport;
import com.tango.stream.raffle.model.DecodedFrame;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.model.events.ChatMessage;
import com.tango.stream.raffle.model.events.Heartbeat;
import com.tango.stream.raffle.model.events.NormalizedEvent;
import com.tango.stream.raffle.service.TenantConfigService;
import com.tango.stream.raffle.service.TenantSessionStore;
import com.tango.stream.raffle.service.impl.ConfigurationService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static com.tango.stream.raffle.model.Metrics.Counters.*;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;

/**
 * Chat connection of one tenant. {@link #run()} keeps the tenant subscribed until {@link #stop()}:
 * transport failures are retried with backoff, a changed chat target makes it resubscribe.
 */
@Slf4j
public class KickChatClient implements Runnable {
    static final Pair<String, Long> IDLE_TIMEOUT_SECONDS = Pair.of("chat.idle.timeout.seconds", 30L);

    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private enum SessionEnd {
        STOPPED,
        RELOAD
    }

    @Getter
    private final String tenantId;
    private final URI pusherUri;
    private final TenantConfigService tenantConfigService;
    private final ChatTransport transport;
    private final FrameDecoder frameDecoder;
    private final TenantSessionStore sessionStore;
    private final EventDispatcher eventDispatcher;
    private final BackoffPolicy backoffPolicy;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sleeper sleeper;

    private final AtomicReference<ChatConnection> connection = new AtomicReference<>();
    private volatile boolean stopped;
    private volatile boolean receiving;

    @Builder
    private KickChatClient(@NonNull String tenantId,
                           @NonNull URI pusherUri,
                           @NonNull TenantConfigService tenantConfigService,
                           @NonNull ChatTransport transport,
                           @NonNull FrameDecoder frameDecoder,
                           @NonNull TenantSessionStore sessionStore,
                           @NonNull EventDispatcher eventDispatcher,
                           @NonNull BackoffPolicy backoffPolicy,
                           @NonNull ConfigurationService configurationService,
                           @NonNull MeterRegistry meterRegistry,
                           @NonNull ObjectMapper objectMapper,
                           @NonNull Clock clock,
                           @Nullable Sleeper sleeper) {
        this.tenantId = tenantId;
        this.pusherUri = pusherUri;
        this.tenantConfigService = tenantConfigService;
        this.transport = transport;
        this.frameDecoder = frameDecoder;
        this.sessionStore = sessionStore;
        this.eventDispatcher = eventDispatcher;
        this.backoffPolicy = backoffPolicy;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sleeper = sleeper != null ? sleeper : Thread::sleep;
    }

    @Override
    public void run() {
        sessionStore.openSession(tenantId);
        int attempt = 0;
        while (!isStopped()) {
            receiving = false;
            try {
                Optional<TenantConfig> config = tenantConfigService.getConfig(tenantId);
                if (!config.isPresent()) {
                    log.warn("run(): configuration of tenant {} is gone, chat client exits", tenantId);
                    return;
                }
                SessionEnd end = runSession(tenantConfigService.resolve(config.get()));
                attempt = 0;
                if (end == SessionEnd.RELOAD) {
                    log.info("run(): chat target of tenant {} changed, resubscribing", tenantId);
                    meterRegistry.counter(CHAT_RELOADS, Tags.of(TENANT, tenantId)).increment();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ChatTransportException | ChannelResolveException | RuntimeException e) {
                if (isStopped()) {
                    break;
                }
                if (receiving) {
                    attempt = 0;
                }
                attempt++;
                long delayMs = backoffPolicy.delayMs(attempt);
                log.warn("run(): chat of tenant {} failed, attempt {}, reconnecting in {} ms: {}", tenantId, attempt, delayMs, e.toString());
                log.debug("run(): chat failure of tenant {}", tenantId, e);
                meterRegistry.counter(CHAT_RECONNECTS, Tags.of(TENANT, tenantId)).increment();
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            } finally {
                closeConnection();
            }
        }
        log.info("run(): chat client of tenant {} stopped", tenantId);
    }

    /**
     * Makes {@link #run()} return. Safe to call from any thread.
     */
    public void stop() {
        stopped = true;
        closeConnection();
    }

    public boolean isStopped() {
        return stopped || Thread.currentThread().isInterrupted();
    }

    private SessionEnd runSession(@Nonnull TenantConfig config) throws ChatTransportException, InterruptedException {
        ChatConnection current = transport.connect(pusherUri);
        connection.set(current);
        if (stopped) {
            return SessionEnd.STOPPED;
        }
        Duration idleTimeout = configurationService.getSeconds(IDLE_TIMEOUT_SECONDS);
        awaitConnectionEstablished(current, idleTimeout);

        subscribe(current, "chatrooms." + config.getChatroomId() + ".v2");
        if (config.getChannelId() != null) {
            subscribe(current, "channel." + config.getChannelId());
        }
        receiving = true;

        Instant lastReloadCheck = clock.instant();
        while (!isStopped()) {
            Optional<String> text = current.receive(idleTimeout);
            Instant now = clock.instant();
            if (!text.isPresent()) {
                lastReloadCheck = now;
                if (reloadPending(config)) {
                    return SessionEnd.RELOAD;
                }
                current.send(controlFrame(FrameDecoder.PING));
                continue;
            }
            handleFrame(current, text.get(), now);
            // a busy socket never times out
            if (Duration.between(lastReloadCheck, now).compareTo(idleTimeout) > 0) {
                lastReloadCheck = now;
                if (reloadPending(config)) {
                    return SessionEnd.RELOAD;
                }
            }
        }
        return SessionEnd.STOPPED;
    }

    private void awaitConnectionEstablished(ChatConnection current, Duration timeout) throws ChatTransportException, InterruptedException {
        Optional<String> text = current.receive(timeout);
        if (!text.isPresent()) {
            throw new ChatTransportException("No connection_established within " + timeout);
        }
        DecodedFrame frame = frameDecoder.decode(text.get());
        if (frame.getKind() != DecodedFrame.Kind.CONNECTION_ESTABLISHED) {
            throw new ChatTransportException("Expected connection_established, got " + frame.getEventName());
        }
        log.info("awaitConnectionEstablished(): tenant {} connected, socket_id={}", tenantId, frame.getSocketId());
    }

    private void subscribe(ChatConnection current, String channel) throws ChatTransportException {
        current.send(toJson(ImmutableMap.of(
                "event", FrameDecoder.SUBSCRIBE,
                "data", ImmutableMap.of("auth", "", "channel", channel))));
        log.info("subscribe(): tenant {} subscribes to {}", tenantId, channel);
    }

    private void handleFrame(ChatConnection current, String text, Instant now) throws ChatTransportException {
        meterRegistry.counter(CHAT_FRAMES, Tags.of(TENANT, tenantId)).increment();
        DecodedFrame frame = frameDecoder.decode(text);
        switch (frame.getKind()) {
            case PING:
                current.send(controlFrame(FrameDecoder.PONG));
                break;
            case PONG:
                eventDispatcher.dispatch(tenantId, new Heartbeat(now));
                break;
            case SUBSCRIPTION_SUCCEEDED:
                log.info("handleFrame(): tenant {} subscribed to {}", tenantId, frame.getChannel());
                break;
            case CONNECTION_ESTABLISHED:
                log.debug("handleFrame(): repeated connection_established for tenant {}", tenantId);
                break;
            case EVENT:
                onEvent(frame.getEvent());
                break;
            case UNKNOWN:
                log.debug("handleFrame(): unknown event {} on {} for tenant {}", frame.getEventName(), frame.getChannel(), tenantId);
                meterRegistry.counter(CHAT_UNKNOWN_FRAMES, Tags.of(TENANT, tenantId)).increment();
                break;
            case MALFORMED:
            default:
                log.warn("handleFrame(): malformed frame {} for tenant {}: {}", frame.getEventName(), tenantId, frame.getError());
                meterRegistry.counter(CHAT_MALFORMED_FRAMES, Tags.of(TENANT, tenantId)).increment();
                break;
        }
    }

    private void onEvent(@Nullable NormalizedEvent event) {
        if (event == null) {
            return;
        }
        if (event instanceof ChatMessage) {
            ChatMessage message = (ChatMessage) event;
            sessionStore.recordChatActivity(tenantId, message.getUser(), message.getAt());
        }
        eventDispatcher.dispatch(tenantId, event);
    }

    private boolean reloadPending(@Nonnull TenantConfig subscribed) {
        try {
            Optional<TenantConfig> fresh = tenantConfigService.getConfig(tenantId);
            if (!fresh.isPresent()) {
                return true;
            }
            return subscribed.targetDiffers(fresh.get());
        } catch (RuntimeException e) {
            log.warn("reloadPending(): configuration of tenant {} is not readable, keeping subscription", tenantId, e);
            return false;
        }
    }

    private String controlFrame(String event) {
        return toJson(ImmutableMap.of("event", event, "data", ImmutableMap.of()));
    }

    private String toJson(Object frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Frame is not serializable: " + frame, e);
        }
    }

    private void closeConnection() {
        ChatConnection current = connection.getAndSet(null);
        if (current != null) {
            current.close();
        }
    }
}
