package com.tango.stream.raffle.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tango.stream.raffle.dao.TenantConfigDao;
import com.tango.stream.raffle.exceptions.ChannelResolveException;
import com.tango.stream.raffle.model.KickChannel;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.model.TenantSession;
import com.tango.stream.raffle.model.events.ChatMessage;
import com.tango.stream.raffle.model.events.Heartbeat;
import com.tango.stream.raffle.restClients.KickChannelClient;
import com.tango.stream.raffle.service.TenantConfigService;
import com.tango.stream.raffle.service.impl.ConfigurationService;
import com.tango.stream.raffle.service.impl.TenantConfigServiceImpl;
import com.tango.stream.raffle.service.impl.TenantSessionStoreImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.env.StandardEnvironment;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.tango.stream.raffle.model.Metrics.Counters.*;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class KickChatClientTest {
    private static final String TENANT = "tenant-1";
    private static final Duration WAIT = Duration.ofSeconds(10);

    @Mock
    private TenantConfigService tenantConfigService;
    @Mock
    private EventDispatcher eventDispatcher;
    @Mock
    private BackoffPolicy backoffPolicy;

    private final FakeChatTransport transport = new FakeChatTransport();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final TenantSessionStoreImpl sessionStore = new TenantSessionStoreImpl(Clock.systemUTC());
    private final AtomicReference<TenantConfig> storedConfig = new AtomicReference<>();
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    private KickChatClient client;

    @BeforeEach
    void setUp() throws ChannelResolveException {
        storedConfig.set(config(42L, 9L));
        when(tenantConfigService.getConfig(TENANT)).thenAnswer(invocation -> Optional.ofNullable(storedConfig.get()));
        when(tenantConfigService.resolve(any(TenantConfig.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(backoffPolicy.delayMs(anyInt())).thenAnswer(invocation -> 10L * invocation.<Integer>getArgument(0));
        client = newClient(tenantConfigService);
    }

    private KickChatClient newClient(TenantConfigService configService) {
        ObjectMapper objectMapper = new ObjectMapper();
        return KickChatClient.builder()
                .tenantId(TENANT)
                .pusherUri(URI.create("wss://pusher.example/app/key"))
                .tenantConfigService(configService)
                .transport(transport)
                .frameDecoder(new FrameDecoder(objectMapper, Clock.systemUTC()))
                .sessionStore(sessionStore)
                .eventDispatcher(eventDispatcher)
                .backoffPolicy(backoffPolicy)
                .configurationService(new ConfigurationService(new StandardEnvironment(), "", 5000))
                .meterRegistry(meterRegistry)
                .objectMapper(objectMapper)
                .clock(Clock.systemUTC())
                .sleeper(sleeps::add)
                .build();
    }

    @AfterEach
    void tearDown() {
        client.stop();
        executor.shutdownNow();
    }

    @Test
    void shouldSubscribeAfterHandshake() throws Exception {
        FakeChatTransport.FakeConnection connection = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);

        Future<?> running = executor.submit(client);

        await().atMost(WAIT).until(() -> connection.sent.size() == 2);
        assertTrue(connection.sent.get(0).contains("\"event\":\"pusher:subscribe\""));
        assertTrue(connection.sent.get(0).contains("\"channel\":\"chatrooms.42.v2\""));
        assertTrue(connection.sent.get(1).contains("\"channel\":\"channel.9\""));
        assertTrue(sessionStore.getSession(TENANT).isPresent());

        client.stop();
        running.get(WAIT.getSeconds(), TimeUnit.SECONDS);
        assertFalse(connection.isOpen());
    }

    @Test
    void shouldAnswerPingsAndDispatchEvents() {
        FakeChatTransport.FakeConnection connection = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);

        connection.push("{\"event\":\"pusher:ping\",\"data\":{}}");
        connection.push("{\"event\":\"App\\\\Events\\\\ChatMessageEvent\",\"channel\":\"chatrooms.42.v2\","
                + "\"data\":\"{\\\"content\\\":\\\"hi\\\",\\\"sender\\\":{\\\"username\\\":\\\"Alice\\\"}}\"}");
        connection.push("{\"event\":\"pusher:pong\",\"data\":{}}");

        await().atMost(WAIT).until(() -> connection.sentContaining("pusher:pong"));
        verify(eventDispatcher, timeout(WAIT.toMillis())).dispatch(eq(TENANT), any(ChatMessage.class));
        verify(eventDispatcher, timeout(WAIT.toMillis())).dispatch(eq(TENANT), any(Heartbeat.class));
        TenantSession session = sessionStore.getSession(TENANT).orElseThrow(AssertionError::new);
        assertTrue(session.getRecentChatters().containsKey("alice"));
    }

    @Test
    void shouldSurviveMalformedFrames() {
        FakeChatTransport.FakeConnection connection = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);

        connection.push("{garbage");
        connection.push("{\"event\":\"App\\\\Events\\\\ChatMessageEvent\",\"data\":\"{\\\"content\\\":\\\"no sender\\\"}\"}");
        connection.push("{\"event\":\"App\\\\Events\\\\StreamHostEvent\",\"data\":\"{}\"}");
        connection.push("{\"event\":\"App\\\\Events\\\\ChatMessageEvent\",\"data\":\"{\\\"content\\\":\\\"ok\\\",\\\"sender\\\":{\\\"username\\\":\\\"bob\\\"}}\"}");

        verify(eventDispatcher, timeout(WAIT.toMillis())).dispatch(eq(TENANT), any(ChatMessage.class));
        assertEquals(2.0, meterRegistry.counter(CHAT_MALFORMED_FRAMES, "tenant", TENANT).count());
        assertEquals(1.0, meterRegistry.counter(CHAT_UNKNOWN_FRAMES, "tenant", TENANT).count());
        assertEquals(1, transport.connections.size());
        assertTrue(connection.isOpen());
    }

    @Test
    void shouldPingWhenIdle() {
        FakeChatTransport.FakeConnection connection = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);

        connection.idle();

        await().atMost(WAIT).until(() -> connection.sentContaining("pusher:ping"));
        assertTrue(connection.isOpen());
    }

    @Test
    void shouldResubscribeOnceWhenTargetChanges() {
        FakeChatTransport.FakeConnection first = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        FakeChatTransport.FakeConnection second = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);
        await().atMost(WAIT).until(() -> first.sent.size() == 2);

        storedConfig.set(config(43L, null));
        first.idle();

        await().atMost(WAIT).until(() -> second.sentContaining("chatrooms.43.v2"));
        assertFalse(first.isOpen());
        assertFalse(second.sentContaining("channel.9"));
        assertEquals(1.0, meterRegistry.counter(CHAT_RELOADS, "tenant", TENANT).count());
        assertEquals(0.0, meterRegistry.counter(CHAT_RECONNECTS, "tenant", TENANT).count());

        second.idle();
        await().atMost(WAIT).until(() -> second.sentContaining("pusher:ping"));
        assertEquals(2, transport.connections.size());
    }

    @Test
    void shouldLookUpNewChatroomWhenOnlySlugChanges() {
        TenantConfigDao tenantConfigDao = mock(TenantConfigDao.class);
        KickChannelClient kickChannelClient = mock(KickChannelClient.class);
        AtomicReference<TenantConfig> row = new AtomicReference<>(TenantConfig.builder()
                .tenantId(TENANT)
                .channelSlug("old-streamer")
                .build());
        when(tenantConfigDao.find(TENANT)).thenAnswer(invocation -> Optional.of(row.get()));
        when(tenantConfigDao.saveChatroomId(eq(TENANT), anyString(), anyLong())).thenAnswer(invocation -> {
            row.set(row.get().toBuilder()
                    .chatroomId(invocation.getArgument(2))
                    .resolvedSlug(invocation.getArgument(1))
                    .build());
            return true;
        });
        when(kickChannelClient.getChannel("old-streamer")).thenReturn(new KickChannel(1L, "old-streamer", new KickChannel.Chatroom(111L)));
        when(kickChannelClient.getChannel("new-streamer")).thenReturn(new KickChannel(2L, "new-streamer", new KickChannel.Chatroom(222L)));
        client = newClient(new TenantConfigServiceImpl(tenantConfigDao, kickChannelClient));
        FakeChatTransport.FakeConnection first = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        FakeChatTransport.FakeConnection second = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);
        await().atMost(WAIT).until(() -> first.sentContaining("chatrooms.111.v2"));

        row.set(row.get().toBuilder()
                .channelSlug("new-streamer")
                .revision(1)
                .build());
        first.idle();

        await().atMost(WAIT).until(() -> second.sentContaining("chatrooms.222.v2"));
        assertFalse(second.sentContaining("chatrooms.111.v2"));
        assertFalse(first.isOpen());
        assertEquals(1.0, meterRegistry.counter(CHAT_RELOADS, "tenant", TENANT).count());

        second.idle();
        await().atMost(WAIT).until(() -> second.sentContaining("pusher:ping"));
        assertEquals(2, transport.connections.size());
        verify(kickChannelClient, times(1)).getChannel("new-streamer");
    }

    @Test
    void shouldBackOffAfterFailures() {
        transport.nextFailure("refused");
        transport.nextFailure("refused again");
        FakeChatTransport.FakeConnection connection = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);

        await().atMost(WAIT).until(() -> connection.sent.size() == 2);
        assertEquals(2, sleeps.size());
        assertEquals(10L, sleeps.get(0));
        assertEquals(20L, sleeps.get(1));
        assertEquals(2.0, meterRegistry.counter(CHAT_RECONNECTS, "tenant", TENANT).count());
    }

    @Test
    void shouldResetBackoffAfterHealthySession() {
        transport.nextFailure("refused");
        FakeChatTransport.FakeConnection first = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        FakeChatTransport.FakeConnection third = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);
        await().atMost(WAIT).until(() -> first.sent.size() == 2);

        first.drop();

        await().atMost(WAIT).until(() -> third.sent.size() == 2);
        assertEquals(2, sleeps.size());
        assertEquals(10L, sleeps.get(0));
        assertEquals(10L, sleeps.get(1));
    }

    @Test
    void shouldRetryWhenHandshakeIsWrong() {
        FakeChatTransport.FakeConnection wrong = transport.nextConnection().push("{\"event\":\"pusher:pong\"}");
        FakeChatTransport.FakeConnection right = transport.nextConnection().push(FakeChatTransport.ESTABLISHED);
        executor.submit(client);

        await().atMost(WAIT).until(() -> right.sent.size() == 2);
        assertTrue(wrong.sent.isEmpty());
        assertFalse(wrong.isOpen());
        assertEquals(1, sleeps.size());
    }

    @Test
    void shouldExitWhenConfigurationIsRemoved() throws Exception {
        storedConfig.set(null);

        Future<?> running = executor.submit(client);

        running.get(WAIT.getSeconds(), TimeUnit.SECONDS);
        assertTrue(transport.connections.isEmpty());
    }

    private static TenantConfig config(long chatroomId, Long channelId) {
        return TenantConfig.builder()
                .tenantId(TENANT)
                .channelSlug("streamer")
                .chatroomId(chatroomId)
                .channelId(channelId)
                .build();
    }
}
