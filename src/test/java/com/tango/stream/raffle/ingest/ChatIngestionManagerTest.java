package com.tango.stream.raffle.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.tango.stream.raffle.exceptions.ChannelResolveException;
import com.tango.stream.raffle.ingest.transport.ChatTransport;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.model.events.ChatMessage;
import com.tango.stream.raffle.service.EventRouter;
import com.tango.stream.raffle.service.TenantConfigService;
import com.tango.stream.raffle.service.impl.ConfigurationService;
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

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChatIngestionManagerTest {
    private static final Duration WAIT = Duration.ofSeconds(10);

    @Mock
    private TenantConfigService tenantConfigService;
    @Mock
    private EventRouter eventRouter;

    private final Map<String, TenantConfig> configs = new ConcurrentHashMap<>();
    private final List<FakeChatTransport.FakeConnection> connections = new CopyOnWriteArrayList<>();
    private final TenantSessionStoreImpl sessionStore = new TenantSessionStoreImpl(Clock.systemUTC());
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private EventDispatcher eventDispatcher;
    private ChatIngestionManager manager;

    @BeforeEach
    void setUp() throws ChannelResolveException {
        configs.put("a", config("a", 1L));
        configs.put("b", config("b", 2L));
        when(tenantConfigService.getConfig(anyString())).thenAnswer(invocation -> Optional.ofNullable(configs.get(invocation.<String>getArgument(0))));
        when(tenantConfigService.getEnabledTenants()).thenAnswer(invocation -> ImmutableList.copyOf(configs.values()));
        when(tenantConfigService.resolve(any(TenantConfig.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ConfigurationService configurationService = new ConfigurationService(new StandardEnvironment(), "", 5000);
        configurationService.update(configuration -> {
            configuration.setProperty("chat.reconnect.initial.delay.ms", 10L);
            configuration.setProperty("chat.reconnect.jitter", 0.0);
        });
        ChatTransport transport = uri -> {
            FakeChatTransport.FakeConnection connection = new FakeChatTransport.FakeConnection().push(FakeChatTransport.ESTABLISHED);
            connections.add(connection);
            return connection;
        };
        ObjectMapper objectMapper = new ObjectMapper();
        eventDispatcher = new EventDispatcher(eventRouter, meterRegistry, 2, 100);
        manager = new ChatIngestionManager(tenantConfigService, sessionStore, transport,
                new FrameDecoder(objectMapper, Clock.systemUTC()), eventDispatcher, new BackoffPolicy(configurationService),
                configurationService, meterRegistry, objectMapper, Clock.systemUTC(),
                "wss://pusher.example/app/key", false);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        eventDispatcher.shutdown();
    }

    @Test
    void shouldKeepTenantsIsolated() {
        assertTrue(manager.start("a"));
        assertTrue(manager.start("b"));
        FakeChatTransport.FakeConnection a = awaitSubscribed("chatrooms.1.v2");
        FakeChatTransport.FakeConnection b = awaitSubscribed("chatrooms.2.v2");

        a.push(chat("alice"));

        verify(eventRouter, timeout(WAIT.toMillis())).route(eq("a"), any(ChatMessage.class));
        verify(eventRouter, never()).route(eq("b"), any());
        await().atMost(WAIT).until(() -> sessionStore.getSession("a").map(session -> session.getRecentChatters().containsKey("alice")).orElse(false));
        assertTrue(sessionStore.getSession("b").map(session -> session.getRecentChatters().isEmpty()).orElse(false));

        a.drop();

        await().atMost(WAIT).until(() -> connections.stream().filter(connection -> connection.sentContaining("chatrooms.1.v2")).count() == 2);
        assertTrue(b.isOpen());
        assertEquals(3, connections.size());
        assertTrue(manager.isRunning("a"));
        assertTrue(manager.isRunning("b"));
    }

    @Test
    void shouldStopOneTenantAndDropItsSession() {
        manager.start("a");
        manager.start("b");
        FakeChatTransport.FakeConnection a = awaitSubscribed("chatrooms.1.v2");
        FakeChatTransport.FakeConnection b = awaitSubscribed("chatrooms.2.v2");

        assertTrue(manager.stop("a"));

        await().atMost(WAIT).until(() -> !a.isOpen());
        assertFalse(manager.isRunning("a"));
        assertFalse(sessionStore.getSession("a").isPresent());
        assertTrue(b.isOpen());
        assertTrue(manager.isRunning("b"));
        assertFalse(manager.stop("a"));
    }

    @Test
    void shouldNotStartTwiceOrWithoutConfiguration() {
        assertTrue(manager.start("a"));
        assertFalse(manager.start("a"));
        assertFalse(manager.start("missing"));
        assertEquals(1, manager.runningTenants().size());
    }

    @Test
    void shouldSyncWithConfiguredTenants() {
        manager.start("a");
        manager.start("b");
        awaitSubscribed("chatrooms.2.v2");

        configs.remove("b");
        configs.put("c", config("c", 3L));
        manager.syncTenants();

        assertEquals(2, manager.runningTenants().size());
        assertTrue(manager.runningTenants().contains("a"));
        assertTrue(manager.runningTenants().contains("c"));
        awaitSubscribed("chatrooms.3.v2");
    }

    @Test
    void shouldRestartExitedClient() {
        manager.start("a");
        awaitSubscribed("chatrooms.1.v2");

        // the client exits once its configuration disappears
        TenantConfig removed = configs.remove("a");
        connections.get(0).idle();
        await().atMost(WAIT).until(() -> !manager.isRunning("a"));

        configs.put("a", removed);
        manager.syncTenants();

        assertTrue(manager.isRunning("a"));
        await().atMost(WAIT).until(() -> connections.size() == 2);
    }

    private FakeChatTransport.FakeConnection awaitSubscribed(String channel) {
        await().atMost(WAIT).until(() -> connections.stream().anyMatch(connection -> connection.sentContaining(channel)));
        return connections.stream()
                .filter(connection -> connection.sentContaining(channel))
                .findFirst()
                .orElseThrow(AssertionError::new);
    }

    private static String chat(String user) {
        return "{\"event\":\"App\\\\Events\\\\ChatMessageEvent\",\"data\":\"{\\\"content\\\":\\\"hi\\\",\\\"sender\\\":{\\\"username\\\":\\\"" + user + "\\\"}}\"}";
    }

    private static TenantConfig config(String tenantId, long chatroomId) {
        return TenantConfig.builder()
                .tenantId(tenantId)
                .channelSlug("slug-" + tenantId)
                .chatroomId(chatroomId)
                .build();
    }
}
