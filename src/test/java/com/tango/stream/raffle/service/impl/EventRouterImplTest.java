package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.model.GiftOutcome;
import com.tango.stream.raffle.model.events.ChatMessage;
import com.tango.stream.raffle.model.events.GiftSubscription;
import com.tango.stream.raffle.model.events.Heartbeat;
import com.tango.stream.raffle.service.ChatCommandListener;
import com.tango.stream.raffle.service.ChatSender;
import com.tango.stream.raffle.service.CooldownService;
import com.tango.stream.raffle.service.GiftedSubService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.env.StandardEnvironment;

import java.time.Instant;
import java.util.stream.Stream;

import static com.tango.stream.raffle.model.Metrics.Counters.ROUTED_EVENTS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EventRouterImplTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private GiftedSubService giftedSubService;
    @Mock
    private CooldownService cooldownService;
    @Mock
    private ChatSender chatSender;
    @Mock
    private ChatCommandListener commandListener;
    @Mock
    private ObjectProvider<ChatCommandListener> commandListeners;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ConfigurationService configurationService = new ConfigurationService(new StandardEnvironment(), "", 5000);
    private EventRouterImpl router;

    @BeforeEach
    void setUp() {
        when(commandListeners.orderedStream()).thenReturn(Stream.of(commandListener));
        when(giftedSubService.ticketsFor(anyInt())).thenAnswer(invocation -> 15L * invocation.<Integer>getArgument(0));
        router = new EventRouterImpl(giftedSubService, cooldownService, chatSender, commandListeners, configurationService, meterRegistry);
    }

    @Test
    void shouldThankGifterWhenAwarded() {
        GiftSubscription gift = new GiftSubscription("generous", 2, "evt-1", NOW);
        when(giftedSubService.handleGift("t1", gift)).thenReturn(GiftOutcome.AWARDED);

        router.route("t1", gift);

        verify(chatSender).send("t1", "Thanks @generous for gifting 2 sub(s)! +30 raffle tickets");
    }

    @Test
    void shouldStayQuietOnDuplicateGift() {
        GiftSubscription gift = new GiftSubscription("generous", 2, "evt-1", NOW);
        when(giftedSubService.handleGift("t1", gift)).thenReturn(GiftOutcome.DUPLICATE);

        router.route("t1", gift);

        verify(chatSender, never()).send(anyString(), anyString());
    }

    @Test
    void shouldPassRequestsThroughCooldown() {
        when(cooldownService.allow(eq("t1"), eq("alice"), anyLong())).thenReturn(true, false);
        ChatMessage request = new ChatMessage("alice", "!call Play the blue song", NOW);

        router.route("t1", request);
        router.route("t1", request);

        verify(commandListener, times(1)).onRequest("t1", request, "Play the blue song");
    }

    @Test
    void shouldIgnorePlainChat() {
        router.route("t1", new ChatMessage("alice", "hello there", NOW));

        verifyNoInteractions(cooldownService);
        verify(commandListener, never()).onRequest(anyString(), any(), anyString());
    }

    @Test
    void shouldSurviveFailingConsumer() {
        GiftSubscription gift = new GiftSubscription("generous", 1, "evt-2", NOW);
        when(giftedSubService.handleGift("t1", gift)).thenThrow(new IllegalStateException("boom"));

        router.route("t1", gift);
        router.route("t1", new Heartbeat(NOW));

        assertEquals(2.0, meterRegistry.find(ROUTED_EVENTS).counters().stream().mapToDouble(counter -> counter.count()).sum());
    }
}
