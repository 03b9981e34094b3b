package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.model.GiftOutcome;
import com.tango.stream.raffle.model.events.ChatMessage;
import com.tango.stream.raffle.model.events.GiftSubscription;
import com.tango.stream.raffle.model.events.NormalizedEvent;
import com.tango.stream.raffle.service.*;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.stream.Collectors;

import static com.tango.stream.raffle.model.Metrics.Counters.ROUTED_EVENTS;
import static com.tango.stream.raffle.model.Metrics.Counters.UNKNOWN_EVENTS;
import static com.tango.stream.raffle.model.Metrics.Tags.EVENT_TYPE;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;

@Slf4j
@Service
public class EventRouterImpl implements EventRouter {
    static final Pair<String, String> REQUEST_PREFIX = Pair.of("chat.request.prefix", "!call");
    static final Pair<String, Long> REQUEST_COOLDOWN_SECONDS = Pair.of("chat.request.cooldown.seconds", 30L);
    static final Pair<String, Boolean> THANK_GIFTERS = Pair.of("chat.thank.gifters", true);
    static final Pair<String, String> THANK_TEMPLATE = Pair.of("chat.thank.template",
            "Thanks @%s for gifting %d sub(s)! +%d raffle tickets");

    private final GiftedSubService giftedSubService;
    private final CooldownService cooldownService;
    private final ChatSender chatSender;
    private final List<ChatCommandListener> commandListeners;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;

    @Autowired
    public EventRouterImpl(GiftedSubService giftedSubService,
                           CooldownService cooldownService,
                           ChatSender chatSender,
                           ObjectProvider<ChatCommandListener> commandListeners,
                           ConfigurationService configurationService,
                           MeterRegistry meterRegistry) {
        this.giftedSubService = giftedSubService;
        this.cooldownService = cooldownService;
        this.chatSender = chatSender;
        this.commandListeners = commandListeners.orderedStream().collect(Collectors.toList());
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void route(@Nonnull String tenantId, @Nonnull NormalizedEvent event) {
        meterRegistry.counter(ROUTED_EVENTS, Tags.of(TENANT, tenantId, EVENT_TYPE, event.getType().name())).increment();
        try {
            switch (event.getType()) {
                case GIFT_SUBSCRIPTION:
                    onGift(tenantId, (GiftSubscription) event);
                    break;
                case CHAT_MESSAGE:
                    onChat(tenantId, (ChatMessage) event);
                    break;
                case HEARTBEAT:
                    break;
                default:
                    meterRegistry.counter(UNKNOWN_EVENTS, Tags.of(TENANT, tenantId)).increment();
                    log.debug("route(): dropped unknown event {} of tenant {}", event, tenantId);
            }
        } catch (RuntimeException e) {
            log.error("route(): failed to route {} of tenant {}", event, tenantId, e);
        }
    }

    private void onGift(String tenantId, GiftSubscription gift) {
        GiftOutcome outcome = giftedSubService.handleGift(tenantId, gift);
        log.info("onGift(): {} gifted {} sub(s) in tenant {}: {}", gift.getGifterUser(), gift.getRecipientCount(), tenantId, outcome);
        if (outcome == GiftOutcome.AWARDED && configurationService.getBoolean(THANK_GIFTERS)) {
            long tickets = giftedSubService.ticketsFor(gift.getRecipientCount());
            String message = String.format(configurationService.getString(THANK_TEMPLATE),
                    gift.getGifterUser(), gift.getRecipientCount(), tickets);
            if (!chatSender.send(tenantId, message)) {
                log.info("onGift(): thank you message to {} not delivered in tenant {}", gift.getGifterUser(), tenantId);
            }
        }
    }

    private void onChat(String tenantId, ChatMessage message) {
        String prefix = configurationService.getString(REQUEST_PREFIX);
        String text = StringUtils.trimToEmpty(message.getText());
        if (commandListeners.isEmpty() || !StringUtils.startsWithIgnoreCase(text, prefix)) {
            return;
        }
        if (!cooldownService.allow(tenantId, message.getUser(), configurationService.getLong(REQUEST_COOLDOWN_SECONDS))) {
            log.debug("onChat(): request of {} in tenant {} is on cooldown", message.getUser(), tenantId);
            return;
        }
        String arguments = text.substring(prefix.length()).trim();
        for (ChatCommandListener listener : commandListeners) {
            listener.onRequest(tenantId, message, arguments);
        }
    }
}
