package com.tango.stream.raffle.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.tango.stream.raffle.model.DecodedFrame;
import com.tango.stream.raffle.model.events.ChatMessage;
import com.tango.stream.raffle.model.events.GiftSubscription;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decodes Pusher protocol frames of the chat websocket. Never throws: anything that can not be
 * understood is returned as a MALFORMED or UNKNOWN frame.
 */
@Component
public class FrameDecoder {
    public static final String CONNECTION_ESTABLISHED = "pusher:connection_established";
    public static final String SUBSCRIPTION_SUCCEEDED = "pusher_internal:subscription_succeeded";
    public static final String PING = "pusher:ping";
    public static final String PONG = "pusher:pong";
    public static final String SUBSCRIBE = "pusher:subscribe";

    private static final String CHAT_MESSAGE_EVENT = "ChatMessageEvent";
    private static final Set<String> GIFT_EVENTS = ImmutableSet.of(
            "GiftedSubscriptionsEvent",
            "SubscriptionEvent",
            "channel.subscription.gifts");
    private static final Set<String> GIFT_FIELDS = ImmutableSet.of(
            "gifter_username",
            "gift_count",
            "months",
            "usernames",
            "gifted_usernames",
            "gifter");
    private static final List<String> COUNT_FIELDS = ImmutableList.of("gift_count", "quantity", "count");
    private static final List<String> RECIPIENT_FIELDS = ImmutableList.of("gifted_usernames", "usernames");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FrameDecoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Nonnull
    public DecodedFrame decode(@Nonnull String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return DecodedFrame.malformed(null, "not json: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return DecodedFrame.malformed(null, "not a json object");
        }
        String eventName = textOrNull(root.get("event"));
        if (eventName == null) {
            return DecodedFrame.malformed(null, "no event name");
        }
        String channel = textOrNull(root.get("channel"));

        switch (eventName) {
            case PING:
                return DecodedFrame.control(DecodedFrame.Kind.PING, eventName, channel);
            case PONG:
                return DecodedFrame.control(DecodedFrame.Kind.PONG, eventName, channel);
            case SUBSCRIPTION_SUCCEEDED:
                return DecodedFrame.control(DecodedFrame.Kind.SUBSCRIPTION_SUCCEEDED, eventName, channel);
            default:
                break;
        }

        JsonNode data;
        try {
            data = parseData(root.get("data"));
        } catch (JsonProcessingException e) {
            return DecodedFrame.malformed(eventName, "data is not json: " + e.getOriginalMessage());
        }
        if (data == null || !data.isObject()) {
            return DecodedFrame.malformed(eventName, "data is not a json object");
        }

        if (CONNECTION_ESTABLISHED.equals(eventName)) {
            return DecodedFrame.connectionEstablished(textOrNull(data.get("socket_id")));
        }
        String simpleName = StringUtils.substringAfterLast(eventName, "\\");
        if (simpleName.isEmpty()) {
            simpleName = eventName;
        }
        Instant now = clock.instant();
        if (CHAT_MESSAGE_EVENT.equals(simpleName)) {
            return decodeChat(eventName, channel, data, now);
        }
        if (GIFT_EVENTS.contains(simpleName) || hasGiftFields(data)) {
            return decodeGift(eventName, channel, data, now);
        }
        return DecodedFrame.unknown(eventName, channel);
    }

    private DecodedFrame decodeChat(String eventName, @Nullable String channel, JsonNode data, Instant now) {
        String username = textOrNull(data.path("sender").get("username"));
        if (StringUtils.isBlank(username)) {
            return DecodedFrame.malformed(eventName, "chat message without sender");
        }
        String content = StringUtils.defaultString(textOrNull(data.get("content")));
        return DecodedFrame.event(eventName, channel, new ChatMessage(username.toLowerCase(Locale.ROOT), content, now));
    }

    private DecodedFrame decodeGift(String eventName, @Nullable String channel, JsonNode data, Instant now) {
        String gifter = resolveGifter(data);
        if (StringUtils.isBlank(gifter)) {
            return DecodedFrame.malformed(eventName, "gift without gifter");
        }
        String eventId = StringUtils.trimToNull(textOrNull(data.get("id")));
        return DecodedFrame.event(eventName, channel,
                new GiftSubscription(gifter.toLowerCase(Locale.ROOT), resolveCount(data), eventId, now));
    }

    @Nullable
    private static String resolveGifter(JsonNode data) {
        String gifter = textOrNull(data.get("gifter_username"));
        if (gifter != null) {
            return gifter;
        }
        JsonNode gifterNode = data.get("gifter");
        if (gifterNode != null) {
            gifter = gifterNode.isObject() ? textOrNull(gifterNode.get("username")) : textOrNull(gifterNode);
            if (gifter != null) {
                return gifter;
            }
        }
        gifter = textOrNull(data.path("sender").get("username"));
        if (gifter != null) {
            return gifter;
        }
        return textOrNull(data.get("username"));
    }

    private static int resolveCount(JsonNode data) {
        for (String field : COUNT_FIELDS) {
            JsonNode count = data.get(field);
            if (count != null && (count.isNumber() || count.isTextual())) {
                return count.asInt(1);
            }
        }
        for (String field : RECIPIENT_FIELDS) {
            JsonNode recipients = data.get(field);
            if (recipients != null && recipients.isArray()) {
                return recipients.size();
            }
        }
        return 1;
    }

    private static boolean hasGiftFields(JsonNode data) {
        for (String field : GIFT_FIELDS) {
            if (data.has(field)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pusher sends the payload as a JSON document encoded into a string.
     */
    private JsonNode parseData(@Nullable JsonNode data) throws JsonProcessingException {
        if (data == null || data.isNull()) {
            return objectMapper.createObjectNode();
        }
        if (data.isTextual()) {
            return objectMapper.readTree(data.asText());
        }
        return data;
    }

    @Nullable
    private static String textOrNull(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
