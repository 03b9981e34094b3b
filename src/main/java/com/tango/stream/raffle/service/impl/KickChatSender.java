package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.model.KickChatMessage;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.restClients.KickChatMessageClient;
import com.tango.stream.raffle.service.ChatSender;
import com.tango.stream.raffle.service.TenantConfigService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Posts bot messages to the tenant's channel. Without a bot token messages are only logged.
 */
@Slf4j
@Service
public class KickChatSender implements ChatSender {
    private final KickChatMessageClient chatMessageClient;
    private final TenantConfigService tenantConfigService;
    private final String botToken;

    @Autowired
    public KickChatSender(KickChatMessageClient chatMessageClient,
                          TenantConfigService tenantConfigService,
                          @Value("${kick.bot.token:}") String botToken) {
        this.chatMessageClient = chatMessageClient;
        this.tenantConfigService = tenantConfigService;
        this.botToken = botToken;
    }

    @Override
    public boolean send(@Nonnull String tenantId, @Nonnull String message) {
        if (StringUtils.isBlank(botToken)) {
            log.info("send(): no bot token, message to tenant {} skipped: {}", tenantId, message);
            return false;
        }
        Optional<Long> channelId = tenantConfigService.getConfig(tenantId).map(TenantConfig::getChannelId);
        if (!channelId.isPresent()) {
            log.warn("send(): tenant {} has no channel id, message skipped: {}", tenantId, message);
            return false;
        }
        try {
            chatMessageClient.sendMessage("Bearer " + botToken, new KickChatMessage(channelId.get(), message, "bot"));
            return true;
        } catch (RuntimeException e) {
            log.warn("send(): message to tenant {} failed", tenantId, e);
            return false;
        }
    }
}
