package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.dao.TenantConfigDao;
import com.tango.stream.raffle.exceptions.ChannelResolveException;
import com.tango.stream.raffle.model.KickChannel;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.restClients.KickChannelClient;
import com.tango.stream.raffle.service.TenantConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class TenantConfigServiceImpl implements TenantConfigService {
    private final TenantConfigDao tenantConfigDao;
    private final KickChannelClient kickChannelClient;

    @Autowired
    public TenantConfigServiceImpl(TenantConfigDao tenantConfigDao, KickChannelClient kickChannelClient) {
        this.tenantConfigDao = tenantConfigDao;
        this.kickChannelClient = kickChannelClient;
    }

    @Nonnull
    @Override
    public Optional<TenantConfig> getConfig(@Nonnull String tenantId) {
        return tenantConfigDao.find(tenantId);
    }

    @Nonnull
    @Override
    public List<TenantConfig> getEnabledTenants() {
        return tenantConfigDao.findAllEnabled();
    }

    @Nonnull
    @Override
    public TenantConfig resolve(@Nonnull TenantConfig config) throws ChannelResolveException {
        if (config.isResolved()) {
            return config;
        }
        if (config.getChatroomId() != null) {
            log.info("resolve(): chatroom {} of tenant {} belongs to {}, looking up {}",
                    config.getChatroomId(), config.getTenantId(), config.getResolvedSlug(), config.getChannelSlug());
        }
        KickChannel channel;
        try {
            channel = kickChannelClient.getChannel(config.getChannelSlug());
        } catch (RuntimeException e) {
            throw new ChannelResolveException("Channel lookup failed for " + config.getChannelSlug(), e);
        }
        if (channel == null || channel.getChatroom() == null || channel.getChatroom().getId() == null) {
            throw new ChannelResolveException("No chatroom for channel " + config.getChannelSlug());
        }
        long chatroomId = channel.getChatroom().getId();
        if (!tenantConfigDao.saveChatroomId(config.getTenantId(), config.getChannelSlug(), chatroomId)) {
            log.warn("resolve(): channel of tenant {} changed during lookup of {}, chatroom {} not cached",
                    config.getTenantId(), config.getChannelSlug(), chatroomId);
        }
        log.info("resolve(): channel {} of tenant {} has chatroom {}", config.getChannelSlug(), config.getTenantId(), chatroomId);
        return config.toBuilder()
                .chatroomId(chatroomId)
                .resolvedSlug(config.getChannelSlug())
                .build();
    }
}
