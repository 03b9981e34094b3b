package com.tango.stream.raffle.service.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.BaseTest;
import com.tango.stream.raffle.exceptions.ChannelResolveException;
import com.tango.stream.raffle.model.KickChannel;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.service.TenantConfigService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TenantConfigServiceImplTest extends BaseTest {
    @Autowired
    private TenantConfigService tenantConfigService;

    @Test
    void shouldResolveAndStoreChatroom() throws ChannelResolveException {
        String tenantId = newTenant();
        addTenant(tenantId, "streamer", null);
        when(kickChannelClient.getChannel("streamer")).thenReturn(new KickChannel(9L, "streamer", new KickChannel.Chatroom(77L)));
        TenantConfig stored = tenantConfigService.getConfig(tenantId).orElseThrow(AssertionError::new);
        assertFalse(stored.isResolved());

        TenantConfig resolved = tenantConfigService.resolve(stored);

        assertEquals(77L, resolved.getChatroomId());
        assertNull(resolved.getChannelId());
        TenantConfig reloaded = tenantConfigService.getConfig(tenantId).orElseThrow(AssertionError::new);
        assertEquals(77L, reloaded.getChatroomId());
        assertFalse(resolved.targetDiffers(reloaded));

        tenantConfigService.resolve(reloaded);
        verify(kickChannelClient, times(1)).getChannel(anyString());
    }

    @Test
    void shouldResolveAgainWhenSlugChanges() throws ChannelResolveException {
        String tenantId = newTenant();
        addTenant(tenantId, "old-streamer", null);
        when(kickChannelClient.getChannel("old-streamer")).thenReturn(new KickChannel(1L, "old-streamer", new KickChannel.Chatroom(111L)));
        when(kickChannelClient.getChannel("new-streamer")).thenReturn(new KickChannel(2L, "new-streamer", new KickChannel.Chatroom(222L)));
        TenantConfig subscribed = tenantConfigService.resolve(tenantConfigService.getConfig(tenantId).orElseThrow(AssertionError::new));
        assertEquals(111L, subscribed.getChatroomId());

        jdbcTemplate.update("UPDATE tenant_settings SET channel_slug = 'new-streamer', revision = revision + 1 WHERE tenant_id = :tenantId",
                ImmutableMap.of("tenantId", tenantId));
        TenantConfig changed = tenantConfigService.getConfig(tenantId).orElseThrow(AssertionError::new);

        assertFalse(changed.isResolved());
        assertTrue(subscribed.targetDiffers(changed));
        TenantConfig resolved = tenantConfigService.resolve(changed);
        assertEquals(222L, resolved.getChatroomId());
        TenantConfig reloaded = tenantConfigService.getConfig(tenantId).orElseThrow(AssertionError::new);
        assertEquals(222L, reloaded.getChatroomId());
        assertEquals("new-streamer", reloaded.getResolvedSlug());
        assertFalse(resolved.targetDiffers(reloaded));
    }

    @Test
    void shouldResubscribeOnRevisionBump() {
        TenantConfig config = TenantConfig.builder()
                .tenantId("t")
                .channelSlug("streamer")
                .chatroomId(5L)
                .resolvedSlug("streamer")
                .revision(3)
                .build();

        assertTrue(config.isResolved());
        assertFalse(config.targetDiffers(config.toBuilder().channelSlug("STREAMER").build()));
        assertTrue(config.targetDiffers(config.toBuilder().revision(4).build()));
    }

    @Test
    void shouldFailWithoutChatroom() {
        String tenantId = newTenant();
        addTenant(tenantId, "ghost", null);
        when(kickChannelClient.getChannel("ghost")).thenReturn(new KickChannel(1L, "ghost", null));
        TenantConfig stored = tenantConfigService.getConfig(tenantId).orElseThrow(AssertionError::new);

        assertThrows(ChannelResolveException.class, () -> tenantConfigService.resolve(stored));
    }

    @Test
    void shouldWrapLookupFailure() {
        String tenantId = newTenant();
        addTenant(tenantId, "down", null);
        when(kickChannelClient.getChannel("down")).thenThrow(new IllegalStateException("503"));
        TenantConfig stored = tenantConfigService.getConfig(tenantId).orElseThrow(AssertionError::new);

        ChannelResolveException e = assertThrows(ChannelResolveException.class, () -> tenantConfigService.resolve(stored));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void shouldListEnabledTenants() {
        String tenantId = newTenant();
        addTenant(tenantId, "listed", 5L);

        assertTrue(tenantConfigService.getEnabledTenants().stream()
                .anyMatch(config -> config.getTenantId().equals(tenantId) && config.getChatroomId() == 5L));
        assertFalse(tenantConfigService.getConfig(newTenant()).isPresent());
    }
}
