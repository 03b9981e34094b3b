package com.tango.stream.raffle;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.restClients.AffiliateStatsClient;
import com.tango.stream.raffle.restClients.KickChannelClient;
import com.tango.stream.raffle.restClients.KickChatMessageClient;
import com.tango.stream.raffle.service.impl.ConfigurationService;
import com.tango.stream.raffle.util.TestClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Spring context on H2 with Flyway migrations. Redis and the platform API are mocked.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
public abstract class BaseTest {
    protected final Logger log = LoggerFactory.getLogger(this.getClass());

    private final Map<String, Object> overriddenProperties = new HashMap<>();

    @MockBean
    protected RedissonClient redissonClient;
    @MockBean
    protected KickChannelClient kickChannelClient;
    @MockBean
    protected KickChatMessageClient kickChatMessageClient;
    @MockBean
    protected AffiliateStatsClient affiliateStatsClient;
    @Autowired
    protected ConfigurationService configurationService;
    @Autowired
    protected NamedParameterJdbcTemplate jdbcTemplate;
    @Autowired
    protected Clock clock;

    protected RTopic drawTopic;

    @BeforeEach
    public void setUpRedis() {
        drawTopic = mock(RTopic.class);
        when(redissonClient.getTopic(anyString(), any(Codec.class))).thenReturn(drawTopic);
    }

    @AfterEach
    public void tearDown() {
        resetOverriddenProperties();
        ((TestClock) clock).reset();
    }

    protected TestClock testClock() {
        return (TestClock) clock;
    }

    protected static String newTenant() {
        return "tenant-" + UUID.randomUUID();
    }

    protected void linkAccount(String tenantId, String kickName, long userId) {
        jdbcTemplate.update("INSERT INTO account_links (tenant_id, kick_name, user_id) VALUES (:tenantId, :kickName, :userId)",
                ImmutableMap.of("tenantId", tenantId, "kickName", kickName, "userId", userId));
    }

    protected void addTenant(String tenantId, String slug, Long chatroomId) {
        Map<String, Object> params = new HashMap<>();
        params.put("tenantId", tenantId);
        params.put("slug", slug);
        params.put("chatroomId", chatroomId);
        params.put("resolvedSlug", chatroomId != null ? slug : null);
        jdbcTemplate.update("INSERT INTO tenant_settings (tenant_id, channel_slug, chatroom_id, resolved_slug) " +
                "VALUES (:tenantId, :slug, :chatroomId, :resolvedSlug)", params);
    }

    public void setProperty(String key, Object value) {
        overriddenProperties.putIfAbsent(key, configurationService.get().getProperty(key));
        configurationService.update(configuration -> configuration.setProperty(key, value));
    }

    public void resetOverriddenProperties() {
        for (String key : overriddenProperties.keySet()) {
            Object value = overriddenProperties.get(key);
            if (value == null) {
                configurationService.update(configuration -> configuration.clearProperty(key));
            } else {
                configurationService.update(configuration -> configuration.setProperty(key, value));
            }
        }
        overriddenProperties.clear();
    }
}
