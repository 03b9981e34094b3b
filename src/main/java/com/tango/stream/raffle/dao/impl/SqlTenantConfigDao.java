package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.TenantConfigDao;
import com.tango.stream.raffle.model.TenantConfig;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

@Repository
public class SqlTenantConfigDao implements TenantConfigDao {
    @Language("MySQL")
    public static final String SELECT_SQL = "" +
            "SELECT tenant_id, channel_slug, chatroom_id, channel_id, resolved_slug, revision, wager_affiliate_url, wager_campaign_codes " +
            "FROM tenant_settings " +
            "WHERE tenant_id = :tenantId AND enabled = TRUE";

    @Language("MySQL")
    public static final String SELECT_ENABLED_SQL = "" +
            "SELECT tenant_id, channel_slug, chatroom_id, channel_id, resolved_slug, revision, wager_affiliate_url, wager_campaign_codes " +
            "FROM tenant_settings " +
            "WHERE enabled = TRUE " +
            "ORDER BY tenant_id";

    @Language("MySQL")
    public static final String UPDATE_CHATROOM_SQL = "" +
            "UPDATE tenant_settings SET chatroom_id = :chatroomId, resolved_slug = :slug, updated_at = CURRENT_TIMESTAMP " +
            "WHERE tenant_id = :tenantId AND channel_slug = :slug";

    private static final RowMapper<TenantConfig> CONFIG_MAPPER = (rs, rowNum) -> {
        long chatroomId = rs.getLong("chatroom_id");
        boolean chatroomMissing = rs.wasNull();
        long channelId = rs.getLong("channel_id");
        boolean channelMissing = rs.wasNull();
        return TenantConfig.builder()
                .tenantId(rs.getString("tenant_id"))
                .channelSlug(rs.getString("channel_slug"))
                .chatroomId(chatroomMissing ? null : chatroomId)
                .channelId(channelMissing ? null : channelId)
                .resolvedSlug(rs.getString("resolved_slug"))
                .revision(rs.getLong("revision"))
                .wagerAffiliateUrl(rs.getString("wager_affiliate_url"))
                .wagerCampaignCodes(rs.getString("wager_campaign_codes"))
                .build();
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlTenantConfigDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Nonnull
    @Override
    public Optional<TenantConfig> find(@Nonnull String tenantId) {
        return jdbcTemplate.query(SELECT_SQL, ImmutableMap.of("tenantId", tenantId), CONFIG_MAPPER).stream()
                .findFirst();
    }

    @Nonnull
    @Override
    public List<TenantConfig> findAllEnabled() {
        return jdbcTemplate.query(SELECT_ENABLED_SQL, CONFIG_MAPPER);
    }

    @Override
    public boolean saveChatroomId(@Nonnull String tenantId, @Nonnull String slug, long chatroomId) {
        return jdbcTemplate.update(UPDATE_CHATROOM_SQL, ImmutableMap.of("tenantId", tenantId, "slug", slug, "chatroomId", chatroomId)) > 0;
    }
}
