package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.WagerDao;
import com.tango.stream.raffle.model.WagerLink;
import com.tango.stream.raffle.model.WagerTracking;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static com.tango.stream.raffle.utils.TimeUtils.instantToTimestamp;

@Repository
public class SqlWagerDao implements WagerDao {
    @Language("MySQL")
    public static final String SELECT_LINK_SQL = "" +
            "SELECT kick_name, user_id FROM wager_links " +
            "WHERE tenant_id = :tenantId AND LOWER(platform_username) = LOWER(:username) AND verified = TRUE";

    @Language("MySQL")
    public static final String SELECT_TRACKING_FOR_UPDATE_SQL = "" +
            "SELECT tenant_id, period_id, platform_username, last_known_wager, tickets_awarded " +
            "FROM raffle_wager_tracking " +
            "WHERE period_id = :periodId AND platform_username = :username " +
            "FOR UPDATE";

    @Language("MySQL")
    public static final String INSERT_TRACKING_SQL = "" +
            "INSERT INTO raffle_wager_tracking (tenant_id, period_id, platform_username, last_known_wager, tickets_awarded, last_checked) " +
            "VALUES (:tenantId, :periodId, :username, :wager, :tickets, :now)";

    @Language("MySQL")
    public static final String ADVANCE_SQL = "" +
            "UPDATE raffle_wager_tracking " +
            "SET last_known_wager = :wager, tickets_awarded = tickets_awarded + :tickets, last_checked = :now " +
            "WHERE period_id = :periodId AND platform_username = :username";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlWagerDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Nonnull
    @Override
    public Optional<WagerLink> findVerifiedLink(@Nonnull String tenantId, @Nonnull String platformUsername) {
        return jdbcTemplate.query(SELECT_LINK_SQL, ImmutableMap.of("tenantId", tenantId, "username", platformUsername),
                (rs, rowNum) -> new WagerLink(rs.getString("kick_name"), rs.getLong("user_id"))).stream()
                .findFirst();
    }

    @Nonnull
    @Override
    public Optional<WagerTracking> findForUpdate(long periodId, @Nonnull String platformUsername) {
        return jdbcTemplate.query(SELECT_TRACKING_FOR_UPDATE_SQL, ImmutableMap.of("periodId", periodId, "username", platformUsername),
                (rs, rowNum) -> WagerTracking.builder()
                        .tenantId(rs.getString("tenant_id"))
                        .periodId(rs.getLong("period_id"))
                        .platformUsername(rs.getString("platform_username"))
                        .lastKnownWager(rs.getBigDecimal("last_known_wager"))
                        .ticketsAwarded(rs.getLong("tickets_awarded"))
                        .build()).stream()
                .findFirst();
    }

    @Override
    public boolean insertIfAbsent(@Nonnull WagerTracking tracking, @Nonnull Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", tracking.getTenantId())
                .addValue("periodId", tracking.getPeriodId())
                .addValue("username", tracking.getPlatformUsername())
                .addValue("wager", tracking.getLastKnownWager())
                .addValue("tickets", tracking.getTicketsAwarded())
                .addValue("now", instantToTimestamp(now));
        try {
            return jdbcTemplate.update(INSERT_TRACKING_SQL, params) > 0;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public void advance(long periodId, @Nonnull String platformUsername, @Nonnull BigDecimal wager, long tickets, @Nonnull Instant now) {
        jdbcTemplate.update(ADVANCE_SQL, new MapSqlParameterSource()
                .addValue("periodId", periodId)
                .addValue("username", platformUsername)
                .addValue("wager", wager)
                .addValue("tickets", tickets)
                .addValue("now", instantToTimestamp(now)));
    }
}
