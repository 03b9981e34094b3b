package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.WatchtimeDao;
import com.tango.stream.raffle.model.LinkedWatchtime;
import com.tango.stream.raffle.model.WatchtimeEntry;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.tango.stream.raffle.utils.TimeUtils.instantToTimestamp;
import static com.tango.stream.raffle.utils.TimeUtils.timestampToInstant;

@Repository
public class SqlWatchtimeDao implements WatchtimeDao {
    @Language("MySQL")
    public static final String UPSERT_SQL = "" +
            "INSERT INTO watchtime (tenant_id, username, seconds_watched, last_active) " +
            "VALUES (:tenantId, :username, :seconds, :lastActive) " +
            "ON DUPLICATE KEY UPDATE seconds_watched = seconds_watched + :seconds, last_active = :lastActive";

    @Language("MySQL")
    public static final String SELECT_ALL_SQL = "" +
            "SELECT tenant_id, username, seconds_watched, last_active " +
            "FROM watchtime " +
            "WHERE tenant_id = :tenantId " +
            "ORDER BY username";

    @Language("MySQL")
    public static final String SELECT_LINKED_SQL = "" +
            "SELECT w.username, l.user_id, w.seconds_watched " +
            "FROM watchtime w " +
            "JOIN account_links l ON l.tenant_id = w.tenant_id AND LOWER(l.kick_name) = w.username " +
            "WHERE w.tenant_id = :tenantId " +
            "ORDER BY w.username";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlWatchtimeDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void addSeconds(@Nonnull String tenantId, @Nonnull Map<String, Instant> viewers, long seconds) {
        if (viewers.isEmpty()) {
            return;
        }
        Map<String, Object>[] batchParams = viewers.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> ImmutableMap.<String, Object>builder()
                        .put("tenantId", tenantId)
                        .put("username", entry.getKey())
                        .put("seconds", seconds)
                        .put("lastActive", instantToTimestamp(entry.getValue()))
                        .build())
                .toArray(Map[]::new);
        jdbcTemplate.batchUpdate(UPSERT_SQL, batchParams);
    }

    @Nonnull
    @Override
    public List<WatchtimeEntry> findAll(@Nonnull String tenantId) {
        return jdbcTemplate.query(SELECT_ALL_SQL, ImmutableMap.of("tenantId", tenantId), (rs, rowNum) -> WatchtimeEntry.builder()
                .tenantId(rs.getString("tenant_id"))
                .username(rs.getString("username"))
                .secondsWatched(rs.getLong("seconds_watched"))
                .lastActive(timestampToInstant(rs.getTimestamp("last_active")))
                .build());
    }

    @Nonnull
    @Override
    public List<LinkedWatchtime> findLinked(@Nonnull String tenantId) {
        return jdbcTemplate.query(SELECT_LINKED_SQL, ImmutableMap.of("tenantId", tenantId), (rs, rowNum) -> new LinkedWatchtime(
                rs.getString("username"),
                rs.getLong("user_id"),
                rs.getLong("seconds_watched")
        ));
    }
}
