package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.PeriodDao;
import com.tango.stream.raffle.model.Period;
import com.tango.stream.raffle.model.PeriodStatus;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tango.stream.raffle.utils.TimeUtils.instantToTimestamp;
import static com.tango.stream.raffle.utils.TimeUtils.timestampToInstant;

/**
 * {@code active_flag} is 1 for the ACTIVE period and NULL otherwise, so the unique
 * (tenant_id, active_flag) key allows a single active period per tenant.
 */
@Repository
public class SqlPeriodDao implements PeriodDao {
    private static final String COLUMNS = "id, tenant_id, start_date, end_date, status, total_tickets ";

    @Language("MySQL")
    public static final String SELECT_ACTIVE_SQL = "" +
            "SELECT " + COLUMNS +
            "FROM raffle_periods " +
            "WHERE tenant_id = :tenantId AND active_flag = 1";

    @Language("MySQL")
    public static final String SELECT_BY_ID_SQL = "" +
            "SELECT " + COLUMNS +
            "FROM raffle_periods " +
            "WHERE id = :periodId";

    @Language("MySQL")
    public static final String SELECT_BY_ID_FOR_UPDATE_SQL = SELECT_BY_ID_SQL + " FOR UPDATE";

    @Language("MySQL")
    public static final String INSERT_SQL = "" +
            "INSERT INTO raffle_periods (tenant_id, start_date, end_date, status, active_flag, total_tickets, created_at) " +
            "VALUES (:tenantId, :startDate, :endDate, 'ACTIVE', 1, 0, :now)";

    @Language("MySQL")
    public static final String END_SQL = "" +
            "UPDATE raffle_periods " +
            "SET status = 'ENDED', active_flag = NULL, total_tickets = :totalTickets " +
            "WHERE id = :periodId AND status = 'ACTIVE'";

    @Language("MySQL")
    public static final String SELECT_RECENT_SQL = "" +
            "SELECT " + COLUMNS +
            "FROM raffle_periods " +
            "WHERE tenant_id = :tenantId " +
            "ORDER BY start_date DESC, id DESC " +
            "LIMIT :limit";

    private static final RowMapper<Period> PERIOD_MAPPER = (rs, rowNum) -> Period.builder()
            .id(rs.getLong("id"))
            .tenantId(rs.getString("tenant_id"))
            .startDate(timestampToInstant(rs.getTimestamp("start_date")))
            .endDate(timestampToInstant(rs.getTimestamp("end_date")))
            .status(PeriodStatus.valueOf(rs.getString("status")))
            .totalTickets(rs.getLong("total_tickets"))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlPeriodDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Nonnull
    @Override
    public Optional<Period> findActive(@Nonnull String tenantId) {
        return jdbcTemplate.query(SELECT_ACTIVE_SQL, ImmutableMap.of("tenantId", tenantId), PERIOD_MAPPER).stream()
                .findFirst();
    }

    @Nonnull
    @Override
    public Optional<Period> find(long periodId) {
        return jdbcTemplate.query(SELECT_BY_ID_SQL, ImmutableMap.of("periodId", periodId), PERIOD_MAPPER).stream()
                .findFirst();
    }

    @Nonnull
    @Override
    public Optional<Period> findForUpdate(long periodId) {
        return jdbcTemplate.query(SELECT_BY_ID_FOR_UPDATE_SQL, ImmutableMap.of("periodId", periodId), PERIOD_MAPPER).stream()
                .findFirst();
    }

    @Override
    public long insertActive(@Nonnull String tenantId, @Nonnull Instant start, @Nonnull Instant end, @Nonnull Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("startDate", instantToTimestamp(start))
                .addValue("endDate", instantToTimestamp(end))
                .addValue("now", instantToTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(INSERT_SQL, params, keyHolder, new String[]{"id"});
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for period of tenant " + tenantId);
        }
        return key.longValue();
    }

    @Override
    public boolean end(long periodId, long totalTickets) {
        return jdbcTemplate.update(END_SQL, ImmutableMap.of("periodId", periodId, "totalTickets", totalTickets)) > 0;
    }

    @Nonnull
    @Override
    public List<Period> findRecent(@Nonnull String tenantId, int limit) {
        return jdbcTemplate.query(SELECT_RECENT_SQL, ImmutableMap.of("tenantId", tenantId, "limit", limit), PERIOD_MAPPER);
    }
}
