package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.TicketDao;
import com.tango.stream.raffle.model.*;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.tango.stream.raffle.utils.TimeUtils.instantToTimestamp;
import static com.tango.stream.raffle.utils.TimeUtils.timestampToInstant;

@Repository
public class SqlTicketDao implements TicketDao {
    private static final String UPSERT_TEMPLATE = "" +
            "INSERT INTO raffle_tickets (tenant_id, period_id, user_id, kick_name, %1$s, total_tickets, last_updated) " +
            "VALUES (:tenantId, :periodId, :userId, :kickName, :amount, :amount, :now) " +
            "ON DUPLICATE KEY UPDATE %1$s = %1$s + :amount, " +
            "total_tickets = total_tickets + :amount, " +
            "kick_name = :kickName, " +
            "last_updated = :now";

    @Language("MySQL")
    public static final String SELECT_BALANCE_SQL = "" +
            "SELECT id, period_id, user_id, kick_name, watchtime_tickets, gifted_sub_tickets, wager_tickets, " +
            "bonus_tickets, total_tickets, last_updated " +
            "FROM raffle_tickets " +
            "WHERE period_id = :periodId AND user_id = :userId";

    @Language("MySQL")
    public static final String SELECT_BALANCE_FOR_UPDATE_SQL = SELECT_BALANCE_SQL + " FOR UPDATE";

    @Language("MySQL")
    public static final String UPDATE_BUCKETS_SQL = "" +
            "UPDATE raffle_tickets " +
            "SET watchtime_tickets = :watchtime, gifted_sub_tickets = :giftedSub, wager_tickets = :wager, " +
            "bonus_tickets = :bonus, total_tickets = :total, last_updated = :now " +
            "WHERE id = :rowId";

    @Language("MySQL")
    public static final String INSERT_LOG_SQL = "" +
            "INSERT INTO raffle_ticket_log (tenant_id, period_id, user_id, kick_name, ticket_change, source, description, created_at) " +
            "VALUES (:tenantId, :periodId, :userId, :kickName, :delta, :source, :description, :createdAt)";

    @Language("MySQL")
    public static final String SELECT_LOG_SQL = "" +
            "SELECT period_id, user_id, kick_name, ticket_change, source, description, created_at " +
            "FROM raffle_ticket_log " +
            "WHERE period_id = :periodId AND user_id = :userId " +
            "ORDER BY id";

    @Language("MySQL")
    public static final String LEADERBOARD_SQL = "" +
            "SELECT id, period_id, user_id, kick_name, watchtime_tickets, gifted_sub_tickets, wager_tickets, " +
            "bonus_tickets, total_tickets, last_updated " +
            "FROM raffle_tickets " +
            "WHERE period_id = :periodId AND total_tickets > 0 " +
            "ORDER BY total_tickets DESC, id ASC " +
            "LIMIT :limit";

    @Language("MySQL")
    public static final String RANK_SQL = "" +
            "SELECT COUNT(*) + 1 AS place " +
            "FROM raffle_tickets " +
            "WHERE period_id = :periodId " +
            "AND (total_tickets > :total OR (total_tickets = :total AND id < :rowId))";

    @Language("MySQL")
    public static final String STATS_SQL = "" +
            "SELECT COUNT(*) AS participants, " +
            "COALESCE(SUM(total_tickets), 0) AS total, " +
            "COALESCE(SUM(watchtime_tickets), 0) AS watchtime, " +
            "COALESCE(SUM(gifted_sub_tickets), 0) AS gifted_sub, " +
            "COALESCE(SUM(wager_tickets), 0) AS wager, " +
            "COALESCE(SUM(bonus_tickets), 0) AS bonus " +
            "FROM raffle_tickets " +
            "WHERE period_id = :periodId AND total_tickets > 0";

    @Language("MySQL")
    public static final String PARTICIPANTS_SQL = "" +
            "SELECT id, user_id, kick_name, total_tickets " +
            "FROM raffle_tickets " +
            "WHERE period_id = :periodId AND total_tickets > 0 " +
            "ORDER BY id";

    @Language("MySQL")
    public static final String SUM_TOTAL_SQL = "" +
            "SELECT COALESCE(SUM(total_tickets), 0) FROM raffle_tickets WHERE period_id = :periodId";

    @Language("MySQL")
    public static final String DELETE_FOR_TENANT_SQL = "" +
            "DELETE FROM raffle_tickets WHERE tenant_id = :tenantId";

    private static final Map<TicketSource, String> UPSERT_BY_SOURCE = new EnumMap<>(TicketSource.class);

    static {
        for (TicketSource source : TicketSource.values()) {
            UPSERT_BY_SOURCE.put(source, String.format(UPSERT_TEMPLATE, source.getColumn()));
        }
    }

    private static final RowMapper<TicketBalance> BALANCE_MAPPER = (rs, rowNum) -> TicketBalance.builder()
            .rowId(rs.getLong("id"))
            .periodId(rs.getLong("period_id"))
            .userId(rs.getLong("user_id"))
            .kickName(rs.getString("kick_name"))
            .watchtimeTickets(rs.getLong("watchtime_tickets"))
            .giftedSubTickets(rs.getLong("gifted_sub_tickets"))
            .wagerTickets(rs.getLong("wager_tickets"))
            .bonusTickets(rs.getLong("bonus_tickets"))
            .totalTickets(rs.getLong("total_tickets"))
            .lastUpdated(timestampToInstant(rs.getTimestamp("last_updated")))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlTicketDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsertAward(@Nonnull String tenantId, long periodId, long userId, @Nonnull String kickName,
                            @Nonnull TicketSource source, long amount, @Nonnull Instant now) {
        Map<String, ?> params = ImmutableMap.<String, Object>builder()
                .put("tenantId", tenantId)
                .put("periodId", periodId)
                .put("userId", userId)
                .put("kickName", kickName)
                .put("amount", amount)
                .put("now", instantToTimestamp(now))
                .build();
        jdbcTemplate.update(UPSERT_BY_SOURCE.get(source), params);
    }

    @Nonnull
    @Override
    public Optional<TicketBalance> find(long periodId, long userId) {
        return jdbcTemplate.query(SELECT_BALANCE_SQL, balanceKey(periodId, userId), BALANCE_MAPPER).stream()
                .findFirst();
    }

    @Nonnull
    @Override
    public Optional<TicketBalance> findForUpdate(long periodId, long userId) {
        return jdbcTemplate.query(SELECT_BALANCE_FOR_UPDATE_SQL, balanceKey(periodId, userId), BALANCE_MAPPER).stream()
                .findFirst();
    }

    @Override
    public void updateBuckets(@Nonnull TicketBalance balance) {
        Map<String, ?> params = ImmutableMap.<String, Object>builder()
                .put("rowId", balance.getRowId())
                .put("watchtime", balance.getWatchtimeTickets())
                .put("giftedSub", balance.getGiftedSubTickets())
                .put("wager", balance.getWagerTickets())
                .put("bonus", balance.getBonusTickets())
                .put("total", balance.getTotalTickets())
                .put("now", instantToTimestamp(balance.getLastUpdated()))
                .build();
        jdbcTemplate.update(UPDATE_BUCKETS_SQL, params);
    }

    @Override
    public void appendLog(@Nonnull String tenantId, @Nonnull TicketLogEntry entry) {
        Map<String, Object> params = new HashMap<>();
        params.put("tenantId", tenantId);
        params.put("periodId", entry.getPeriodId());
        params.put("userId", entry.getUserId());
        params.put("kickName", entry.getKickName());
        params.put("delta", entry.getDelta());
        params.put("source", entry.getSource());
        params.put("description", entry.getDescription());
        params.put("createdAt", instantToTimestamp(entry.getCreatedAt()));
        jdbcTemplate.update(INSERT_LOG_SQL, params);
    }

    @Nonnull
    @Override
    public List<TicketLogEntry> findLog(long periodId, long userId) {
        return jdbcTemplate.query(SELECT_LOG_SQL, balanceKey(periodId, userId), (rs, rowNum) -> TicketLogEntry.builder()
                .periodId(rs.getLong("period_id"))
                .userId(rs.getLong("user_id"))
                .kickName(rs.getString("kick_name"))
                .delta(rs.getLong("ticket_change"))
                .source(rs.getString("source"))
                .description(rs.getString("description"))
                .createdAt(timestampToInstant(rs.getTimestamp("created_at")))
                .build());
    }

    @Nonnull
    @Override
    public List<TicketBalance> leaderboard(long periodId, int limit) {
        Map<String, ?> params = ImmutableMap.of("periodId", periodId, "limit", limit);
        return jdbcTemplate.query(LEADERBOARD_SQL, params, BALANCE_MAPPER);
    }

    @Nonnull
    @Override
    public Optional<Integer> rank(long periodId, long userId) {
        return find(periodId, userId).map(balance -> {
            Map<String, ?> params = ImmutableMap.of(
                    "periodId", periodId,
                    "total", balance.getTotalTickets(),
                    "rowId", balance.getRowId());
            Number place = jdbcTemplate.queryForObject(RANK_SQL, params, Number.class);
            return place == null ? 1 : place.intValue();
        });
    }

    @Nonnull
    @Override
    public PeriodStats stats(long periodId) {
        Map<String, Object> row = jdbcTemplate.queryForMap(STATS_SQL, ImmutableMap.of("periodId", periodId));
        return PeriodStats.builder()
                .periodId(periodId)
                .totalParticipants(asLong(row.get("participants")))
                .totalTickets(asLong(row.get("total")))
                .watchtimeTickets(asLong(row.get("watchtime")))
                .giftedSubTickets(asLong(row.get("gifted_sub")))
                .wagerTickets(asLong(row.get("wager")))
                .bonusTickets(asLong(row.get("bonus")))
                .build();
    }

    @Nonnull
    @Override
    public List<Participant> participants(long periodId) {
        return jdbcTemplate.query(PARTICIPANTS_SQL, ImmutableMap.of("periodId", periodId), (rs, rowNum) -> new Participant(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getString("kick_name"),
                rs.getLong("total_tickets")
        ));
    }

    @Override
    public long sumTotal(long periodId) {
        Number sum = jdbcTemplate.queryForObject(SUM_TOTAL_SQL, ImmutableMap.of("periodId", periodId), Number.class);
        return sum == null ? 0L : sum.longValue();
    }

    @Override
    public int deleteForTenant(@Nonnull String tenantId) {
        return jdbcTemplate.update(DELETE_FOR_TENANT_SQL, ImmutableMap.of("tenantId", tenantId));
    }

    private static Map<String, ?> balanceKey(long periodId, long userId) {
        return ImmutableMap.of("periodId", periodId, "userId", userId);
    }

    private static long asLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
