package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.DrawDao;
import com.tango.stream.raffle.model.DrawResult;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

import static com.tango.stream.raffle.utils.TimeUtils.instantToTimestamp;
import static com.tango.stream.raffle.utils.TimeUtils.timestampToInstant;

@Repository
public class SqlDrawDao implements DrawDao {
    private static final String COLUMNS = "" +
            "id, tenant_id, period_id, total_tickets, total_participants, winner_user_id, winner_kick_name, " +
            "winning_ticket, winner_tickets, win_probability, prize_description, drawn_by, server_seed, client_seed, " +
            "nonce, proof_hash, drawn_at ";

    @Language("MySQL")
    public static final String SELECT_BY_PERIOD_SQL = "" +
            "SELECT " + COLUMNS +
            "FROM raffle_draws " +
            "WHERE period_id = :periodId";

    @Language("MySQL")
    public static final String HISTORY_SQL = "" +
            "SELECT " + COLUMNS +
            "FROM raffle_draws " +
            "WHERE tenant_id = :tenantId " +
            "ORDER BY drawn_at DESC, id DESC " +
            "LIMIT :limit";

    @Language("MySQL")
    public static final String INSERT_SQL = "" +
            "INSERT INTO raffle_draws (tenant_id, period_id, total_tickets, total_participants, winner_user_id, " +
            "winner_kick_name, winning_ticket, winner_tickets, win_probability, prize_description, drawn_by, " +
            "server_seed, client_seed, nonce, proof_hash, drawn_at) " +
            "VALUES (:tenantId, :periodId, :totalTickets, :totalParticipants, :winnerUserId, :winnerKickName, " +
            ":winningTicket, :winnerTickets, :winProbability, :prize, :drawnBy, :serverSeed, :clientSeed, :nonce, " +
            ":proofHash, :drawnAt)";

    private static final RowMapper<DrawResult> DRAW_MAPPER = (rs, rowNum) -> DrawResult.builder()
            .id(rs.getLong("id"))
            .tenantId(rs.getString("tenant_id"))
            .periodId(rs.getLong("period_id"))
            .totalTickets(rs.getLong("total_tickets"))
            .totalParticipants(rs.getInt("total_participants"))
            .winnerUserId(rs.getLong("winner_user_id"))
            .winnerKickName(rs.getString("winner_kick_name"))
            .winningTicket(rs.getLong("winning_ticket"))
            .winnerTickets(rs.getLong("winner_tickets"))
            .winProbability(rs.getDouble("win_probability"))
            .prizeDescription(rs.getString("prize_description"))
            .drawnBy(rs.getString("drawn_by"))
            .serverSeed(rs.getString("server_seed"))
            .clientSeed(rs.getString("client_seed"))
            .nonce(rs.getLong("nonce"))
            .proofHash(rs.getString("proof_hash"))
            .drawnAt(timestampToInstant(rs.getTimestamp("drawn_at")))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlDrawDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Nonnull
    @Override
    public Optional<DrawResult> findByPeriod(long periodId) {
        return jdbcTemplate.query(SELECT_BY_PERIOD_SQL, ImmutableMap.of("periodId", periodId), DRAW_MAPPER).stream()
                .findFirst();
    }

    @Override
    public long insert(@Nonnull DrawResult result) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", result.getTenantId())
                .addValue("periodId", result.getPeriodId())
                .addValue("totalTickets", result.getTotalTickets())
                .addValue("totalParticipants", result.getTotalParticipants())
                .addValue("winnerUserId", result.getWinnerUserId())
                .addValue("winnerKickName", result.getWinnerKickName())
                .addValue("winningTicket", result.getWinningTicket())
                .addValue("winnerTickets", result.getWinnerTickets())
                .addValue("winProbability", result.getWinProbability())
                .addValue("prize", result.getPrizeDescription())
                .addValue("drawnBy", result.getDrawnBy())
                .addValue("serverSeed", result.getServerSeed())
                .addValue("clientSeed", result.getClientSeed())
                .addValue("nonce", result.getNonce())
                .addValue("proofHash", result.getProofHash())
                .addValue("drawnAt", instantToTimestamp(result.getDrawnAt()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(INSERT_SQL, params, keyHolder, new String[]{"id"});
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for draw of period " + result.getPeriodId());
        }
        return key.longValue();
    }

    @Nonnull
    @Override
    public List<DrawResult> history(@Nonnull String tenantId, int limit) {
        return jdbcTemplate.query(HISTORY_SQL, ImmutableMap.of("tenantId", tenantId, "limit", limit), DRAW_MAPPER);
    }
}
