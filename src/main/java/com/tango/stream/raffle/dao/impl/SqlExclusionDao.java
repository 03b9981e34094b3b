package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.ExclusionDao;
import com.tango.stream.raffle.model.Exclusion;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.util.List;

@Repository
public class SqlExclusionDao implements ExclusionDao {
    @Language("MySQL")
    public static final String SELECT_SQL = "" +
            "SELECT tenant_id, kick_name, user_id, reason " +
            "FROM raffle_exclusions " +
            "WHERE tenant_id = :tenantId";

    @Language("MySQL")
    public static final String INSERT_SQL = "" +
            "INSERT INTO raffle_exclusions (tenant_id, kick_name, user_id, reason, created_at) " +
            "VALUES (:tenantId, :kickName, :userId, :reason, CURRENT_TIMESTAMP)";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlExclusionDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Nonnull
    @Override
    public List<Exclusion> find(@Nonnull String tenantId) {
        return jdbcTemplate.query(SELECT_SQL, ImmutableMap.of("tenantId", tenantId), (rs, rowNum) -> {
            long userId = rs.getLong("user_id");
            boolean userMissing = rs.wasNull();
            return Exclusion.builder()
                    .tenantId(rs.getString("tenant_id"))
                    .kickName(rs.getString("kick_name"))
                    .userId(userMissing ? null : userId)
                    .reason(rs.getString("reason"))
                    .build();
        });
    }

    @Override
    public void add(@Nonnull Exclusion exclusion) {
        jdbcTemplate.update(INSERT_SQL, new MapSqlParameterSource()
                .addValue("tenantId", exclusion.getTenantId())
                .addValue("kickName", exclusion.getKickName())
                .addValue("userId", exclusion.getUserId())
                .addValue("reason", exclusion.getReason()));
    }
}
