package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.GiftedSubDao;
import com.tango.stream.raffle.model.GiftedSubRecord;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;

import static com.tango.stream.raffle.utils.TimeUtils.instantToTimestamp;

@Repository
public class SqlGiftedSubDao implements GiftedSubDao {
    @Language("MySQL")
    public static final String INSERT_SQL = "" +
            "INSERT INTO raffle_gifted_subs (tenant_id, period_id, gifter_kick_name, gifter_user_id, sub_count, tickets_awarded, kick_event_id, gifted_at) " +
            "VALUES (:tenantId, :periodId, :gifter, :gifterUserId, :subCount, :tickets, :eventId, :giftedAt)";

    @Language("MySQL")
    public static final String EXISTS_SQL = "" +
            "SELECT COUNT(*) FROM raffle_gifted_subs WHERE tenant_id = :tenantId AND kick_event_id = :eventId";

    @Language("MySQL")
    public static final String DELETE_FOR_TENANT_SQL = "" +
            "DELETE FROM raffle_gifted_subs WHERE tenant_id = :tenantId";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlGiftedSubDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insertIfAbsent(@Nonnull GiftedSubRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", record.getTenantId())
                .addValue("periodId", record.getPeriodId())
                .addValue("gifter", record.getGifterKickName())
                .addValue("gifterUserId", record.getGifterUserId())
                .addValue("subCount", record.getSubCount())
                .addValue("tickets", record.getTicketsAwarded())
                .addValue("eventId", record.getKickEventId())
                .addValue("giftedAt", instantToTimestamp(record.getGiftedAt()));
        try {
            return jdbcTemplate.update(INSERT_SQL, params) > 0;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public boolean exists(@Nonnull String tenantId, @Nonnull String kickEventId) {
        Number count = jdbcTemplate.queryForObject(EXISTS_SQL, ImmutableMap.of("tenantId", tenantId, "eventId", kickEventId), Number.class);
        return count != null && count.longValue() > 0;
    }

    @Override
    public int deleteForTenant(@Nonnull String tenantId) {
        return jdbcTemplate.update(DELETE_FOR_TENANT_SQL, ImmutableMap.of("tenantId", tenantId));
    }
}
