package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.ConversionDao;
import com.tango.stream.raffle.model.ConversionRecord;
import lombok.extern.slf4j.Slf4j;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.tango.stream.raffle.utils.TimeUtils.instantToTimestamp;

@Slf4j
@Repository
public class SqlConversionDao implements ConversionDao {
    @Language("MySQL")
    public static final String INSERT_SQL = "" +
            "INSERT INTO raffle_watchtime_converted (tenant_id, period_id, kick_name, basis_key, units_converted, tickets_awarded, converted_at) " +
            "VALUES (:tenantId, :periodId, :kickName, :basisKey, :units, :tickets, :now)";

    @Language("MySQL")
    public static final String SUM_WATCHTIME_UNITS_SQL = "" +
            "SELECT COALESCE(SUM(units_converted), 0) " +
            "FROM raffle_watchtime_converted " +
            "WHERE period_id = :periodId AND kick_name = :kickName " +
            "AND (basis_key = 'baseline' OR basis_key LIKE 'watchtime:%')";

    @Language("MySQL")
    public static final String SELECT_SQL = "" +
            "SELECT period_id, kick_name, basis_key, units_converted, tickets_awarded " +
            "FROM raffle_watchtime_converted " +
            "WHERE period_id = :periodId AND kick_name = :kickName " +
            "ORDER BY id";

    @Language("MySQL")
    public static final String DELETE_FOR_TENANT_SQL = "" +
            "DELETE FROM raffle_watchtime_converted WHERE tenant_id = :tenantId";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlConversionDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insertIfAbsent(@Nonnull String tenantId, @Nonnull ConversionRecord record, @Nonnull Instant now) {
        try {
            jdbcTemplate.update(INSERT_SQL, toParams(tenantId, record, now));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("insertIfAbsent(): conversion {} of {} in period {} exists", record.getBasisKey(), record.getKickName(), record.getPeriodId());
            return false;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public void insertBatch(@Nonnull String tenantId, @Nonnull List<ConversionRecord> records, @Nonnull Instant now) {
        if (records.isEmpty()) {
            return;
        }
        Map<String, Object>[] batchParams = records.stream()
                .map(record -> toParams(tenantId, record, now))
                .toArray(Map[]::new);
        jdbcTemplate.batchUpdate(INSERT_SQL, batchParams);
    }

    @Override
    public long sumWatchtimeUnits(long periodId, @Nonnull String kickName) {
        Number sum = jdbcTemplate.queryForObject(SUM_WATCHTIME_UNITS_SQL, ImmutableMap.of("periodId", periodId, "kickName", kickName), Number.class);
        return sum == null ? 0L : sum.longValue();
    }

    @Nonnull
    @Override
    public List<ConversionRecord> find(long periodId, @Nonnull String kickName) {
        return jdbcTemplate.query(SELECT_SQL, ImmutableMap.of("periodId", periodId, "kickName", kickName), (rs, rowNum) -> ConversionRecord.builder()
                .periodId(rs.getLong("period_id"))
                .kickName(rs.getString("kick_name"))
                .basisKey(rs.getString("basis_key"))
                .unitsConverted(rs.getLong("units_converted"))
                .ticketsAwarded(rs.getLong("tickets_awarded"))
                .build());
    }

    @Override
    public int deleteForTenant(@Nonnull String tenantId) {
        return jdbcTemplate.update(DELETE_FOR_TENANT_SQL, ImmutableMap.of("tenantId", tenantId));
    }

    private static Map<String, Object> toParams(String tenantId, ConversionRecord record, Instant now) {
        return ImmutableMap.<String, Object>builder()
                .put("tenantId", tenantId)
                .put("periodId", record.getPeriodId())
                .put("kickName", record.getKickName())
                .put("basisKey", record.getBasisKey())
                .put("units", record.getUnitsConverted())
                .put("tickets", record.getTicketsAwarded())
                .put("now", instantToTimestamp(now))
                .build();
    }
}
