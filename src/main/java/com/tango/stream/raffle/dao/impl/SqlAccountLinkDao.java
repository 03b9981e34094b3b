package com.tango.stream.raffle.dao.impl;

import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.dao.AccountLinkDao;
import org.intellij.lang.annotations.Language;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.annotation.Nonnull;
import java.util.Optional;

@Repository
public class SqlAccountLinkDao implements AccountLinkDao {
    @Language("MySQL")
    public static final String SELECT_USER_SQL = "" +
            "SELECT user_id FROM account_links " +
            "WHERE tenant_id = :tenantId AND LOWER(kick_name) = LOWER(:kickName)";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    public SqlAccountLinkDao(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Nonnull
    @Override
    public Optional<Long> findUserId(@Nonnull String tenantId, @Nonnull String kickName) {
        return jdbcTemplate.queryForList(SELECT_USER_SQL, ImmutableMap.of("tenantId", tenantId, "kickName", kickName), Long.class).stream()
                .findFirst();
    }
}
