package com.tango.stream.raffle.dao;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Read side of the links written by the account-linking flow.
 */
public interface AccountLinkDao {

    @Nonnull
    Optional<Long> findUserId(@Nonnull String tenantId, @Nonnull String kickName);
}
