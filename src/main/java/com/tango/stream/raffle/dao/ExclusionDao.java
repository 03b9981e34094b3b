package com.tango.stream.raffle.dao;

import com.tango.stream.raffle.model.Exclusion;

import javax.annotation.Nonnull;
import java.util.List;

public interface ExclusionDao {

    @Nonnull
    List<Exclusion> find(@Nonnull String tenantId);

    void add(@Nonnull Exclusion exclusion);
}
