package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.CallSpec;

import javax.annotation.Nonnull;

public interface LocksService {

    /**
     * Runs the action under local locks first and then under distributed locks with the same names.
     *
     * @throws com.tango.stream.raffle.exceptions.LockAcquiringFail if any lock is not acquired within the wait time
     */
    <T> T doUnderLock(@Nonnull CallSpec<T> callSpec) throws Exception;
}
