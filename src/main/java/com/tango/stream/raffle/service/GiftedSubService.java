package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.GiftOutcome;
import com.tango.stream.raffle.model.events.GiftSubscription;

import javax.annotation.Nonnull;

public interface GiftedSubService {

    @Nonnull
    GiftOutcome handleGift(@Nonnull String tenantId, @Nonnull GiftSubscription gift);

    long ticketsFor(int recipientCount);
}
