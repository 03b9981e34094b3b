package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.dao.AccountLinkDao;
import com.tango.stream.raffle.dao.GiftedSubDao;
import com.tango.stream.raffle.dao.PeriodDao;
import com.tango.stream.raffle.model.*;
import com.tango.stream.raffle.model.events.GiftSubscription;
import com.tango.stream.raffle.service.GiftedSubService;
import com.tango.stream.raffle.service.TicketService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.tango.stream.raffle.model.Metrics.Counters.GIFT_OUTCOMES;
import static com.tango.stream.raffle.model.Metrics.Tags.OUTCOME;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;

@Slf4j
@Service
public class GiftedSubServiceImpl implements GiftedSubService {
    static final Pair<String, Long> TICKETS_PER_GIFTED_SUB = Pair.of("raffle.tickets.per.gifted.sub", 15L);

    private final GiftedSubDao giftedSubDao;
    private final AccountLinkDao accountLinkDao;
    private final PeriodDao periodDao;
    private final TicketService ticketService;
    private final TransactionTemplate transactionTemplate;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, AtomicLong> syntheticIdSequences = new ConcurrentHashMap<>();

    @Autowired
    public GiftedSubServiceImpl(GiftedSubDao giftedSubDao,
                                AccountLinkDao accountLinkDao,
                                PeriodDao periodDao,
                                TicketService ticketService,
                                TransactionTemplate transactionTemplate,
                                ConfigurationService configurationService,
                                MeterRegistry meterRegistry) {
        this.giftedSubDao = giftedSubDao;
        this.accountLinkDao = accountLinkDao;
        this.periodDao = periodDao;
        this.ticketService = ticketService;
        this.transactionTemplate = transactionTemplate;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
    }

    @Nonnull
    @Override
    public GiftOutcome handleGift(@Nonnull String tenantId, @Nonnull GiftSubscription gift) {
        GiftOutcome outcome;
        if (StringUtils.isBlank(gift.getGifterUser()) || gift.getRecipientCount() <= 0) {
            log.warn("handleGift(): invalid gift event for tenant {}: {}", tenantId, gift);
            outcome = GiftOutcome.INVALID;
        } else {
            outcome = handleValidGift(tenantId, gift);
        }
        meterRegistry.counter(GIFT_OUTCOMES, Tags.of(TENANT, tenantId, OUTCOME, outcome.name())).increment();
        return outcome;
    }

    private GiftOutcome handleValidGift(String tenantId, GiftSubscription gift) {
        String eventId = StringUtils.isNotBlank(gift.getEventId())
                ? gift.getEventId()
                : syntheticEventId(tenantId, gift);
        try {
            GiftOutcome outcome = transactionTemplate.execute(status -> {
                if (giftedSubDao.exists(tenantId, eventId)) {
                    log.debug("handleGift(): gift {} of tenant {} already processed", eventId, tenantId);
                    return GiftOutcome.DUPLICATE;
                }
                Optional<Period> period = periodDao.findActive(tenantId);
                if (!period.isPresent()) {
                    log.warn("handleGift(): no active period for tenant {}, gift {} ignored", tenantId, eventId);
                    return GiftOutcome.NO_ACTIVE_PERIOD;
                }
                String gifter = gift.getGifterUser();
                Optional<Long> userId = accountLinkDao.findUserId(tenantId, gifter);
                long tickets = userId.isPresent() ? ticketsFor(gift.getRecipientCount()) : 0L;
                boolean inserted = giftedSubDao.insertIfAbsent(GiftedSubRecord.builder()
                        .tenantId(tenantId)
                        .periodId(period.get().getId())
                        .gifterKickName(gifter)
                        .gifterUserId(userId.orElse(null))
                        .subCount(gift.getRecipientCount())
                        .ticketsAwarded(tickets)
                        .kickEventId(eventId)
                        .giftedAt(gift.getAt())
                        .build());
                if (!inserted) {
                    return GiftOutcome.DUPLICATE;
                }
                if (!userId.isPresent()) {
                    log.info("handleGift(): {} gifted {} subs in tenant {} but is not linked", gifter, gift.getRecipientCount(), tenantId);
                    return GiftOutcome.NOT_LINKED;
                }
                LedgerOutcome awarded = ticketService.award(tenantId, userId.get(), gifter, tickets, TicketSource.GIFTED_SUB,
                        String.format("Gifted %d sub%s in chat", gift.getRecipientCount(), gift.getRecipientCount() > 1 ? "s" : ""),
                        period.get().getId());
                if (awarded.getStatus() != LedgerOutcome.Status.AWARDED) {
                    log.error("handleGift(): award of {} tickets to {} failed with {}, gift {} rolled back", tickets, gifter, awarded.getStatus(), eventId);
                    status.setRollbackOnly();
                    return GiftOutcome.FAILED;
                }
                return GiftOutcome.AWARDED;
            });
            return outcome == null ? GiftOutcome.FAILED : outcome;
        } catch (RuntimeException e) {
            log.error("handleGift(): gift {} of tenant {} failed", eventId, tenantId, e);
            return GiftOutcome.FAILED;
        }
    }

    @Override
    public long ticketsFor(int recipientCount) {
        return recipientCount * configurationService.getLong(TICKETS_PER_GIFTED_SUB);
    }

    private String syntheticEventId(String tenantId, GiftSubscription gift) {
        long sequence = syntheticIdSequences.computeIfAbsent(tenantId, id -> new AtomicLong()).incrementAndGet();
        return String.join(":", gift.getGifterUser(), String.valueOf(gift.getAt().toEpochMilli()), String.valueOf(sequence));
    }
}
