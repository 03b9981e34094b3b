package com.tango.stream.raffle.model;

public interface Metrics {

    String BASE_METRIC_PREFIX = "srt.streamRaffle";

    interface Counters {
        String CHAT_FRAMES = m("chat.frames");
        String CHAT_MALFORMED_FRAMES = m("chat.frames.malformed");
        String CHAT_UNKNOWN_FRAMES = m("chat.frames.unknown");
        String CHAT_RECONNECTS = m("chat.reconnects");
        String CHAT_RELOADS = m("chat.reloads");

        String DISPATCH_REJECTED = m("dispatch.rejected");
        String ROUTED_EVENTS = m("router.events");
        String UNKNOWN_EVENTS = m("router.events.unknown");

        String GIFT_OUTCOMES = m("gift.outcome");
        String TICKETS_AWARDED = m("tickets.awarded");
        String TICKETS_REMOVED = m("tickets.removed");

        String ACCRUAL_USER_FAILURES = m("accrual.user.fail");
        String ACCRUAL_SKIPPED = m("accrual.skipped");

        String WAGER_USER_FAILURES = m("wager.user.fail");
        String WAGER_FETCH_FAILURES = m("wager.fetch.fail");

        String DRAWS = m("draws");
        String DRAW_NOTIFY_ERRORS = m("draws.notify.error");

        String UNDER_LOCK_ERRORS = m("lock.error");
    }

    interface Timers {
        String ACCRUAL_TICK_TIME = m("accrual.tick.time");
        String WAGER_TICK_TIME = m("wager.tick.time");
        String PERIOD_TRANSITION_TIME = m("period.transition.time");
    }

    interface Tags {
        String TENANT = "tenant";
        String OUTCOME = "outcome";
        String SOURCE = "source";
        String ERROR_TYPE = "error_type";
        String EVENT_TYPE = "event_type";
    }

    static String m(String metric) {
        return String.join(".", BASE_METRIC_PREFIX, metric);
    }
}
