package com.tango.stream.raffle.ingest;

import com.tango.stream.raffle.model.events.NormalizedEvent;
import com.tango.stream.raffle.service.EventRouter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.Nonnull;
import javax.annotation.PreDestroy;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.tango.stream.raffle.model.Metrics.Counters.DISPATCH_REJECTED;
import static com.tango.stream.raffle.model.Metrics.Tags.EVENT_TYPE;
import static com.tango.stream.raffle.model.Metrics.Tags.TENANT;

/**
 * Hands decoded events to the router on a bounded pool so receive loops never wait for consumers.
 */
@Slf4j
@Component
public class EventDispatcher {
    private final ThreadPoolExecutor executor;
    private final EventRouter eventRouter;
    private final MeterRegistry meterRegistry;

    @Autowired
    public EventDispatcher(EventRouter eventRouter,
                           MeterRegistry meterRegistry,
                           @Value("${chat.dispatch.threads:4}") int threads,
                           @Value("${chat.dispatch.queue.capacity:1000}") int queueCapacity) {
        this.eventRouter = eventRouter;
        this.meterRegistry = meterRegistry;
        this.executor = new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new BasicThreadFactory.Builder()
                        .namingPattern("chat-dispatch-thread-%d")
                        .daemon(true)
                        .build(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * @return false if the event was dropped because the queue is full
     */
    public boolean dispatch(@Nonnull String tenantId, @Nonnull NormalizedEvent event) {
        try {
            executor.execute(() -> eventRouter.route(tenantId, event));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("dispatch(): queue is full, {} of tenant {} dropped", event, tenantId);
            meterRegistry.counter(DISPATCH_REJECTED, Tags.of(TENANT, tenantId, EVENT_TYPE, event.getType().name())).increment();
            return false;
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
