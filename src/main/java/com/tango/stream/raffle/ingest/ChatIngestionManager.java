package com.tango.stream.raffle.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;
import com.tango.stream.raffle.ingest.transport.ChatTransport;
import com.tango.stream.raffle.model.TenantConfig;
import com.tango.stream.raffle.service.TenantConfigService;
import com.tango.stream.raffle.service.TenantSessionStore;
import com.tango.stream.raffle.service.impl.ConfigurationService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.net.URI;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs one chat client thread per enabled tenant and keeps the set of running tenants in line
 * with the stored configuration.
 */
@Slf4j
@Service
public class ChatIngestionManager {
    static final Pair<String, Long> SYNC_PERIOD_SECONDS = Pair.of("chat.tenants.sync.period.seconds", 60L);

    private final ExecutorService clientExecutorService = Executors.newCachedThreadPool(new BasicThreadFactory.Builder()
            .namingPattern("kick-chat-thread-%d")
            .daemon(true)
            .build());
    private final ScheduledExecutorService syncExecutorService = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
            .namingPattern("chat-sync-thread-%d")
            .daemon(true)
            .build());
    private final ConcurrentMap<String, RunningClient> clients = new ConcurrentHashMap<>();

    private final TenantConfigService tenantConfigService;
    private final TenantSessionStore sessionStore;
    private final ChatTransport transport;
    private final FrameDecoder frameDecoder;
    private final EventDispatcher eventDispatcher;
    private final BackoffPolicy backoffPolicy;
    private final ConfigurationService configurationService;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final URI pusherUri;
    private final boolean enabled;

    @Autowired
    public ChatIngestionManager(TenantConfigService tenantConfigService,
                                TenantSessionStore sessionStore,
                                ChatTransport transport,
                                FrameDecoder frameDecoder,
                                EventDispatcher eventDispatcher,
                                BackoffPolicy backoffPolicy,
                                ConfigurationService configurationService,
                                MeterRegistry meterRegistry,
                                ObjectMapper objectMapper,
                                Clock clock,
                                @Value("${chat.pusher.url}") String pusherUrl,
                                @Value("${chat.ingestion.enable:true}") boolean enabled) {
        this.tenantConfigService = tenantConfigService;
        this.sessionStore = sessionStore;
        this.transport = transport;
        this.frameDecoder = frameDecoder;
        this.eventDispatcher = eventDispatcher;
        this.backoffPolicy = backoffPolicy;
        this.configurationService = configurationService;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pusherUri = URI.create(pusherUrl);
        this.enabled = enabled;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            log.info("init(): chat ingestion is disabled");
            return;
        }
        syncExecutorService.schedule(this::runSync, 0, TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        syncExecutorService.shutdownNow();
        for (String tenantId : ImmutableSet.copyOf(clients.keySet())) {
            stop(tenantId);
        }
        clientExecutorService.shutdownNow();
    }

    /**
     * @return false if the tenant is already running or has no usable configuration
     */
    public boolean start(@Nonnull String tenantId) {
        TenantConfig config;
        try {
            config = tenantConfigService.getConfig(tenantId)
                    .orElseThrow(() -> new IllegalStateException("No chat configuration for tenant " + tenantId));
        } catch (IllegalStateException e) {
            log.error("start(): tenant {} not started", tenantId, e);
            return false;
        }
        KickChatClient client = KickChatClient.builder()
                .tenantId(tenantId)
                .pusherUri(pusherUri)
                .tenantConfigService(tenantConfigService)
                .transport(transport)
                .frameDecoder(frameDecoder)
                .sessionStore(sessionStore)
                .eventDispatcher(eventDispatcher)
                .backoffPolicy(backoffPolicy)
                .configurationService(configurationService)
                .meterRegistry(meterRegistry)
                .objectMapper(objectMapper)
                .clock(clock)
                .build();
        RunningClient running = new RunningClient(client);
        if (clients.putIfAbsent(tenantId, running) != null) {
            log.debug("start(): tenant {} is already running", tenantId);
            return false;
        }
        running.future = clientExecutorService.submit(client);
        log.info("start(): chat of tenant {} ({}) started", tenantId, config.getChannelSlug());
        return true;
    }

    /**
     * Stops the tenant's client, closing its socket, and drops its session state.
     */
    public boolean stop(@Nonnull String tenantId) {
        RunningClient running = clients.remove(tenantId);
        if (running == null) {
            return false;
        }
        running.client.stop();
        if (running.future != null) {
            running.future.cancel(true);
        }
        sessionStore.discard(tenantId);
        log.info("stop(): chat of tenant {} stopped", tenantId);
        return true;
    }

    public boolean isRunning(@Nonnull String tenantId) {
        RunningClient running = clients.get(tenantId);
        return running != null && (running.future == null || !running.future.isDone());
    }

    @Nonnull
    public Set<String> runningTenants() {
        return ImmutableSet.copyOf(clients.keySet());
    }

    /**
     * Starts newly enabled tenants, stops removed ones and restarts clients that exited.
     */
    public void syncTenants() {
        Set<String> configured = tenantConfigService.getEnabledTenants().stream()
                .map(TenantConfig::getTenantId)
                .collect(Collectors.toSet());
        for (String tenantId : runningTenants()) {
            if (!configured.contains(tenantId)) {
                stop(tenantId);
            } else if (!isRunning(tenantId)) {
                log.warn("syncTenants(): chat client of tenant {} exited, restarting", tenantId);
                stop(tenantId);
            }
        }
        for (String tenantId : configured) {
            if (!clients.containsKey(tenantId)) {
                start(tenantId);
            }
        }
    }

    private void runSync() {
        try {
            syncTenants();
        } catch (RuntimeException e) {
            log.error("runSync(): tenant sync failed", e);
        }
        syncExecutorService.schedule(this::runSync, configurationService.getLong(SYNC_PERIOD_SECONDS), TimeUnit.SECONDS);
    }

    private static class RunningClient {
        private final KickChatClient client;
        private volatile Future<?> future;

        private RunningClient(KickChatClient client) {
            this.client = client;
        }
    }
}
