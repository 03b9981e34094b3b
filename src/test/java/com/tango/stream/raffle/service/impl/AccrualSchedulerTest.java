package com.tango.stream.raffle.service.impl;

import com.tango.stream.raffle.dao.WatchtimeDao;
import com.tango.stream.raffle.model.AccrualReport;
import com.tango.stream.raffle.model.CallSpec;
import com.tango.stream.raffle.model.ConversionSummary;
import com.tango.stream.raffle.service.LocksService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.springframework.core.env.StandardEnvironment;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.tango.stream.raffle.model.Metrics.Counters.ACCRUAL_SKIPPED;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AccrualSchedulerTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private WatchtimeDao watchtimeDao;
    @Mock
    private WatchtimeConverter watchtimeConverter;
    @Mock
    private LocksService locksService;
    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RBucket<Long> lastTick;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final TenantSessionStoreImpl sessionStore = new TenantSessionStoreImpl(clock);
    private AccrualScheduler scheduler;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        ConfigurationService configurationService = new ConfigurationService(new StandardEnvironment(), "", 5000);
        LivenessDetectorImpl livenessDetector = new LivenessDetectorImpl(sessionStore, configurationService);
        when(locksService.doUnderLock(any())).thenAnswer(invocation -> ((CallSpec<Object>) invocation.getArgument(0)).getAction().call());
        when(redissonClient.<Long>getBucket(anyString(), any(Codec.class))).thenReturn(lastTick);
        when(watchtimeConverter.convert(anyString())).thenReturn(ConversionSummary.EMPTY);
        scheduler = new AccrualScheduler(sessionStore, livenessDetector, watchtimeDao, watchtimeConverter, locksService,
                redissonClient, configurationService, meterRegistry, clock);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCreditOnlyViewersSeenWithinWindow() {
        sessionStore.recordChatActivity("t1", "alice", NOW.minusSeconds(30));
        sessionStore.recordChatActivity("t1", "bob", NOW.minusSeconds(90));
        sessionStore.recordChatActivity("t1", "carol", NOW.minus(Duration.ofMinutes(7)));
        when(watchtimeConverter.convert("t1")).thenReturn(new ConversionSummary(1, 10, 0));

        AccrualReport report = scheduler.accrueTenant("t1", NOW, 60);

        ArgumentCaptor<Map<String, Instant>> viewers = ArgumentCaptor.forClass(Map.class);
        verify(watchtimeDao).addSeconds(eq("t1"), viewers.capture(), eq(60L));
        assertEquals(2, viewers.getValue().size());
        assertTrue(viewers.getValue().containsKey("alice"));
        assertTrue(viewers.getValue().containsKey("bob"));
        assertEquals(AccrualReport.Status.ACCRUED, report.getStatus());
        assertEquals(2, report.getViewersCredited());
        assertEquals(10, report.getTicketsAwarded());
    }

    @Test
    void shouldSkipOfflineTenant() {
        sessionStore.recordChatActivity("t1", "alice", NOW.minusSeconds(30));

        AccrualReport report = scheduler.accrueTenant("t1", NOW, 60);

        assertEquals(AccrualReport.Status.SKIPPED_OFFLINE, report.getStatus());
        verifyNoInteractions(watchtimeDao, watchtimeConverter);
        assertEquals(1.0, meterRegistry.counter(ACCRUAL_SKIPPED, "tenant", "t1").count());
    }

    @Test
    void shouldConvertForForcedLiveTenantWithoutViewers() {
        sessionStore.setForceLive("t1", true);

        AccrualReport report = scheduler.accrueTenant("t1", NOW, 60);

        assertEquals(AccrualReport.Status.ACCRUED, report.getStatus());
        assertEquals(0, report.getViewersCredited());
        verify(watchtimeDao, never()).addSeconds(anyString(), anyMap(), anyLong());
        verify(watchtimeConverter).convert("t1");
    }

    @Test
    void shouldReportMissingSession() {
        assertEquals(AccrualReport.Status.NO_SESSION, scheduler.accrueTenant("unknown", NOW, 60).getStatus());
    }

    @Test
    void shouldIsolateTenantFailures() throws Exception {
        live("t1");
        live("t2");
        when(watchtimeConverter.convert("t1")).thenThrow(new IllegalStateException("db down"));

        List<AccrualReport> reports = scheduler.runAccrual();

        assertEquals(2, reports.size());
        assertEquals(AccrualReport.Status.FAILED, report(reports, "t1").getStatus());
        assertEquals(AccrualReport.Status.ACCRUED, report(reports, "t2").getStatus());
        verify(lastTick).set(NOW.toEpochMilli());
    }

    @Test
    void shouldNotCreditTwiceWithinPeriod() throws Exception {
        live("t1");
        when(lastTick.get()).thenReturn(NOW.minusSeconds(10).toEpochMilli());

        List<AccrualReport> reports = scheduler.runAccrual();

        assertTrue(reports.isEmpty());
        verifyNoInteractions(watchtimeDao);
        verify(lastTick, never()).set(anyLong());
    }

    @Test
    void shouldRunWhenPreviousTickIsOld() throws Exception {
        live("t1");
        when(lastTick.get()).thenReturn(NOW.minusSeconds(60).toEpochMilli());

        List<AccrualReport> reports = scheduler.runAccrual();

        assertEquals(1, reports.size());
        verify(watchtimeDao).addSeconds(eq("t1"), anyMap(), eq(60L));
    }

    private void live(String tenantId) {
        sessionStore.recordChatActivity(tenantId, "alice", NOW.minusSeconds(5));
        sessionStore.recordChatActivity(tenantId, "bob", NOW.minusSeconds(5));
    }

    private static AccrualReport report(List<AccrualReport> reports, String tenantId) {
        return reports.stream()
                .filter(report -> report.getTenantId().equals(tenantId))
                .findFirst()
                .orElseThrow(AssertionError::new);
    }
}
