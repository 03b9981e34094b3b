package com.tango.stream.raffle.dao.impl;

import com.tango.stream.raffle.BaseTest;
import com.tango.stream.raffle.dao.PeriodDao;
import com.tango.stream.raffle.model.Period;
import com.tango.stream.raffle.model.PeriodStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlPeriodDaoTest extends BaseTest {
    @Autowired
    private PeriodDao periodDao;

    @Test
    void shouldAllowSingleActivePeriodPerTenant() {
        String tenantId = newTenant();
        Instant start = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant end = start.plus(Duration.ofDays(30));
        long first = periodDao.insertActive(tenantId, start, end, start);

        assertThrows(DataIntegrityViolationException.class, () -> periodDao.insertActive(tenantId, start, end, start));

        assertTrue(periodDao.end(first, 17));
        assertFalse(periodDao.end(first, 20));
        long second = periodDao.insertActive(tenantId, end, end.plus(Duration.ofDays(30)), start);

        Period active = periodDao.findActive(tenantId).orElseThrow(AssertionError::new);
        assertEquals(second, active.getId());
        assertEquals(end, active.getStartDate());
        Period ended = periodDao.find(first).orElseThrow(AssertionError::new);
        assertEquals(PeriodStatus.ENDED, ended.getStatus());
        assertEquals(17, ended.getTotalTickets());
    }

    @Test
    void shouldListRecentPeriodsNewestFirst() {
        String tenantId = newTenant();
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        long january = periodDao.insertActive(tenantId, start, start.plus(Duration.ofDays(31)), start);
        periodDao.end(january, 0);
        long february = periodDao.insertActive(tenantId, start.plus(Duration.ofDays(31)), start.plus(Duration.ofDays(59)), start);

        List<Period> recent = periodDao.findRecent(tenantId, 10);

        assertEquals(2, recent.size());
        assertEquals(february, recent.get(0).getId());
        assertEquals(january, recent.get(1).getId());
        assertEquals(1, periodDao.findRecent(tenantId, 1).size());
        assertTrue(periodDao.findRecent(newTenant(), 10).isEmpty());
    }
}
