package com.wangbin.scheduler.core.churn;

import com.google.common.util.concurrent.MoreExecutors;
import com.wangbin.scheduler.common.domain.entity.RetentionMetrics;
import com.wangbin.scheduler.core.port.PortInvoker;
import com.wangbin.scheduler.core.schedule.PeriodClock;
import com.wangbin.scheduler.core.schedule.ScheduleDefinition;
import com.wangbin.scheduler.core.schedule.TickOutcome;
import com.wangbin.scheduler.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class ChurnAlertSchedulerTest {

    private ScheduledExecutorService timer;
    private MutableClock clock;
    private List<String> ownerTitles;
    private ChurnAlertScheduler scheduler;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        clock = MutableClock.at("2026-10-18T09:00:00Z");
        ownerTitles = new ArrayList<>();

        ThresholdConfig threshold = new ThresholdConfig(50);
        PortInvoker portInvoker = new PortInvoker(MoreExecutors.newDirectExecutorService(), Duration.ofSeconds(5));
        RetentionMetrics metrics = RetentionMetrics.builder().totalUsers(10).activeUsers(4).inactiveUsers(6)
                .retentionRate(40).avgDaysSinceLogin(20).build();
        ChurnRunExecutor executor = new ChurnRunExecutor(() -> metrics, threshold,
                (title, content) -> ownerTitles.add(title), payload -> { }, (action, details) -> { }, portInvoker);
        scheduler = new ChurnAlertScheduler(
                PeriodClock.daily(ScheduleDefinition.daily(Duration.ofHours(1), 9)),
                executor, threshold, timer, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        timer.shutdownNow();
    }

    @Test
    void alertsOncePerDay() {
        assertEquals(TickOutcome.COMPLETED, scheduler.tick());
        clock.advance(Duration.ofMinutes(45));
        assertEquals(TickOutcome.ALREADY_COMPLETED, scheduler.tick());
        clock.advance(Duration.ofHours(1));
        assertEquals(TickOutcome.OUTSIDE_WINDOW, scheduler.tick());

        clock.advance(Duration.ofDays(1).minusHours(1).minusMinutes(45));
        assertEquals(TickOutcome.COMPLETED, scheduler.tick());
        assertEquals(2, ownerTitles.size());
        assertEquals("2026-10-19", scheduler.getStatus().getLastCompletedPeriodKey());
    }

    @Test
    void thresholdUpdateIsClampedAndSilencesAlert() {
        assertEquals(0, scheduler.setThreshold(-5));
        assertEquals(0, scheduler.getThreshold());

        ChurnCheckResult result = scheduler.forceRun();
        assertFalse(result.isAlert());
        assertTrue(result.isForced());
        assertTrue(ownerTitles.isEmpty());
    }
}
