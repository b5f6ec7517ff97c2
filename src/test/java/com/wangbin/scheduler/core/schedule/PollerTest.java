package com.wangbin.scheduler.core.schedule;

import com.wangbin.scheduler.common.exception.SchedulerException;
import com.wangbin.scheduler.common.web.result.ResultCode;
import com.wangbin.scheduler.monitor.health.HealthStatus;
import com.wangbin.scheduler.monitor.health.JobHealth;
import com.wangbin.scheduler.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PollerTest {

    private static final String IN_WINDOW = "2026-10-19T08:30:00Z";
    private static final String OUTSIDE_WINDOW = "2026-10-18T08:30:00Z";

    private ScheduledExecutorService timer;
    private MutableClock clock;
    private DedupGuard guard;
    private PeriodClock periodClock;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        clock = MutableClock.at(IN_WINDOW);
        guard = new DedupGuard();
        periodClock = PeriodClock.weekly(ScheduleDefinition.weekly(Duration.ofHours(1), DayOfWeek.MONDAY, 8));
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    private Poller<String> poller(RunExecutor<String> executor) {
        return new Poller<>("test", periodClock, guard, executor, timer, clock);
    }

    @Test
    void outsideWindowDoesNotRun() {
        clock = MutableClock.at(OUTSIDE_WINDOW);
        AtomicInteger runs = new AtomicInteger();
        Poller<String> poller = poller(ctx -> "run-" + runs.incrementAndGet());

        assertEquals(TickOutcome.OUTSIDE_WINDOW, poller.tick());
        assertEquals(0, runs.get());
        assertFalse(poller.isRunning());
    }

    @Test
    void runsOncePerPeriod() {
        List<RunContext> contexts = new ArrayList<>();
        Poller<String> poller = poller(ctx -> {
            contexts.add(ctx);
            return "ok";
        });

        assertEquals(TickOutcome.COMPLETED, poller.tick());
        clock.advance(Duration.ofMinutes(20));
        assertEquals(TickOutcome.ALREADY_COMPLETED, poller.tick());
        assertEquals(1, contexts.size());
        assertEquals("2026-W43", contexts.get(0).periodKey());
        assertFalse(contexts.get(0).forced());
        assertEquals("2026-W43", guard.getLastCompletedPeriodKey());

        clock.advance(Duration.ofDays(7));
        assertEquals(TickOutcome.COMPLETED, poller.tick());
        assertEquals(2, contexts.size());
        assertEquals("2026-W44", contexts.get(1).periodKey());
        assertEquals("ok", poller.getLastResult());
    }

    @Test
    void failureRollsBackAndNextTickRetries() {
        AtomicInteger attempts = new AtomicInteger();
        Poller<String> poller = poller(ctx -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("directory unavailable");
            }
            return "ok";
        });

        assertEquals(TickOutcome.FAILED, poller.tick());
        assertNull(guard.getLastCompletedPeriodKey());
        assertFalse(poller.isRunning());
        assertEquals("directory unavailable", poller.getStatus().getLastError());

        assertEquals(TickOutcome.COMPLETED, poller.tick());
        PollerStatus status = poller.getStatus();
        assertEquals(1, status.getSuccessCount());
        assertEquals(1, status.getFailureCount());
        assertNull(status.getLastError());
        assertEquals("2026-W43", status.getLastCompletedPeriodKey());
    }

    @Test
    void overlappingTickAndForceRunAreRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        Poller<String> poller = poller(ctx -> {
            runs.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "slow";
        });

        AtomicReference<TickOutcome> first = new AtomicReference<>();
        Thread worker = new Thread(() -> first.set(poller.tick()));
        worker.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(poller.isRunning());
        assertEquals(TickOutcome.BUSY, poller.tick());
        SchedulerException busy = assertThrows(SchedulerException.class, poller::forceRun);
        assertEquals(ResultCode.SCHEDULER_BUSY.getCode(), busy.getCode());
        assertEquals("test", busy.getJobName());

        release.countDown();
        worker.join(5000);
        assertEquals(TickOutcome.COMPLETED, first.get());
        assertEquals(1, runs.get());
        assertFalse(poller.isRunning());
    }

    @Test
    void forceRunIgnoresWindowAndDoesNotMarkPeriod() {
        clock = MutableClock.at(OUTSIDE_WINDOW);
        List<RunContext> contexts = new ArrayList<>();
        Poller<String> poller = poller(ctx -> {
            contexts.add(ctx);
            return "forced";
        });

        assertEquals("forced", poller.forceRun());
        assertEquals(1, contexts.size());
        assertTrue(contexts.get(0).forced());
        assertNull(guard.getLastCompletedPeriodKey());
    }

    @Test
    void forceRunClearsCompletedPeriod() {
        AtomicInteger runs = new AtomicInteger();
        Poller<String> poller = poller(ctx -> "run-" + runs.incrementAndGet());

        assertEquals(TickOutcome.COMPLETED, poller.tick());
        poller.forceRun();
        assertNull(guard.getLastCompletedPeriodKey());

        assertEquals(TickOutcome.COMPLETED, poller.tick());
        assertEquals(3, runs.get());
    }

    @Test
    void forceRunWrapsBatchFailure() {
        Poller<String> poller = poller(ctx -> {
            throw new IllegalStateException("boom");
        });

        SchedulerException e = assertThrows(SchedulerException.class, poller::forceRun);
        assertEquals(ResultCode.SCHEDULER_RUN_FAILED.getCode(), e.getCode());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertFalse(poller.isRunning());
    }

    @Test
    void startAndStopAreIdempotent() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        Poller<String> poller = poller(ctx -> {
            ran.countDown();
            return "ok";
        });

        assertTrue(poller.start());
        assertFalse(poller.start());
        assertTrue(poller.isStarted());
        assertTrue(ran.await(5, TimeUnit.SECONDS), "first check runs immediately on start");

        assertTrue(poller.stop());
        assertFalse(poller.stop());
        assertFalse(poller.isStarted());
        assertFalse(poller.getStatus().isStarted());

        assertTrue(poller.start());
        assertTrue(poller.stop());
    }

    @Test
    void timerShutdownMakesStartedPollerInactive() {
        Poller<String> poller = poller(ctx -> "ok");
        assertFalse(poller.isTimerActive());

        assertTrue(poller.start());
        assertTrue(poller.isTimerActive());
        assertTrue(poller.getStatus().isTimerActive());

        timer.shutdownNow();
        assertTrue(poller.isStarted());
        assertFalse(poller.isTimerActive());
        assertEquals(HealthStatus.Status.DOWN, JobHealth.classify(poller.getStatus()));
    }
}
