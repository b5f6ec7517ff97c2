package com.wangbin.scheduler.core.digest;

import com.google.common.util.concurrent.MoreExecutors;
import com.wangbin.scheduler.common.domain.entity.Recipient;
import com.wangbin.scheduler.common.domain.entity.RecipientMetrics;
import com.wangbin.scheduler.core.port.PortInvoker;
import com.wangbin.scheduler.core.port.adapter.InMemoryAudienceStore;
import com.wangbin.scheduler.core.schedule.PeriodClock;
import com.wangbin.scheduler.core.schedule.ScheduleDefinition;
import com.wangbin.scheduler.core.schedule.TickOutcome;
import com.wangbin.scheduler.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class DigestSchedulerTest {

    private ScheduledExecutorService timer;
    private MutableClock clock;
    private List<Long> delivered;
    private DigestScheduler scheduler;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        clock = MutableClock.at("2026-10-19T08:05:00Z");
        delivered = new ArrayList<>();

        InMemoryAudienceStore store = new InMemoryAudienceStore();
        store.putRecipient(Recipient.builder().id(1).name("Mia").build());
        store.putMetrics(1, RecipientMetrics.builder().totalReviews(2).averageScore(7.0).build());

        PortInvoker portInvoker = new PortInvoker(MoreExecutors.newDirectExecutorService(), Duration.ofSeconds(5));
        DigestRunExecutor executor = DigestRunExecutor.builder()
                .recipientDirectory(store)
                .metricsSource(store)
                .summaryComposer(new DigestSummaryComposer(ctx -> null, portInvoker))
                .inAppNotifier((id, title, message, link) -> delivered.add(id))
                .emailSender((to, subject, html) -> { })
                .ownerNotifier((title, content) -> { })
                .portInvoker(portInvoker)
                .settings(new DigestSettings("Artist", "/digest", 200))
                .clock(clock)
                .build();
        scheduler = new DigestScheduler(
                PeriodClock.weekly(ScheduleDefinition.weekly(Duration.ofHours(1), DayOfWeek.MONDAY, 8)),
                executor, timer, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        timer.shutdownNow();
    }

    @Test
    void forceRunTwiceDeliversTwice() {
        DigestRunResult first = scheduler.forceRun();
        DigestRunResult second = scheduler.forceRun();

        assertTrue(first.isForced());
        assertEquals(1, second.getSent());
        assertEquals(List.of(1L, 1L), delivered);
        assertNull(scheduler.getStatus().getLastCompletedPeriodKey());
    }

    @Test
    void tickDeliversOncePerWeek() {
        assertEquals(TickOutcome.COMPLETED, scheduler.tick());
        clock.advance(Duration.ofMinutes(30));
        assertEquals(TickOutcome.ALREADY_COMPLETED, scheduler.tick());

        assertEquals(List.of(1L), delivered);
        assertEquals("2026-W43", scheduler.getStatus().getLastCompletedPeriodKey());
        assertEquals(1, scheduler.getStatus().getSuccessCount());
    }
}
