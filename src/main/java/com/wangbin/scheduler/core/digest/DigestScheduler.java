package com.wangbin.scheduler.core.digest;

import com.wangbin.scheduler.common.constant.SchedulerConstant;
import com.wangbin.scheduler.core.schedule.DedupGuard;
import com.wangbin.scheduler.core.schedule.PeriodClock;
import com.wangbin.scheduler.core.schedule.Poller;
import com.wangbin.scheduler.core.schedule.PollerStatus;
import com.wangbin.scheduler.core.schedule.TickOutcome;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 摘要调度器：每周锚定时刻按接收人频率扇出推送摘要。
 */
public class DigestScheduler {

    private final Poller<DigestRunResult> poller;

    public DigestScheduler(PeriodClock periodClock,
                           DigestRunExecutor runExecutor,
                           ScheduledExecutorService timer,
                           Clock clock) {
        this.poller = new Poller<>(SchedulerConstant.JOB_DIGEST, periodClock, new DedupGuard(), runExecutor, timer, clock);
    }

    public boolean start() {
        return poller.start();
    }

    public boolean stop() {
        return poller.stop();
    }

    public TickOutcome tick() {
        return poller.tick();
    }

    public DigestRunResult forceRun() {
        return poller.forceRun();
    }

    public boolean isStarted() {
        return poller.isStarted();
    }

    public PollerStatus getStatus() {
        return poller.getStatus();
    }
}
