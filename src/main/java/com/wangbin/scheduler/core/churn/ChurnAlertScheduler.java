package com.wangbin.scheduler.core.churn;

import com.wangbin.scheduler.common.constant.SchedulerConstant;
import com.wangbin.scheduler.core.schedule.DedupGuard;
import com.wangbin.scheduler.core.schedule.PeriodClock;
import com.wangbin.scheduler.core.schedule.Poller;
import com.wangbin.scheduler.core.schedule.PollerStatus;
import com.wangbin.scheduler.core.schedule.TickOutcome;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 流失告警调度器：每天固定小时检查一次全局留存率。
 * <p>
 * {@link #setThreshold(double)} 不占用轮询器的运行标志，检查进行中也可以修改。
 * {@link ChurnRunExecutor} 在每次检查开始时读取一次阈值，修改只对下一次检查生效。
 */
public class ChurnAlertScheduler {

    private final Poller<ChurnCheckResult> poller;
    private final ThresholdConfig thresholdConfig;

    public ChurnAlertScheduler(PeriodClock periodClock,
                               ChurnRunExecutor runExecutor,
                               ThresholdConfig thresholdConfig,
                               ScheduledExecutorService timer,
                               Clock clock) {
        this.poller = new Poller<>(SchedulerConstant.JOB_CHURN, periodClock, new DedupGuard(), runExecutor, timer, clock);
        this.thresholdConfig = thresholdConfig;
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

    public ChurnCheckResult forceRun() {
        return poller.forceRun();
    }

    public double setThreshold(double value) {
        return thresholdConfig.setValue(value);
    }

    public double getThreshold() {
        return thresholdConfig.getValue();
    }

    public boolean isStarted() {
        return poller.isStarted();
    }

    public PollerStatus getStatus() {
        return poller.getStatus();
    }
}
