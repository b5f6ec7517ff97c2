package com.wangbin.scheduler.core.schedule;

import com.wangbin.scheduler.common.exception.SchedulerException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 固定间隔轮询器。
 * <p>
 * 每次轮询：置运行标志 → 判断触发窗口 → 查询去重 → 执行批次 → 成功则标记周期，失败则回滚。
 * 运行标志在判断窗口之前设置、在 finally 中清除，前一次执行未结束时新的轮询或强制执行不会重入。
 * {@link #stop()} 只取消定时器，不中断正在执行的批次。
 */
@Slf4j
public class Poller<R> {

    private final String jobName;
    private final PeriodClock periodClock;
    private final DedupGuard dedupGuard;
    private final RunExecutor<R> runExecutor;
    private final ScheduledExecutorService timer;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private ScheduledFuture<?> timerHandle;

    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private volatile R lastResult;
    private volatile String lastError;
    private volatile Instant lastRunAt;

    public Poller(String jobName,
                  PeriodClock periodClock,
                  DedupGuard dedupGuard,
                  RunExecutor<R> runExecutor,
                  ScheduledExecutorService timer,
                  Clock clock) {
        this.jobName = Objects.requireNonNull(jobName);
        this.periodClock = Objects.requireNonNull(periodClock);
        this.dedupGuard = Objects.requireNonNull(dedupGuard);
        this.runExecutor = Objects.requireNonNull(runExecutor);
        this.timer = Objects.requireNonNull(timer);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * 启动定时器，立即执行一次检查，之后按轮询间隔执行。
     *
     * @return 已在运行时返回false
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (timerHandle != null) {
                log.warn("[{}] 调度器已在运行，忽略重复启动", jobName);
                return false;
            }
            long intervalMs = periodClock.getDefinition().pollInterval().toMillis();
            timerHandle = timer.scheduleAtFixedRate(this::safeTick, 0, intervalMs, TimeUnit.MILLISECONDS);
            ScheduleDefinition definition = periodClock.getDefinition();
            log.info("[{}] 调度器启动，轮询间隔: {}ms, 触发日: {}, 触发时间: {}:00 UTC",
                    jobName, intervalMs,
                    definition.isDaily() ? "每天" : definition.anchorWeekday(),
                    definition.anchorHourUtc());
            return true;
        }
    }

    /**
     * 取消定时器。
     *
     * @return 未在运行时返回false
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            if (timerHandle == null) {
                return false;
            }
            timerHandle.cancel(false);
            timerHandle = null;
            log.info("[{}] 调度器已停止", jobName);
            return true;
        }
    }

    public boolean isStarted() {
        synchronized (lifecycleLock) {
            return timerHandle != null;
        }
    }

    /**
     * 已启动且定时任务仍然有效。定时器线程池被关闭或任务被意外取消时返回false。
     */
    public boolean isTimerActive() {
        synchronized (lifecycleLock) {
            return timerHandle != null && !timerHandle.isDone() && !timer.isShutdown();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 执行一次轮询判断。
     */
    public TickOutcome tick() {
        if (!running.compareAndSet(false, true)) {
            log.warn("[{}] 上一次执行尚未结束，跳过本次轮询", jobName);
            return TickOutcome.BUSY;
        }
        try {
            Instant now = clock.instant();
            if (!periodClock.isTriggerWindow(now)) {
                log.debug("[{}] 不在触发窗口: {}", jobName, now);
                return TickOutcome.OUTSIDE_WINDOW;
            }
            String periodKey = periodClock.periodKey(now);
            if (!dedupGuard.shouldRun(periodKey)) {
                log.debug("[{}] 周期 {} 已执行，跳过", jobName, periodKey);
                return TickOutcome.ALREADY_COMPLETED;
            }

            log.info("[{}] 开始执行周期 {}", jobName, periodKey);
            try {
                R result = execute(new RunContext(now, periodKey, false));
                dedupGuard.markCompleted(periodKey);
                log.info("[{}] 周期 {} 执行完成", jobName, periodKey);
                return TickOutcome.COMPLETED;
            } catch (RuntimeException e) {
                // 回滚后下一次轮询会重试整个周期
                dedupGuard.rollback();
                log.error("[{}] 周期 {} 执行失败，已回滚去重状态", jobName, periodKey, e);
                return TickOutcome.FAILED;
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * 绕过触发窗口与去重直接执行一次，用于运维测试。结果不会标记周期。
     *
     * @throws SchedulerException 已有执行在进行，或批次级失败
     */
    public R forceRun() {
        if (!running.compareAndSet(false, true)) {
            throw SchedulerException.busy(jobName);
        }
        try {
            Instant now = clock.instant();
            String periodKey = periodClock.periodKey(now);
            dedupGuard.rollback();
            log.info("[{}] 强制执行，周期 {}", jobName, periodKey);
            try {
                return execute(new RunContext(now, periodKey, true));
            } catch (SchedulerException e) {
                throw e;
            } catch (RuntimeException e) {
                throw SchedulerException.runFailed(jobName, e);
            }
        } finally {
            running.set(false);
        }
    }

    public PollerStatus getStatus() {
        return PollerStatus.builder()
                .jobName(jobName)
                .started(isStarted())
                .timerActive(isTimerActive())
                .running(running.get())
                .lastCompletedPeriodKey(dedupGuard.getLastCompletedPeriodKey())
                .lastRunAt(lastRunAt)
                .lastResult(lastResult)
                .lastError(lastError)
                .successCount(successCount.get())
                .failureCount(failureCount.get())
                .build();
    }

    public String getJobName() {
        return jobName;
    }

    public R getLastResult() {
        return lastResult;
    }

    private R execute(RunContext context) {
        lastRunAt = context.now();
        try {
            R result = runExecutor.run(context);
            lastResult = result;
            lastError = null;
            successCount.incrementAndGet();
            return result;
        } catch (RuntimeException e) {
            lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            failureCount.incrementAndGet();
            throw e;
        }
    }

    // 定时任务抛出异常会导致后续执行被取消，这里兜底
    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("[{}] 轮询异常", jobName, e);
        }
    }
}
