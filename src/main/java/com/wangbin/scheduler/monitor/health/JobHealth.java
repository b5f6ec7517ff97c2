package com.wangbin.scheduler.monitor.health;

import com.wangbin.scheduler.core.schedule.PollerStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * 单个调度任务的健康快照
 */
@Value
@Builder
public class JobHealth {
    String jobName;
    HealthStatus.Status status;
    String message;
    String lastCompletedPeriodKey;
    long successCount;
    long failureCount;

    @Builder.Default
    Map<String, Object> details = Collections.emptyMap();

    /**
     * 状态判定：
     * <ul>
     *     <li>未启动：UNKNOWN</li>
     *     <li>已启动但定时任务失效：DOWN，不会再有轮询</li>
     *     <li>最近一次执行失败：DEGRADED，下一次轮询会重试</li>
     *     <li>其余：UP</li>
     * </ul>
     */
    public static HealthStatus.Status classify(PollerStatus status) {
        if (!status.isStarted()) {
            return HealthStatus.Status.UNKNOWN;
        }
        if (!status.isTimerActive()) {
            return HealthStatus.Status.DOWN;
        }
        return status.getLastError() == null ? HealthStatus.Status.UP : HealthStatus.Status.DEGRADED;
    }
}
