package com.wangbin.scheduler.core.schedule;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 轮询器状态快照，用于健康检查与接口展示。
 */
@Value
@Builder
public class PollerStatus {
    String jobName;
    boolean started;
    boolean timerActive;
    boolean running;
    String lastCompletedPeriodKey;
    Instant lastRunAt;
    Object lastResult;
    String lastError;
    long successCount;
    long failureCount;
}
