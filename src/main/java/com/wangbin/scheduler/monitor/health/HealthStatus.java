package com.wangbin.scheduler.monitor.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * 调度服务整体健康状态，由各任务中最差的状态决定
 */
@Value
@Builder
public class HealthStatus {
    Status status;
    Instant checkedAt;
    Map<String, JobHealth> jobs;

    public enum Status {
        UP(0),
        UNKNOWN(1),
        DEGRADED(2),
        DOWN(3);

        private final int severity;

        Status(int severity) {
            this.severity = severity;
        }

        public boolean isWorseThan(Status other) {
            return severity > other.severity;
        }
    }

    public static Status worstOf(Collection<JobHealth> jobs) {
        Status worst = Status.UP;
        for (JobHealth job : jobs) {
            if (job.getStatus().isWorseThan(worst)) {
                worst = job.getStatus();
            }
        }
        return worst;
    }
}
