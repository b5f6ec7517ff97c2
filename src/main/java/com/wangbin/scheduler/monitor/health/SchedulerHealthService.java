package com.wangbin.scheduler.monitor.health;

import com.wangbin.scheduler.core.churn.ChurnAlertScheduler;
import com.wangbin.scheduler.core.digest.DigestScheduler;
import com.wangbin.scheduler.core.schedule.PollerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 汇总摘要与流失告警两个调度器的健康信息
 */
@Service
@RequiredArgsConstructor
public class SchedulerHealthService {

    private final DigestScheduler digestScheduler;
    private final ChurnAlertScheduler churnAlertScheduler;
    private final Clock schedulerClock;

    public HealthStatus getSchedulerHealth() {
        Map<String, Object> churnExtra = new LinkedHashMap<>();
        churnExtra.put("threshold", churnAlertScheduler.getThreshold());

        Map<String, JobHealth> jobs = new LinkedHashMap<>();
        JobHealth digest = toJobHealth(digestScheduler.getStatus(), Map.of());
        JobHealth churn = toJobHealth(churnAlertScheduler.getStatus(), churnExtra);
        jobs.put(digest.getJobName(), digest);
        jobs.put(churn.getJobName(), churn);

        return HealthStatus.builder()
                .status(HealthStatus.worstOf(jobs.values()))
                .checkedAt(schedulerClock.instant())
                .jobs(jobs)
                .build();
    }

    static JobHealth toJobHealth(PollerStatus status, Map<String, Object> extra) {
        HealthStatus.Status health = JobHealth.classify(status);

        Map<String, Object> details = new LinkedHashMap<>(extra);
        details.put("running", status.isRunning());
        details.put("lastRunAt", status.getLastRunAt());
        details.put("lastResult", status.getLastResult());

        return JobHealth.builder()
                .jobName(status.getJobName())
                .status(health)
                .message(message(health, status))
                .lastCompletedPeriodKey(status.getLastCompletedPeriodKey())
                .successCount(status.getSuccessCount())
                .failureCount(status.getFailureCount())
                .details(details)
                .build();
    }

    private static String message(HealthStatus.Status health, PollerStatus status) {
        return switch (health) {
            case UNKNOWN -> "Scheduler is stopped";
            case DOWN -> "Scheduler timer is no longer active";
            case DEGRADED -> "Last run failed: " + status.getLastError();
            case UP -> "Scheduler is running";
        };
    }
}
