package com.wangbin.scheduler.common.exception;

import com.wangbin.scheduler.common.web.result.ResultCode;
import lombok.Getter;

import java.time.Duration;

/**
 * 调度器异常
 */
@Getter
public class SchedulerException extends BusinessException {

    private final String jobName;
    private final String operation;

    public SchedulerException(ResultCode resultCode, String message, String jobName, String operation) {
        super(resultCode.getCode(), message);
        this.jobName = jobName;
        this.operation = operation;
    }

    public SchedulerException(ResultCode resultCode, String message, String jobName, String operation, Throwable cause) {
        super(resultCode.getCode(), message, cause);
        this.jobName = jobName;
        this.operation = operation;
    }

    // 调度器正在执行，拒绝重入
    public static SchedulerException busy(String jobName) {
        return new SchedulerException(ResultCode.SCHEDULER_BUSY,
                "Scheduler " + jobName + " is already running", jobName, "run");
    }

    // 批次级失败
    public static SchedulerException runFailed(String jobName, Throwable cause) {
        return new SchedulerException(ResultCode.SCHEDULER_RUN_FAILED,
                "Scheduler " + jobName + " run failed: " + cause.getMessage(), jobName, "run", cause);
    }

    // 外部调用超时
    public static SchedulerException timeout(String operation, Duration timeout) {
        return new SchedulerException(ResultCode.PORT_TIMEOUT,
                operation + " timed out after " + timeout.toMillis() + "ms", null, operation);
    }

    // 外部调用抛出受检异常
    public static SchedulerException portFailure(String operation, Throwable cause) {
        return new SchedulerException(ResultCode.PORT_ERROR,
                operation + " failed: " + cause.getMessage(), null, operation, cause);
    }
}
