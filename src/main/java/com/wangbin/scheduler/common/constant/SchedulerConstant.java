package com.wangbin.scheduler.common.constant;

/**
 * 调度服务常量
 */
public class SchedulerConstant {

    private SchedulerConstant() {
    }

    // 任务名称
    public static final String JOB_DIGEST = "digest";
    public static final String JOB_CHURN = "churn";

    // 默认配置
    public static final long DEFAULT_POLL_INTERVAL_MS = 60 * 60 * 1000L; // 每小时轮询
    public static final int DEFAULT_DIGEST_HOUR_UTC = 8;
    public static final int DEFAULT_CHURN_HOUR_UTC = 9;
    public static final double DEFAULT_CHURN_THRESHOLD = 50;
    public static final long DEFAULT_PORT_TIMEOUT_MS = 30_000L;

    // 阈值范围
    public static final double THRESHOLD_MIN = 0;
    public static final double THRESHOLD_MAX = 100;

    // 摘要相关
    public static final int MIN_GENERATED_SUMMARY_LENGTH = 20;
    public static final int DEFAULT_NOTIFICATION_MAX_LENGTH = 200;
    public static final String DEFAULT_NOTIFICATION_LINK = "/digest";
    public static final String DEFAULT_RECIPIENT_NAME = "Artist";

    // 审计动作
    public static final String AUDIT_ACTION_CHURN_ALERT = "auto_churn_alert";

    // 月度摘要只在当月第一个锚定星期触发
    public static final int MONTHLY_TRIGGER_LAST_DAY = 7;
}
