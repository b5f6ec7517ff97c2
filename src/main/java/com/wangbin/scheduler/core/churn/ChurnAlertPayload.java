package com.wangbin.scheduler.core.churn;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 聊天渠道告警内容
 */
@Value
@Builder
public class ChurnAlertPayload {
    double retentionRate;
    double threshold;
    long totalUsers;
    long activeUsers;
    long inactiveUsers;
    double avgDaysSinceLogin;
    Instant timestamp;
}
