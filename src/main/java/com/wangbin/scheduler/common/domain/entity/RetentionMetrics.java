package com.wangbin.scheduler.common.domain.entity;

import lombok.Builder;
import lombok.Value;

/**
 * 全局留存指标
 */
@Value
@Builder
public class RetentionMetrics {
    long totalUsers;
    long activeUsers;
    long inactiveUsers;
    double retentionRate;
    double avgDaysSinceLogin;

    // 无用户时视为健康
    public static RetentionMetrics empty() {
        return RetentionMetrics.builder()
                .retentionRate(100)
                .build();
    }
}
