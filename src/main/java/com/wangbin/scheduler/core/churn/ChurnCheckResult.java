package com.wangbin.scheduler.core.churn;

import lombok.Builder;
import lombok.Value;

/**
 * 一次留存检查的结果
 */
@Value
@Builder
public class ChurnCheckResult {
    String dateKey;
    double retentionRate;
    double threshold;
    boolean alert;
    boolean ownerNotified;
    int channelsDelivered;
    boolean forced;
}
