package com.wangbin.scheduler.core.churn;

import com.wangbin.scheduler.common.constant.SchedulerConstant;
import lombok.extern.slf4j.Slf4j;

/**
 * 流失告警阈值（留存率百分比），运行时可调整，写入时截断到 [0,100]。
 */
@Slf4j
public class ThresholdConfig {

    private volatile double value;

    public ThresholdConfig(double initialValue) {
        this.value = clamp(initialValue);
    }

    public double getValue() {
        return value;
    }

    /**
     * @return 截断后实际生效的值
     */
    public double setValue(double newValue) {
        double clamped = clamp(newValue);
        this.value = clamped;
        log.info("[churn] 告警阈值更新为 {}%", clamped);
        return clamped;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("threshold must be a number");
        }
        return Math.max(SchedulerConstant.THRESHOLD_MIN, Math.min(SchedulerConstant.THRESHOLD_MAX, value));
    }
}
