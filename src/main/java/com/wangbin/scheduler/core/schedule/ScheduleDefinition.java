package com.wangbin.scheduler.core.schedule;

import java.time.DayOfWeek;
import java.time.Duration;

/**
 * 调度定义，每个调度器实例一份，不可变。
 *
 * @param pollInterval  轮询间隔，触发窗口宽度与之耦合（每小时轮询对应一小时窗口）
 * @param anchorWeekday 触发的星期，为null表示每天
 * @param anchorHourUtc 触发的小时（UTC）
 */
public record ScheduleDefinition(
        Duration pollInterval,
        DayOfWeek anchorWeekday,
        int anchorHourUtc
) {
    public ScheduleDefinition {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (anchorHourUtc < 0 || anchorHourUtc > 23) {
            throw new IllegalArgumentException("anchorHourUtc must be within 0..23, got " + anchorHourUtc);
        }
    }

    public static ScheduleDefinition weekly(Duration pollInterval, DayOfWeek weekday, int hourUtc) {
        if (weekday == null) {
            throw new IllegalArgumentException("anchorWeekday must not be null for a weekly schedule");
        }
        return new ScheduleDefinition(pollInterval, weekday, hourUtc);
    }

    public static ScheduleDefinition daily(Duration pollInterval, int hourUtc) {
        return new ScheduleDefinition(pollInterval, null, hourUtc);
    }

    public boolean isDaily() {
        return anchorWeekday == null;
    }
}
