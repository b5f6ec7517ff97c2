package com.wangbin.scheduler.core.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;

/**
 * 日历周期时钟：判断当前是否处于触发窗口，并给出所在周期的键。
 * <p>
 * 所有计算都基于UTC。同一周期内多次调用 {@link #periodKey(Instant)} 返回相同的键，
 * 不同周期返回不同的键，去重依赖这一点。
 */
public abstract class PeriodClock {

    protected final ScheduleDefinition definition;

    protected PeriodClock(ScheduleDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition must not be null");
        }
        this.definition = definition;
    }

    /**
     * 按ISO周分区，键形如 {@code 2026-W3}。跨年时使用ISO周所属年份。
     */
    public static PeriodClock weekly(ScheduleDefinition definition) {
        return new WeeklyClock(definition);
    }

    /**
     * 按月分区，只有当月第一个锚定星期（日期 <= 7）落在窗口内。
     * 内置的摘要调度器使用周时钟加频率筛选处理月度接收人，本时钟供只按月推送的宿主任务使用。
     */
    public static PeriodClock monthly(ScheduleDefinition definition) {
        return new MonthlyClock(definition);
    }

    /**
     * 按天分区，键形如 {@code 2026-10-18}。
     */
    public static PeriodClock daily(ScheduleDefinition definition) {
        return new DailyClock(definition);
    }

    public ScheduleDefinition getDefinition() {
        return definition;
    }

    /**
     * 星期（若有）与小时都匹配时返回true。
     */
    public boolean isTriggerWindow(Instant now) {
        ZonedDateTime utc = toUtc(now);
        if (definition.anchorWeekday() != null && utc.getDayOfWeek() != definition.anchorWeekday()) {
            return false;
        }
        return utc.getHour() == definition.anchorHourUtc();
    }

    public abstract String periodKey(Instant now);

    protected static ZonedDateTime toUtc(Instant now) {
        return now.atZone(ZoneOffset.UTC);
    }

    static final class WeeklyClock extends PeriodClock {

        WeeklyClock(ScheduleDefinition definition) {
            super(definition);
        }

        @Override
        public String periodKey(Instant now) {
            ZonedDateTime utc = toUtc(now);
            return utc.get(IsoFields.WEEK_BASED_YEAR) + "-W" + utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        }
    }

    static final class MonthlyClock extends PeriodClock {

        MonthlyClock(ScheduleDefinition definition) {
            super(definition);
        }

        @Override
        public boolean isTriggerWindow(Instant now) {
            return super.isTriggerWindow(now) && toUtc(now).getDayOfMonth() <= 7;
        }

        @Override
        public String periodKey(Instant now) {
            return YearMonth.from(toUtc(now)).toString();
        }
    }

    static final class DailyClock extends PeriodClock {

        DailyClock(ScheduleDefinition definition) {
            super(definition);
        }

        @Override
        public String periodKey(Instant now) {
            return LocalDate.from(toUtc(now)).toString();
        }
    }
}
