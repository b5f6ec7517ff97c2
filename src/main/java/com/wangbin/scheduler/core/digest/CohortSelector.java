package com.wangbin.scheduler.core.digest;

import com.wangbin.scheduler.common.constant.SchedulerConstant;
import com.wangbin.scheduler.common.domain.enums.Cadence;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * 根据接收人的推送频率判断本次触发是否包含该接收人。纯函数，只依赖 {@code now}。
 * <ul>
 *     <li>weekly：始终包含</li>
 *     <li>biweekly：自 {@link #BIWEEKLY_EPOCH} 起的连续周数为偶数时包含</li>
 *     <li>monthly：当月日期 <= 7，即当月第一个锚定星期</li>
 *     <li>disabled：始终不包含</li>
 * </ul>
 * biweekly 不用ISO周序号的奇偶：53周的年份末周与次年第1周同为奇数，会连续三周不推送。
 */
public class CohortSelector {

    /**
     * 连续周计数的起点，1970年ISO第2周的周一
     */
    static final LocalDate BIWEEKLY_EPOCH = LocalDate.of(1970, 1, 5);

    public boolean includes(Cadence cadence, Instant now) {
        return switch (cadence) {
            case WEEKLY -> true;
            case BIWEEKLY -> Math.floorMod(weeksSinceEpoch(now), 2L) == 0;
            case MONTHLY -> now.atZone(ZoneOffset.UTC).getDayOfMonth() <= SchedulerConstant.MONTHLY_TRIGGER_LAST_DAY;
            case DISABLED -> false;
        };
    }

    static long weeksSinceEpoch(Instant now) {
        long days = LocalDate.ofInstant(now, ZoneOffset.UTC).toEpochDay() - BIWEEKLY_EPOCH.toEpochDay();
        return Math.floorDiv(days, 7L);
    }
}
