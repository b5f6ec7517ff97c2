package com.wangbin.scheduler.common.domain.enums;

import lombok.Getter;

/**
 * 摘要推送频率
 */
@Getter
public enum Cadence {

    WEEKLY("weekly", "This Week", 7),
    BIWEEKLY("biweekly", "Last 2 Weeks", 14),
    MONTHLY("monthly", "This Month", 30),
    DISABLED("disabled", "Disabled", 0);

    private final String code;
    private final String periodLabel;
    private final int lookbackDays;

    Cadence(String code, String periodLabel, int lookbackDays) {
        this.code = code;
        this.periodLabel = periodLabel;
        this.lookbackDays = lookbackDays;
    }

    // 根据code获取枚举，未知或为空时按每周处理
    public static Cadence fromCode(String code) {
        if (code == null) {
            return WEEKLY;
        }
        for (Cadence cadence : values()) {
            if (cadence.getCode().equalsIgnoreCase(code.trim())) {
                return cadence;
            }
        }
        return WEEKLY;
    }
}
