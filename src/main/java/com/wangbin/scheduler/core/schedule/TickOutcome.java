package com.wangbin.scheduler.core.schedule;

/**
 * 单次轮询的结果
 */
public enum TickOutcome {
    /** 不在触发窗口 */
    OUTSIDE_WINDOW,
    /** 本周期已成功执行过 */
    ALREADY_COMPLETED,
    /** 上一次执行尚未结束 */
    BUSY,
    /** 执行成功，已标记周期 */
    COMPLETED,
    /** 批次级失败，已回滚 */
    FAILED
}
