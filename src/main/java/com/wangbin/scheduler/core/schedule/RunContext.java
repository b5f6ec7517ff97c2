package com.wangbin.scheduler.core.schedule;

import java.time.Instant;

/**
 * 单次执行的上下文。
 *
 * @param now       触发时刻
 * @param periodKey 所在周期键
 * @param forced    是否为手动强制执行
 */
public record RunContext(Instant now, String periodKey, boolean forced) {
}
