package com.wangbin.scheduler.core.schedule;

/**
 * 执行一个完整批次。抛出的异常视为批次级失败，由 {@link Poller} 回滚去重状态。
 */
@FunctionalInterface
public interface RunExecutor<R> {
    R run(RunContext context);
}
