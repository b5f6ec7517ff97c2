package com.wangbin.scheduler.core.schedule;

/**
 * 记录最近一次成功完成的周期键，仅保存在进程内存中。
 * <p>
 * 不做加锁，重入保护由 {@link Poller} 的运行标志负责。进程重启后状态丢失，
 * 最坏情况是在同一触发窗口内重启时多执行一次。
 */
public class DedupGuard {

    private volatile String lastCompletedPeriodKey;

    public boolean shouldRun(String periodKey) {
        return !periodKey.equals(lastCompletedPeriodKey);
    }

    public void markCompleted(String periodKey) {
        this.lastCompletedPeriodKey = periodKey;
    }

    public void rollback() {
        this.lastCompletedPeriodKey = null;
    }

    public String getLastCompletedPeriodKey() {
        return lastCompletedPeriodKey;
    }
}
