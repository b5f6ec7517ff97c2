package com.wangbin.scheduler.core.port;

/**
 * 面向运营者的通知渠道，同时作为批次汇总的输出端。
 */
public interface OwnerNotifier {
    void notifyOwner(String title, String content);
}
