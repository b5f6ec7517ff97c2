package com.wangbin.scheduler.core.port;

public interface InAppNotifier {
    void writeInAppRecord(long recipientId, String title, String message, String link);
}
