package com.wangbin.scheduler.core.port.adapter;

import com.wangbin.scheduler.core.port.InAppNotifier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingInAppNotifier implements InAppNotifier {

    @Override
    public void writeInAppRecord(long recipientId, String title, String message, String link) {
        log.info("站内通知 recipientId={}, title={}, link={}, message={}", recipientId, title, link, message);
    }
}
