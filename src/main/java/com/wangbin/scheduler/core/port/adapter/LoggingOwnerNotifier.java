package com.wangbin.scheduler.core.port.adapter;

import com.wangbin.scheduler.core.port.OwnerNotifier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingOwnerNotifier implements OwnerNotifier {

    @Override
    public void notifyOwner(String title, String content) {
        log.info("运营通知: {}\n{}", title, content);
    }
}
