package com.wangbin.scheduler.core.port.adapter;

import com.wangbin.scheduler.common.utils.JsonUtil;
import com.wangbin.scheduler.core.port.AuditLog;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class LoggingAuditLog implements AuditLog {

    @Override
    public void writeAuditEntry(String action, Map<String, Object> details) {
        log.info("审计日志 action={}, details={}", action, JsonUtil.toJsonString(details));
    }
}
