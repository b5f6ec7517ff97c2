package com.wangbin.scheduler.core.port;

import java.util.Map;

public interface AuditLog {
    void writeAuditEntry(String action, Map<String, Object> details);
}
