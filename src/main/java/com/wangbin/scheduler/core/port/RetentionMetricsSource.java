package com.wangbin.scheduler.core.port;

import com.wangbin.scheduler.common.domain.entity.RetentionMetrics;

public interface RetentionMetricsSource {
    RetentionMetrics getGlobalRetentionMetrics();
}
