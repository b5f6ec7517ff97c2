package com.wangbin.scheduler.core.port;

import com.wangbin.scheduler.common.domain.entity.RecipientMetrics;

public interface RecipientMetricsSource {
    RecipientMetrics getRecipientMetrics(long recipientId, int lookbackDays);
}
