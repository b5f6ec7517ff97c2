package com.wangbin.scheduler.core.port.adapter;

import com.wangbin.scheduler.common.domain.entity.Recipient;
import com.wangbin.scheduler.common.domain.entity.RecipientMetrics;
import com.wangbin.scheduler.common.domain.entity.RetentionMetrics;
import com.wangbin.scheduler.core.port.RecipientDirectory;
import com.wangbin.scheduler.core.port.RecipientMetricsSource;
import com.wangbin.scheduler.core.port.RetentionMetricsSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存版受众数据源，未接入真实存储时使用。指标不区分回看窗口。
 */
public class InMemoryAudienceStore implements RecipientDirectory, RecipientMetricsSource, RetentionMetricsSource {

    private final Map<Long, Recipient> recipients = new ConcurrentHashMap<>();
    private final Map<Long, RecipientMetrics> metrics = new ConcurrentHashMap<>();
    private volatile RetentionMetrics retentionMetrics = RetentionMetrics.empty();

    public void putRecipient(Recipient recipient) {
        recipients.put(recipient.getId(), recipient);
    }

    public void putMetrics(long recipientId, RecipientMetrics recipientMetrics) {
        metrics.put(recipientId, recipientMetrics);
    }

    public void setRetentionMetrics(RetentionMetrics retentionMetrics) {
        this.retentionMetrics = retentionMetrics;
    }

    @Override
    public List<Recipient> listEligibleRecipients() {
        List<Recipient> list = new ArrayList<>(recipients.values());
        list.sort(Comparator.comparingLong(Recipient::getId));
        return list;
    }

    @Override
    public RecipientMetrics getRecipientMetrics(long recipientId, int lookbackDays) {
        return metrics.getOrDefault(recipientId, RecipientMetrics.empty());
    }

    @Override
    public RetentionMetrics getGlobalRetentionMetrics() {
        return retentionMetrics;
    }
}
