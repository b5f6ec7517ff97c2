package com.wangbin.scheduler.core.digest;

import com.wangbin.scheduler.common.domain.entity.RecipientMetrics;
import com.wangbin.scheduler.common.domain.enums.Cadence;

/**
 * 生成摘要所需的上下文
 */
public record DigestContext(String recipientName, Cadence cadence, String periodKey, RecipientMetrics metrics) {

    public String periodLabel() {
        return cadence.getPeriodLabel();
    }
}
