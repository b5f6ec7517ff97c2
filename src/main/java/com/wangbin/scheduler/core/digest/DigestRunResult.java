package com.wangbin.scheduler.core.digest;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 一次摘要批次的汇总，每次执行新建，不做持久化。
 */
@Value
@Builder
public class DigestRunResult {
    String periodKey;
    boolean forced;
    int attempted;
    int sent;
    int skippedNoActivity;
    int skippedCadence;
    int failed;

    @Builder.Default
    List<Long> failedRecipientIds = Collections.emptyList();

    Instant startedAt;
    long durationMs;

    public static DigestRunResult empty(String periodKey, boolean forced, Instant startedAt) {
        return DigestRunResult.builder()
                .periodKey(periodKey)
                .forced(forced)
                .startedAt(startedAt)
                .build();
    }

    public String summaryLine() {
        return String.format("Sent to %d recipients (%d no activity, %d cadence skip, %d failed) of %d for %s.",
                sent, skippedNoActivity, skippedCadence, failed, attempted, periodKey);
    }
}
