package com.wangbin.scheduler.common.domain.entity;

import com.wangbin.scheduler.common.domain.enums.Cadence;
import lombok.Builder;
import lombok.Value;

/**
 * 摘要接收人，只读
 */
@Value
@Builder
public class Recipient {
    long id;
    String name;
    String email;

    @Builder.Default
    Cadence cadence = Cadence.WEEKLY;

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public String displayName(String fallback) {
        return name == null || name.isBlank() ? fallback : name;
    }
}
