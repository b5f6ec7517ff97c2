package com.wangbin.scheduler.common.domain.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 流失阈值更新请求
 */
@Data
public class ThresholdRequest {

    @NotNull(message = "阈值不能为空")
    private Double value;
}
