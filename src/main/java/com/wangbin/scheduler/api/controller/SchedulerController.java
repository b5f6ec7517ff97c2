package com.wangbin.scheduler.api.controller;

import com.wangbin.scheduler.common.domain.dto.ThresholdRequest;
import com.wangbin.scheduler.common.web.result.ApiResult;
import com.wangbin.scheduler.core.churn.ChurnAlertScheduler;
import com.wangbin.scheduler.core.churn.ChurnCheckResult;
import com.wangbin.scheduler.core.digest.DigestRunResult;
import com.wangbin.scheduler.core.digest.DigestScheduler;
import com.wangbin.scheduler.monitor.health.HealthStatus;
import com.wangbin.scheduler.monitor.health.SchedulerHealthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 调度器管理接口
 */
@Slf4j
@RestController
@RequestMapping("/schedulers")
@RequiredArgsConstructor
public class SchedulerController {

    private final DigestScheduler digestScheduler;
    private final ChurnAlertScheduler churnAlertScheduler;
    private final SchedulerHealthService schedulerHealthService;

    @GetMapping("/health")
    public HealthStatus health() {
        return schedulerHealthService.getSchedulerHealth();
    }

    @PostMapping("/digest/start")
    public ApiResult<Boolean> startDigest() {
        return ApiResult.success(digestScheduler.start());
    }

    @PostMapping("/digest/stop")
    public ApiResult<Boolean> stopDigest() {
        return ApiResult.success(digestScheduler.stop());
    }

    /**
     * 手动触发摘要推送，忽略时间窗口
     */
    @PostMapping("/digest/force-run")
    public ApiResult<DigestRunResult> forceRunDigest() {
        log.info("收到手动触发摘要推送请求");
        DigestRunResult result = digestScheduler.forceRun();
        return ApiResult.success(result.summaryLine(), result);
    }

    @PostMapping("/churn/start")
    public ApiResult<Boolean> startChurn() {
        return ApiResult.success(churnAlertScheduler.start());
    }

    @PostMapping("/churn/stop")
    public ApiResult<Boolean> stopChurn() {
        return ApiResult.success(churnAlertScheduler.stop());
    }

    @PostMapping("/churn/force-run")
    public ApiResult<ChurnCheckResult> forceRunChurn() {
        log.info("收到手动触发流失检查请求");
        return ApiResult.success(churnAlertScheduler.forceRun());
    }

    @GetMapping("/churn/threshold")
    public ApiResult<Map<String, Double>> getThreshold() {
        return ApiResult.success(Map.of("value", churnAlertScheduler.getThreshold()));
    }

    /**
     * 更新流失阈值，超出 [0,100] 时截断
     */
    @PutMapping("/churn/threshold")
    public ApiResult<Map<String, Double>> setThreshold(@Valid @RequestBody ThresholdRequest request) {
        double applied = churnAlertScheduler.setThreshold(request.getValue());
        return ApiResult.success(Map.of("value", applied));
    }
}
