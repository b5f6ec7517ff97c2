package com.wangbin.scheduler;

import com.wangbin.scheduler.common.config.SchedulerProperties;
import com.wangbin.scheduler.core.churn.ChurnAlertScheduler;
import com.wangbin.scheduler.core.digest.DigestScheduler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 按配置启动、停止调度器
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerBootstrap {

    private final SchedulerProperties properties;
    private final DigestScheduler digestScheduler;
    private final ChurnAlertScheduler churnAlertScheduler;

    @PostConstruct
    public void init() {
        if (properties.getDigest().isEnabled()) {
            digestScheduler.start();
        } else {
            log.info("摘要调度器未启用");
        }
        if (properties.getChurn().isEnabled()) {
            churnAlertScheduler.start();
        } else {
            log.info("流失告警调度器未启用");
        }
    }

    @PreDestroy
    public void destroy() {
        log.info("停止所有调度器...");
        digestScheduler.stop();
        churnAlertScheduler.stop();
    }
}
