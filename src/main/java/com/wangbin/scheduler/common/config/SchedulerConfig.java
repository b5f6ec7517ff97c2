package com.wangbin.scheduler.common.config;

import com.wangbin.scheduler.core.churn.ChurnAlertScheduler;
import com.wangbin.scheduler.core.churn.ChurnRunExecutor;
import com.wangbin.scheduler.core.churn.ThresholdConfig;
import com.wangbin.scheduler.core.digest.DigestRunExecutor;
import com.wangbin.scheduler.core.digest.DigestScheduler;
import com.wangbin.scheduler.core.digest.DigestSummaryComposer;
import com.wangbin.scheduler.core.port.AuditLog;
import com.wangbin.scheduler.core.port.ChatAlertSender;
import com.wangbin.scheduler.core.port.EmailSender;
import com.wangbin.scheduler.core.port.InAppNotifier;
import com.wangbin.scheduler.core.port.OwnerNotifier;
import com.wangbin.scheduler.core.port.PortInvoker;
import com.wangbin.scheduler.core.port.RecipientDirectory;
import com.wangbin.scheduler.core.port.RecipientMetricsSource;
import com.wangbin.scheduler.core.port.RetentionMetricsSource;
import com.wangbin.scheduler.core.port.SummaryGenerator;
import com.wangbin.scheduler.core.schedule.PeriodClock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 调度器装配
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock schedulerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PortInvoker portInvoker(@Qualifier("portCallExecutor") ThreadPoolExecutor portCallExecutor,
                                   SchedulerProperties properties) {
        return new PortInvoker(portCallExecutor, Duration.ofMillis(properties.getPort().getCallTimeoutMs()));
    }

    @Bean
    public DigestScheduler digestScheduler(SchedulerProperties properties,
                                           RecipientDirectory recipientDirectory,
                                           RecipientMetricsSource recipientMetricsSource,
                                           SummaryGenerator summaryGenerator,
                                           InAppNotifier inAppNotifier,
                                           EmailSender emailSender,
                                           OwnerNotifier ownerNotifier,
                                           PortInvoker portInvoker,
                                           @Qualifier("schedulerTimer") ScheduledExecutorService schedulerTimer,
                                           Clock schedulerClock) {
        SchedulerProperties.Digest digest = properties.getDigest();
        DigestRunExecutor executor = DigestRunExecutor.builder()
                .recipientDirectory(recipientDirectory)
                .metricsSource(recipientMetricsSource)
                .summaryComposer(new DigestSummaryComposer(summaryGenerator, portInvoker))
                .inAppNotifier(inAppNotifier)
                .emailSender(emailSender)
                .ownerNotifier(ownerNotifier)
                .portInvoker(portInvoker)
                .settings(digest.toSettings())
                .clock(schedulerClock)
                .build();
        return new DigestScheduler(PeriodClock.weekly(digest.toScheduleDefinition()), executor,
                schedulerTimer, schedulerClock);
    }

    @Bean
    public ThresholdConfig churnThresholdConfig(SchedulerProperties properties) {
        return new ThresholdConfig(properties.getChurn().getDefaultThreshold());
    }

    @Bean
    public ChurnAlertScheduler churnAlertScheduler(SchedulerProperties properties,
                                                   RetentionMetricsSource retentionMetricsSource,
                                                   ThresholdConfig churnThresholdConfig,
                                                   OwnerNotifier ownerNotifier,
                                                   ChatAlertSender chatAlertSender,
                                                   AuditLog auditLog,
                                                   PortInvoker portInvoker,
                                                   @Qualifier("schedulerTimer") ScheduledExecutorService schedulerTimer,
                                                   Clock schedulerClock) {
        ChurnRunExecutor executor = new ChurnRunExecutor(retentionMetricsSource, churnThresholdConfig,
                ownerNotifier, chatAlertSender, auditLog, portInvoker);
        return new ChurnAlertScheduler(PeriodClock.daily(properties.getChurn().toScheduleDefinition()),
                executor, churnThresholdConfig, schedulerTimer, schedulerClock);
    }
}
