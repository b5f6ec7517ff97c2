package com.wangbin.scheduler.common.config;

import com.wangbin.scheduler.core.port.AuditLog;
import com.wangbin.scheduler.core.port.ChatAlertSender;
import com.wangbin.scheduler.core.port.EmailSender;
import com.wangbin.scheduler.core.port.InAppNotifier;
import com.wangbin.scheduler.core.port.OwnerNotifier;
import com.wangbin.scheduler.core.port.RecipientDirectory;
import com.wangbin.scheduler.core.port.RecipientMetricsSource;
import com.wangbin.scheduler.core.port.RetentionMetricsSource;
import com.wangbin.scheduler.core.port.SummaryGenerator;
import com.wangbin.scheduler.core.port.adapter.InMemoryAudienceStore;
import com.wangbin.scheduler.core.port.adapter.LoggingAuditLog;
import com.wangbin.scheduler.core.port.adapter.LoggingEmailSender;
import com.wangbin.scheduler.core.port.adapter.LoggingInAppNotifier;
import com.wangbin.scheduler.core.port.adapter.LoggingOwnerNotifier;
import com.wangbin.scheduler.core.port.adapter.WebhookChatAlertSender;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 外部端口的默认实现，宿主应用声明同类型 Bean 即可替换。
 * 三个数据端口需要一起替换。
 */
@Configuration
public class PortAdapterConfig {

    @Bean
    @ConditionalOnMissingBean({RecipientDirectory.class, RecipientMetricsSource.class, RetentionMetricsSource.class})
    public InMemoryAudienceStore inMemoryAudienceStore() {
        return new InMemoryAudienceStore();
    }

    /**
     * 默认不调用大模型，直接使用模板摘要
     */
    @Bean
    @ConditionalOnMissingBean
    public SummaryGenerator summaryGenerator() {
        return context -> null;
    }

    @Bean
    @ConditionalOnMissingBean
    public InAppNotifier inAppNotifier() {
        return new LoggingInAppNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailSender emailSender() {
        return new LoggingEmailSender();
    }

    @Bean
    @ConditionalOnMissingBean
    public OwnerNotifier ownerNotifier() {
        return new LoggingOwnerNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditLog auditLog() {
        return new LoggingAuditLog();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatAlertSender chatAlertSender(SchedulerProperties properties) {
        SchedulerProperties.Chat chat = properties.getChat();
        return new WebhookChatAlertSender(chat.getWebhookUrl(), Duration.ofMillis(chat.getConnectTimeoutMs()));
    }
}
