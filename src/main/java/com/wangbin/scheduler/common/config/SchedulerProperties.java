package com.wangbin.scheduler.common.config;

import com.wangbin.scheduler.common.constant.SchedulerConstant;
import com.wangbin.scheduler.core.digest.DigestSettings;
import com.wangbin.scheduler.core.schedule.ScheduleDefinition;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;

/**
 * scheduler 配置映射
 */
@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private final Digest digest = new Digest();

    private final Churn churn = new Churn();

    private final Port port = new Port();

    private final Chat chat = new Chat();

    @Data
    public static class Digest {
        /**
         * 启动时是否开启轮询
         */
        private boolean enabled = true;

        /**
         * 轮询间隔（毫秒），与触发窗口宽度一致
         */
        private long pollIntervalMs = SchedulerConstant.DEFAULT_POLL_INTERVAL_MS;

        private DayOfWeek anchorWeekday = DayOfWeek.MONDAY;

        private int anchorHourUtc = SchedulerConstant.DEFAULT_DIGEST_HOUR_UTC;

        private String defaultRecipientName = SchedulerConstant.DEFAULT_RECIPIENT_NAME;

        private String notificationLink = SchedulerConstant.DEFAULT_NOTIFICATION_LINK;

        /**
         * 站内通知消息最大长度，超出截断并追加省略号
         */
        private int notificationMaxLength = SchedulerConstant.DEFAULT_NOTIFICATION_MAX_LENGTH;

        public ScheduleDefinition toScheduleDefinition() {
            return ScheduleDefinition.weekly(Duration.ofMillis(pollIntervalMs), anchorWeekday, anchorHourUtc);
        }

        public DigestSettings toSettings() {
            return new DigestSettings(defaultRecipientName, notificationLink, notificationMaxLength);
        }
    }

    @Data
    public static class Churn {
        private boolean enabled = true;

        private long pollIntervalMs = SchedulerConstant.DEFAULT_POLL_INTERVAL_MS;

        private int alertHourUtc = SchedulerConstant.DEFAULT_CHURN_HOUR_UTC;

        /**
         * 初始告警阈值（留存率百分比）
         */
        private double defaultThreshold = SchedulerConstant.DEFAULT_CHURN_THRESHOLD;

        public ScheduleDefinition toScheduleDefinition() {
            return ScheduleDefinition.daily(Duration.ofMillis(pollIntervalMs), alertHourUtc);
        }
    }

    @Data
    public static class Port {
        /**
         * 单次外部调用超时（毫秒）
         */
        private long callTimeoutMs = SchedulerConstant.DEFAULT_PORT_TIMEOUT_MS;

        private int poolSize = 4;

        private int queueCapacity = 200;
    }

    @Data
    public static class Chat {
        /**
         * 聊天告警 webhook 地址，留空表示不发送
         */
        private String webhookUrl = "";

        private long connectTimeoutMs = 5000;
    }
}
