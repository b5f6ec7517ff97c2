package com.wangbin.scheduler.core.churn;

import com.wangbin.scheduler.common.constant.SchedulerConstant;
import com.wangbin.scheduler.common.domain.entity.RetentionMetrics;
import com.wangbin.scheduler.common.utils.NumberFormatUtil;
import com.wangbin.scheduler.core.port.AuditLog;
import com.wangbin.scheduler.core.port.ChatAlertSender;
import com.wangbin.scheduler.core.port.OwnerNotifier;
import com.wangbin.scheduler.core.port.PortInvoker;
import com.wangbin.scheduler.core.port.RetentionMetricsSource;
import com.wangbin.scheduler.core.schedule.RunContext;
import com.wangbin.scheduler.core.schedule.RunExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 留存阈值检查（单例检查版本）。
 * <p>
 * 留存率严格小于阈值时告警，等于阈值不告警。告警通过三个互相独立的渠道尽力发送：
 * 运营者通知、聊天 webhook、审计日志，任一渠道失败只记录警告。
 * 阈值在检查开始时读取一次，执行过程中调整阈值只影响下一次检查。
 */
@Slf4j
public class ChurnRunExecutor implements RunExecutor<ChurnCheckResult> {

    private final RetentionMetricsSource metricsSource;
    private final ThresholdConfig thresholdConfig;
    private final OwnerNotifier ownerNotifier;
    private final ChatAlertSender chatAlertSender;
    private final AuditLog auditLog;
    private final PortInvoker portInvoker;

    public ChurnRunExecutor(RetentionMetricsSource metricsSource,
                            ThresholdConfig thresholdConfig,
                            OwnerNotifier ownerNotifier,
                            ChatAlertSender chatAlertSender,
                            AuditLog auditLog,
                            PortInvoker portInvoker) {
        this.metricsSource = Objects.requireNonNull(metricsSource);
        this.thresholdConfig = Objects.requireNonNull(thresholdConfig);
        this.ownerNotifier = Objects.requireNonNull(ownerNotifier);
        this.chatAlertSender = Objects.requireNonNull(chatAlertSender);
        this.auditLog = Objects.requireNonNull(auditLog);
        this.portInvoker = Objects.requireNonNull(portInvoker);
    }

    @Override
    public ChurnCheckResult run(RunContext context) {
        double threshold = thresholdConfig.getValue();
        RetentionMetrics metrics = portInvoker.call("getGlobalRetentionMetrics", metricsSource::getGlobalRetentionMetrics);
        boolean alert = metrics.getRetentionRate() < threshold;

        boolean ownerNotified = false;
        int delivered = 0;
        if (alert) {
            log.warn("[churn] 留存率低于阈值 retentionRate={}%, threshold={}%", metrics.getRetentionRate(), threshold);

            ownerNotified = deliver("notifyOwner", () -> ownerNotifier.notifyOwner(
                    ownerTitle(metrics, context.forced()), ownerContent(metrics, threshold, context.periodKey())));
            if (ownerNotified) {
                delivered++;
            }
            if (deliver("sendChatAlert", () -> chatAlertSender.sendChatAlert(payload(metrics, threshold, context)))) {
                delivered++;
            }
            if (deliver("writeAuditEntry", () -> auditLog.writeAuditEntry(
                    SchedulerConstant.AUDIT_ACTION_CHURN_ALERT, auditDetails(metrics, threshold, context.forced())))) {
                delivered++;
            }
        } else {
            log.info("[churn] 留存率正常 retentionRate={}%, threshold={}%", metrics.getRetentionRate(), threshold);
        }

        return ChurnCheckResult.builder()
                .dateKey(context.periodKey())
                .retentionRate(metrics.getRetentionRate())
                .threshold(threshold)
                .alert(alert)
                .ownerNotified(ownerNotified)
                .channelsDelivered(delivered)
                .forced(context.forced())
                .build();
    }

    private boolean deliver(String channel, Runnable action) {
        try {
            portInvoker.run(channel, action);
            return true;
        } catch (Exception e) {
            log.warn("[churn] 告警渠道 {} 发送失败: {}", channel, e.getMessage());
            return false;
        }
    }

    static String ownerTitle(RetentionMetrics metrics, boolean forced) {
        return (forced ? "Forced Churn Check" : "Daily Churn Alert")
                + ": Retention at " + NumberFormatUtil.compact(metrics.getRetentionRate()) + "%";
    }

    static String ownerContent(RetentionMetrics metrics, double threshold, String dateKey) {
        return String.join("\n",
                "**Automated Churn Alert** (" + dateKey + ")",
                "",
                "- Total Users: " + metrics.getTotalUsers(),
                "- Active (30d): " + metrics.getActiveUsers(),
                "- Inactive (30d+): " + metrics.getInactiveUsers(),
                "- Retention Rate: " + NumberFormatUtil.compact(metrics.getRetentionRate()) + "%",
                "- Avg Days Since Login: " + NumberFormatUtil.compact(metrics.getAvgDaysSinceLogin()),
                "- Alert Threshold: " + NumberFormatUtil.compact(threshold) + "%",
                "",
                "Retention is below the " + NumberFormatUtil.compact(threshold) + "% threshold. Consider re-engagement campaigns.");
    }

    private static ChurnAlertPayload payload(RetentionMetrics metrics, double threshold, RunContext context) {
        return ChurnAlertPayload.builder()
                .retentionRate(metrics.getRetentionRate())
                .threshold(threshold)
                .totalUsers(metrics.getTotalUsers())
                .activeUsers(metrics.getActiveUsers())
                .inactiveUsers(metrics.getInactiveUsers())
                .avgDaysSinceLogin(metrics.getAvgDaysSinceLogin())
                .timestamp(context.now())
                .build();
    }

    private static Map<String, Object> auditDetails(RetentionMetrics metrics, double threshold, boolean forced) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("retentionRate", metrics.getRetentionRate());
        details.put("threshold", threshold);
        details.put("activeUsers", metrics.getActiveUsers());
        details.put("inactiveUsers", metrics.getInactiveUsers());
        details.put("automated", !forced);
        return details;
    }
}
