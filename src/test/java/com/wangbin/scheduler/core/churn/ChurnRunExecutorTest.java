package com.wangbin.scheduler.core.churn;

import com.google.common.util.concurrent.MoreExecutors;
import com.wangbin.scheduler.common.constant.SchedulerConstant;
import com.wangbin.scheduler.common.domain.entity.RetentionMetrics;
import com.wangbin.scheduler.core.port.AuditLog;
import com.wangbin.scheduler.core.port.ChatAlertSender;
import com.wangbin.scheduler.core.port.OwnerNotifier;
import com.wangbin.scheduler.core.port.PortInvoker;
import com.wangbin.scheduler.core.schedule.RunContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChurnRunExecutorTest {

    private static final Instant NOW = Instant.parse("2026-10-18T09:10:00Z");
    private static final RunContext SCHEDULED = new RunContext(NOW, "2026-10-18", false);

    private ThresholdConfig threshold;
    private RecordingChannels channels;
    private PortInvoker portInvoker;

    @BeforeEach
    void setUp() {
        threshold = new ThresholdConfig(50);
        channels = new RecordingChannels();
        portInvoker = new PortInvoker(MoreExecutors.newDirectExecutorService(), Duration.ofSeconds(5));
    }

    private ChurnRunExecutor executor(double retentionRate) {
        RetentionMetrics metrics = RetentionMetrics.builder()
                .totalUsers(200)
                .activeUsers(Math.round(retentionRate * 2))
                .inactiveUsers(200 - Math.round(retentionRate * 2))
                .retentionRate(retentionRate)
                .avgDaysSinceLogin(12.4)
                .build();
        return new ChurnRunExecutor(() -> metrics, threshold, channels, channels, channels, portInvoker);
    }

    @Test
    void rateEqualToThresholdDoesNotAlert() {
        ChurnCheckResult result = executor(50).run(SCHEDULED);

        assertFalse(result.isAlert());
        assertEquals(0, result.getChannelsDelivered());
        assertTrue(channels.ownerTitles.isEmpty());
        assertTrue(channels.chatPayloads.isEmpty());
        assertTrue(channels.auditActions.isEmpty());
    }

    @Test
    void rateBelowThresholdAlertsAllChannels() {
        ChurnCheckResult result = executor(42).run(SCHEDULED);

        assertTrue(result.isAlert());
        assertTrue(result.isOwnerNotified());
        assertEquals(3, result.getChannelsDelivered());
        assertEquals("2026-10-18", result.getDateKey());

        assertEquals(List.of("Daily Churn Alert: Retention at 42%"), channels.ownerTitles);
        assertTrue(channels.ownerContents.get(0).contains("- Alert Threshold: 50%"));

        ChurnAlertPayload payload = channels.chatPayloads.get(0);
        assertEquals(42, payload.getRetentionRate());
        assertEquals(50, payload.getThreshold());
        assertEquals(NOW, payload.getTimestamp());

        assertEquals(List.of(SchedulerConstant.AUDIT_ACTION_CHURN_ALERT), channels.auditActions);
        Map<String, Object> details = channels.auditDetails.get(0);
        assertEquals(true, details.get("automated"));
        assertEquals(50.0, details.get("threshold"));
    }

    @Test
    void channelFailuresAreIndependent() {
        channels.failOwner = true;
        channels.failChat = true;

        ChurnCheckResult result = executor(10).run(SCHEDULED);

        assertTrue(result.isAlert());
        assertFalse(result.isOwnerNotified());
        assertEquals(1, result.getChannelsDelivered());
        assertEquals(1, channels.auditActions.size());
    }

    @Test
    void forcedCheckIsMarkedInTitleAndAudit() {
        ChurnCheckResult result = executor(30.5).run(new RunContext(NOW, "2026-10-18", true));

        assertTrue(result.isForced());
        assertEquals("Forced Churn Check: Retention at 30.5%", channels.ownerTitles.get(0));
        assertEquals(false, channels.auditDetails.get(0).get("automated"));
    }

    @Test
    void thresholdChangeAppliesToNextCheck() {
        ChurnRunExecutor executor = executor(60);
        assertFalse(executor.run(SCHEDULED).isAlert());

        threshold.setValue(70);
        ChurnCheckResult result = executor.run(SCHEDULED);
        assertTrue(result.isAlert());
        assertEquals(70, result.getThreshold());
    }

    @Test
    void thresholdChangedDuringCheckIsNotSeenByThatCheck() {
        RetentionMetrics metrics = RetentionMetrics.builder().totalUsers(10).activeUsers(6).inactiveUsers(4)
                .retentionRate(60).build();
        ChurnRunExecutor executor = new ChurnRunExecutor(() -> {
            threshold.setValue(90);
            return metrics;
        }, threshold, channels, channels, channels, portInvoker);

        ChurnCheckResult result = executor.run(SCHEDULED);

        assertFalse(result.isAlert());
        assertEquals(50, result.getThreshold());
        assertEquals(90, threshold.getValue());
        assertTrue(executor.run(SCHEDULED).isAlert());
    }

    @Test
    void metricsFailurePropagates() {
        ChurnRunExecutor executor = new ChurnRunExecutor(() -> {
            throw new IllegalStateException("analytics down");
        }, threshold, channels, channels, channels, portInvoker);

        assertThrows(IllegalStateException.class, () -> executor.run(SCHEDULED));
        assertTrue(channels.ownerTitles.isEmpty());
    }

    static class RecordingChannels implements OwnerNotifier, ChatAlertSender, AuditLog {
        final List<String> ownerTitles = new ArrayList<>();
        final List<String> ownerContents = new ArrayList<>();
        final List<ChurnAlertPayload> chatPayloads = new ArrayList<>();
        final List<String> auditActions = new ArrayList<>();
        final List<Map<String, Object>> auditDetails = new ArrayList<>();
        boolean failOwner;
        boolean failChat;

        @Override
        public void notifyOwner(String title, String content) {
            if (failOwner) {
                throw new IllegalStateException("owner channel down");
            }
            ownerTitles.add(title);
            ownerContents.add(content);
        }

        @Override
        public void sendChatAlert(ChurnAlertPayload payload) {
            if (failChat) {
                throw new IllegalStateException("webhook down");
            }
            chatPayloads.add(payload);
        }

        @Override
        public void writeAuditEntry(String action, Map<String, Object> details) {
            auditActions.add(action);
            auditDetails.add(details);
        }
    }
}
