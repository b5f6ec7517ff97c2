package com.wangbin.scheduler.core.digest;

import com.wangbin.scheduler.common.domain.entity.Recipient;
import com.wangbin.scheduler.common.domain.entity.RecipientMetrics;
import com.wangbin.scheduler.common.domain.enums.Cadence;
import com.wangbin.scheduler.core.port.EmailSender;
import com.wangbin.scheduler.core.port.InAppNotifier;
import com.wangbin.scheduler.core.port.OwnerNotifier;
import com.wangbin.scheduler.core.port.PortInvoker;
import com.wangbin.scheduler.core.port.RecipientDirectory;
import com.wangbin.scheduler.core.port.RecipientMetricsSource;
import com.wangbin.scheduler.core.schedule.RunContext;
import com.wangbin.scheduler.core.schedule.RunExecutor;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 摘要批次执行器（扇出版本）。
 * <p>
 * 接收人逐个顺序处理，每个接收人在独立的隔离边界内执行，失败只计入 {@code failed}，不中断循环。
 * 接收人列表获取失败属于批次级失败，直接抛出。
 */
@Slf4j
public class DigestRunExecutor implements RunExecutor<DigestRunResult> {

    private final RecipientDirectory recipientDirectory;
    private final RecipientMetricsSource metricsSource;
    private final DigestSummaryComposer summaryComposer;
    private final DigestEmailRenderer emailRenderer;
    private final InAppNotifier inAppNotifier;
    private final EmailSender emailSender;
    private final OwnerNotifier ownerNotifier;
    private final CohortSelector cohortSelector;
    private final PortInvoker portInvoker;
    private final DigestSettings settings;
    private final Clock clock;

    @Builder
    public DigestRunExecutor(RecipientDirectory recipientDirectory,
                             RecipientMetricsSource metricsSource,
                             DigestSummaryComposer summaryComposer,
                             DigestEmailRenderer emailRenderer,
                             InAppNotifier inAppNotifier,
                             EmailSender emailSender,
                             OwnerNotifier ownerNotifier,
                             CohortSelector cohortSelector,
                             PortInvoker portInvoker,
                             DigestSettings settings,
                             Clock clock) {
        this.recipientDirectory = Objects.requireNonNull(recipientDirectory);
        this.metricsSource = Objects.requireNonNull(metricsSource);
        this.summaryComposer = Objects.requireNonNull(summaryComposer);
        this.emailRenderer = emailRenderer == null ? new DigestEmailRenderer() : emailRenderer;
        this.inAppNotifier = Objects.requireNonNull(inAppNotifier);
        this.emailSender = Objects.requireNonNull(emailSender);
        this.ownerNotifier = Objects.requireNonNull(ownerNotifier);
        this.cohortSelector = cohortSelector == null ? new CohortSelector() : cohortSelector;
        this.portInvoker = Objects.requireNonNull(portInvoker);
        this.settings = Objects.requireNonNull(settings);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public DigestRunResult run(RunContext context) {
        Instant startedAt = clock.instant();
        List<Recipient> listed = portInvoker.call("listEligibleRecipients", recipientDirectory::listEligibleRecipients);
        List<Recipient> recipients = listed == null ? List.of()
                : listed.stream().filter(Objects::nonNull).collect(Collectors.toList());
        if (listed != null && recipients.size() < listed.size()) {
            log.warn("[digest] 接收人列表包含 {} 个空条目，已忽略", listed.size() - recipients.size());
        }
        if (recipients.isEmpty()) {
            log.info("[digest] 没有可推送的接收人，跳过周期 {}", context.periodKey());
            return DigestRunResult.empty(context.periodKey(), context.forced(), startedAt);
        }

        int sent = 0;
        int skippedCadence = 0;
        int skippedNoActivity = 0;
        List<Long> failedIds = new ArrayList<>();

        for (Recipient recipient : recipients) {
            RecipientOutcome outcome = processRecipient(recipient, context);
            switch (outcome.status()) {
                case SENT -> sent++;
                case SKIPPED_CADENCE -> skippedCadence++;
                case SKIPPED_NO_ACTIVITY -> skippedNoActivity++;
                case FAILED -> failedIds.add(outcome.recipientId());
            }
        }

        DigestRunResult result = DigestRunResult.builder()
                .periodKey(context.periodKey())
                .forced(context.forced())
                .attempted(recipients.size())
                .sent(sent)
                .skippedCadence(skippedCadence)
                .skippedNoActivity(skippedNoActivity)
                .failed(failedIds.size())
                .failedRecipientIds(List.copyOf(failedIds))
                .startedAt(startedAt)
                .durationMs(Duration.between(startedAt, clock.instant()).toMillis())
                .build();

        log.info("[digest] 批次完成 period={}, attempted={}, sent={}, noActivity={}, cadenceSkip={}, failed={}",
                result.getPeriodKey(), result.getAttempted(), result.getSent(),
                result.getSkippedNoActivity(), result.getSkippedCadence(), result.getFailed());

        reportSummary(result);
        return result;
    }

    /**
     * 处理单个接收人，所有异常都转换为 {@link RecipientOutcome#failed}。空条目在进入循环前已过滤。
     */
    RecipientOutcome processRecipient(Recipient recipient, RunContext context) {
        long recipientId = recipient.getId();
        try {
            Cadence cadence = recipient.getCadence() == null ? Cadence.WEEKLY : recipient.getCadence();
            if (!cohortSelector.includes(cadence, context.now())) {
                return RecipientOutcome.skippedCadence(recipientId);
            }

            int lookbackDays = cadence.getLookbackDays();
            RecipientMetrics metrics = portInvoker.call("getRecipientMetrics",
                    () -> metricsSource.getRecipientMetrics(recipientId, lookbackDays));
            if (metrics == null || !metrics.hasActivity()) {
                return RecipientOutcome.skippedNoActivity(recipientId);
            }

            DigestContext digestContext = new DigestContext(
                    recipient.displayName(settings.defaultRecipientName()), cadence, context.periodKey(), metrics);
            String summary = summaryComposer.compose(digestContext);
            String title = emailRenderer.subject(digestContext);

            portInvoker.run("writeInAppRecord", () -> inAppNotifier.writeInAppRecord(
                    recipientId, title, settings.truncate(summary), settings.notificationLink()));

            if (recipient.hasEmail()) {
                deliverEmail(recipient, digestContext, summary);
            }
            return RecipientOutcome.sent(recipientId);
        } catch (Exception e) {
            log.error("[digest] 接收人处理失败 recipientId={}", recipientId, e);
            return RecipientOutcome.failed(recipientId, e);
        }
    }

    // 邮件尽力投递，失败不影响sent计数
    private void deliverEmail(Recipient recipient, DigestContext digestContext, String summary) {
        try {
            String html = emailRenderer.render(digestContext, summary);
            String subject = emailRenderer.subject(digestContext);
            portInvoker.run("sendEmail", () -> emailSender.sendEmail(recipient.getEmail(), subject, html));
        } catch (Exception e) {
            log.warn("[digest] 邮件发送失败 recipientId={}: {}", recipient.getId(), e.getMessage());
        }
    }

    private void reportSummary(DigestRunResult result) {
        try {
            portInvoker.run("notifyOwner", () -> ownerNotifier.notifyOwner(
                    result.isForced() ? "Forced Digest Run Complete" : "Digest Run Complete",
                    result.summaryLine()));
        } catch (Exception e) {
            log.warn("[digest] 批次汇总上报失败: {}", e.getMessage());
        }
    }
}
