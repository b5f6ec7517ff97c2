package com.wangbin.scheduler.core.digest;

import com.wangbin.scheduler.common.constant.SchedulerConstant;
import com.wangbin.scheduler.common.domain.entity.RecipientMetrics;
import com.wangbin.scheduler.common.utils.NumberFormatUtil;
import com.wangbin.scheduler.core.port.PortInvoker;
import com.wangbin.scheduler.core.port.SummaryGenerator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 生成个性化摘要文本。生成失败、超时或文本过短时退回由指标拼出的模板句子，
 * 不会因为文案生成失败而让接收人失败。
 */
@Slf4j
public class DigestSummaryComposer {

    private final SummaryGenerator summaryGenerator;
    private final PortInvoker portInvoker;

    public DigestSummaryComposer(SummaryGenerator summaryGenerator, PortInvoker portInvoker) {
        this.summaryGenerator = summaryGenerator;
        this.portInvoker = portInvoker;
    }

    public String compose(DigestContext context) {
        try {
            String text = portInvoker.call("generateSummaryText", () -> summaryGenerator.generateSummary(context));
            if (text != null && text.trim().length() > SchedulerConstant.MIN_GENERATED_SUMMARY_LENGTH) {
                return text.trim();
            }
            log.debug("生成的摘要过短，使用模板文本: {}", context.recipientName());
        } catch (Exception e) {
            log.warn("摘要生成失败，使用模板文本: {}", e.getMessage());
        }
        return fallbackSummary(context);
    }

    /**
     * 纯指标拼出的模板摘要。
     */
    public static String fallbackSummary(DigestContext context) {
        RecipientMetrics metrics = context.metrics();
        List<String> parts = new ArrayList<>();

        int reviews = metrics.getTotalReviews();
        if (reviews > 0) {
            String average = metrics.getAverageScore() == null ? "-" : NumberFormatUtil.compact(metrics.getAverageScore());
            parts.add(String.format("You completed %d review%s with an average score of %s/10.",
                    reviews, reviews > 1 ? "s" : "", average));
        }

        int streak = metrics.currentStreak();
        if (streak > 0) {
            parts.add(String.format("Your creative streak is at %d day%s, keep it going!",
                    streak, streak > 1 ? "s" : ""));
        }

        List<RecipientMetrics.SkillGain> gains = metrics.getSkillGains();
        if (!gains.isEmpty() && gains.get(0).delta() > 0) {
            RecipientMetrics.SkillGain top = gains.get(0);
            parts.add(String.format("Your %s skill improved by +%s this period.",
                    top.dimension(), NumberFormatUtil.compact(top.delta())));
        }

        if (parts.isEmpty()) {
            return "Here's your " + context.periodLabel().toLowerCase(Locale.ROOT) + " recap.";
        }
        return String.join(" ", parts);
    }
}
