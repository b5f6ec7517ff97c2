package com.wangbin.scheduler.core.digest;

import com.wangbin.scheduler.common.domain.entity.RecipientMetrics;
import com.wangbin.scheduler.common.utils.NumberFormatUtil;
import org.springframework.web.util.HtmlUtils;

/**
 * 渲染摘要邮件HTML，所有动态值都做HTML转义。
 */
public class DigestEmailRenderer {

    private static final int MAX_SKILL_ROWS = 5;

    public String subject(DigestContext context) {
        return "Your " + context.periodLabel() + " Digest";
    }

    public String render(DigestContext context, String summary) {
        RecipientMetrics metrics = context.metrics();
        StringBuilder html = new StringBuilder(2048);
        html.append("<!DOCTYPE html><html><head><meta charset=\"UTF-8\"><title>")
                .append(escape(context.periodLabel())).append(" Digest</title></head>")
                .append("<body style=\"margin:0;padding:0;font-family:system-ui,sans-serif;\">")
                .append("<div style=\"max-width:640px;margin:0 auto;padding:32px 20px;\">");

        html.append("<h1 style=\"font-size:1.5em;\">").append(escape(context.periodLabel()))
                .append(" Digest for ").append(escape(context.recipientName())).append("</h1>");

        html.append("<p style=\"font-style:italic;line-height:1.6;\">").append(escape(summary)).append("</p>");

        html.append("<table style=\"width:100%;text-align:center;\"><tr>")
                .append(statCell("Reviews", String.valueOf(metrics.getTotalReviews())))
                .append(statCell("Projects", String.valueOf(metrics.getTotalNewProjects())))
                .append(statCell("Avg Score", metrics.getAverageScore() == null
                        ? "-" : NumberFormatUtil.compact(metrics.getAverageScore())))
                .append("</tr></table>");

        RecipientMetrics.Streak streak = metrics.getStreak();
        if (streak != null) {
            html.append("<h3>Creative Streak</h3><table style=\"width:100%;text-align:center;\"><tr>")
                    .append(statCell("Current Streak", String.valueOf(streak.current())))
                    .append(statCell("Longest Streak", String.valueOf(streak.longest())))
                    .append(statCell("Total Activities", String.valueOf(streak.totalUploads() + streak.totalReviews())))
                    .append("</tr></table>");
        }

        if (!metrics.getSkillGains().isEmpty()) {
            html.append("<h3>Skill Growth</h3><ul>");
            metrics.getSkillGains().stream().limit(MAX_SKILL_ROWS).forEach(gain -> html.append("<li>")
                    .append(escape(gain.dimension())).append(": ")
                    .append(gain.delta() > 0 ? "+" : "").append(NumberFormatUtil.compact(gain.delta()))
                    .append(" (").append(NumberFormatUtil.compact(gain.latestScore())).append("/10)</li>"));
            html.append("</ul>");
        }

        RecipientMetrics.TopTrack topTrack = metrics.getTopTrack();
        if (topTrack != null) {
            html.append("<h3>Top Track</h3><p>").append(escape(topTrack.track())).append(": ")
                    .append(NumberFormatUtil.compact(topTrack.score())).append("/10</p>");
        } else if (metrics.getTotalReviews() == 0) {
            html.append("<p style=\"color:#888;\">No reviews this period.</p>");
        }

        if (metrics.getArchetype() != null) {
            html.append("<h3>Your Artist DNA</h3><p><strong>").append(escape(metrics.getArchetype()))
                    .append("</strong></p>");
        }

        html.append("</div></body></html>");
        return html.toString();
    }

    private static String statCell(String label, String value) {
        return "<td><div style=\"font-size:2em;font-weight:700;\">" + escape(value)
                + "</div><div style=\"font-size:0.75em;color:#888;\">" + escape(label) + "</div></td>";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
