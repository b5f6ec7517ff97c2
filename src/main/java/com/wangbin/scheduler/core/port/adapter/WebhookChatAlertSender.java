package com.wangbin.scheduler.core.port.adapter;

import com.wangbin.scheduler.common.exception.BusinessException;
import com.wangbin.scheduler.common.utils.JsonUtil;
import com.wangbin.scheduler.common.utils.NumberFormatUtil;
import com.wangbin.scheduler.common.web.result.ResultCode;
import com.wangbin.scheduler.core.churn.ChurnAlertPayload;
import com.wangbin.scheduler.core.port.ChatAlertSender;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 通过 Slack 风格的 incoming webhook 发送流失告警（Java 11+ HttpClient）。
 * webhook 地址为空时只记录日志。
 */
@Slf4j
public class WebhookChatAlertSender implements ChatAlertSender {

    private final String webhookUrl;
    private final Duration timeout;
    private final HttpClient httpClient;

    public WebhookChatAlertSender(String webhookUrl, Duration timeout) {
        this.webhookUrl = webhookUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public boolean isConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public void sendChatAlert(ChurnAlertPayload payload) {
        if (!isConfigured()) {
            log.info("聊天 webhook 未配置，跳过告警: retentionRate={}%", payload.getRetentionRate());
            return;
        }
        String body = JsonUtil.toJsonString(buildMessage(payload));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body == null ? "{}" : body, StandardCharsets.UTF_8))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new BusinessException(ResultCode.PORT_ERROR,
                        "Chat webhook returned HTTP " + response.statusCode() + ": " + response.body());
            }
            log.debug("聊天告警发送成功");
        } catch (IOException e) {
            throw new BusinessException(ResultCode.PORT_ERROR.getCode(), "Chat webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ResultCode.PORT_ERROR.getCode(), "Chat webhook request interrupted", e);
        }
    }

    static Map<String, Object> buildMessage(ChurnAlertPayload payload) {
        String rate = NumberFormatUtil.compact(payload.getRetentionRate());
        String threshold = NumberFormatUtil.compact(payload.getThreshold());

        Map<String, Object> header = Map.of("type", "header",
                "text", Map.of("type", "plain_text", "text", "Churn Alert: Retention Below Threshold"));
        Map<String, Object> fields = Map.of("type", "section", "fields", List.of(
                field("Retention Rate", rate + "%"),
                field("Threshold", threshold + "%"),
                field("Active Users (30d)", String.valueOf(payload.getActiveUsers())),
                field("Inactive Users", String.valueOf(payload.getInactiveUsers())),
                field("Total Users", String.valueOf(payload.getTotalUsers())),
                field("Avg Days Since Login", NumberFormatUtil.compact(payload.getAvgDaysSinceLogin()))));
        Map<String, Object> context = Map.of("type", "context", "elements", List.of(
                Map.of("type", "mrkdwn", "text", payload.getTimestamp() + " | Automated churn scheduler")));

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("text", "Churn Alert: Retention at " + rate + "% (threshold: " + threshold + "%)");
        message.put("blocks", List.of(header, fields, context));
        return message;
    }

    private static Map<String, Object> field(String label, String value) {
        return Map.of("type", "mrkdwn", "text", "*" + label + ":*\n" + value);
    }
}
