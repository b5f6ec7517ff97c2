package com.wangbin.scheduler.core.digest;

/**
 * 摘要投递的展示参数
 */
public record DigestSettings(String defaultRecipientName, String notificationLink, int notificationMaxLength) {

    public DigestSettings {
        if (notificationMaxLength < 4) {
            throw new IllegalArgumentException("notificationMaxLength must be >= 4");
        }
    }

    public String truncate(String message) {
        if (message.length() <= notificationMaxLength) {
            return message;
        }
        return message.substring(0, notificationMaxLength - 3) + "...";
    }
}
