package com.wangbin.scheduler.core.port;

public interface EmailSender {
    void sendEmail(String to, String subject, String htmlBody);
}
