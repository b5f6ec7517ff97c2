package com.wangbin.scheduler.core.port.adapter;

import com.wangbin.scheduler.core.port.EmailSender;
import lombok.extern.slf4j.Slf4j;

/**
 * 未配置邮件服务时只记录日志
 */
@Slf4j
public class LoggingEmailSender implements EmailSender {

    @Override
    public void sendEmail(String to, String subject, String htmlBody) {
        log.info("邮件未配置，跳过发送 to={}, subject={}, bodyLength={}", to, subject, htmlBody.length());
    }
}
