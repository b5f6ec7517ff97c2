package com.wangbin.scheduler.core.port;

import com.wangbin.scheduler.core.churn.ChurnAlertPayload;

public interface ChatAlertSender {
    void sendChatAlert(ChurnAlertPayload payload);
}
