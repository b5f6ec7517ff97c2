package com.wangbin.scheduler.core.port;

import com.wangbin.scheduler.common.domain.entity.Recipient;

import java.util.List;

/**
 * 接收人目录。整体获取失败视为批次级失败。
 */
public interface RecipientDirectory {
    List<Recipient> listEligibleRecipients();
}
