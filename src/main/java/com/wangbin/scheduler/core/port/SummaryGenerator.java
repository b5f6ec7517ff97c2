package com.wangbin.scheduler.core.port;

import com.wangbin.scheduler.core.digest.DigestContext;

/**
 * 摘要文本生成（通常由大模型实现）。允许失败或返回空，调用方会退回模板文本。
 */
public interface SummaryGenerator {
    String generateSummary(DigestContext context);
}
