package com.wangbin.scheduler.core.digest;

/**
 * 单个接收人的处理结果。失败以值的形式返回，由批次循环汇总。
 */
public record RecipientOutcome(long recipientId, Status status, String error) {

    public enum Status {
        SENT,
        SKIPPED_CADENCE,
        SKIPPED_NO_ACTIVITY,
        FAILED
    }

    public static RecipientOutcome sent(long recipientId) {
        return new RecipientOutcome(recipientId, Status.SENT, null);
    }

    public static RecipientOutcome skippedCadence(long recipientId) {
        return new RecipientOutcome(recipientId, Status.SKIPPED_CADENCE, null);
    }

    public static RecipientOutcome skippedNoActivity(long recipientId) {
        return new RecipientOutcome(recipientId, Status.SKIPPED_NO_ACTIVITY, null);
    }

    public static RecipientOutcome failed(long recipientId, Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new RecipientOutcome(recipientId, Status.FAILED, message);
    }
}
