package com.wangbin.scheduler.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),

    // 调度相关错误
    SCHEDULER_BUSY(2100, "调度器正在执行"),
    SCHEDULER_RUN_FAILED(2101, "调度执行失败"),

    // 外部端口错误
    PORT_TIMEOUT(6002, "外部调用超时"),
    PORT_ERROR(6003, "外部调用失败"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
