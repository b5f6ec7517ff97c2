package com.wangbin.scheduler.common.web.result;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一API响应结果
 */
@Data
public class ApiResult<T> {

    private int code;
    private String message;
    private T data;
    private long timestamp;
    private Map<String, Object> extra;

    public ApiResult() {
        this.timestamp = System.currentTimeMillis();
    }

    public static <T> ApiResult<T> success(T data) {
        ApiResult<T> result = new ApiResult<>();
        result.setCode(ResultCode.SUCCESS.getCode());
        result.setMessage(ResultCode.SUCCESS.getMessage());
        result.setData(data);
        return result;
    }

    public static <T> ApiResult<T> success(String message, T data) {
        ApiResult<T> result = success(data);
        result.setMessage(message);
        return result;
    }

    public static <T> ApiResult<T> error(int code, String message) {
        ApiResult<T> result = new ApiResult<>();
        result.setCode(code);
        result.setMessage(message);
        return result;
    }

    public static <T> ApiResult<T> error(ResultCode resultCode) {
        return error(resultCode.getCode(), resultCode.getMessage());
    }

    public boolean isSuccess() {
        return this.code == ResultCode.SUCCESS.getCode();
    }

    /**
     * 附加信息，值为null时忽略
     */
    public ApiResult<T> addExtra(String key, Object value) {
        if (value == null) {
            return this;
        }
        if (this.extra == null) {
            this.extra = new LinkedHashMap<>();
        }
        this.extra.put(key, value);
        return this;
    }
}
