package com.wangbin.scheduler.common.exception;

import com.wangbin.scheduler.common.web.result.ApiResult;
import com.wangbin.scheduler.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理调度器异常
     */
    @ExceptionHandler(SchedulerException.class)
    public ApiResult<?> handleSchedulerException(SchedulerException e, HttpServletRequest request) {
        if (e.getCode() == ResultCode.SCHEDULER_BUSY.getCode()) {
            log.warn("调度器忙 - Job: {}, 请求: {}", e.getJobName(), request.getRequestURI());
        } else {
            log.error("调度器异常 - Job: {}, Operation: {}", e.getJobName(), e.getOperation(), e);
        }
        return ApiResult.error(e.getCode(), e.getMessage())
                .addExtra("jobName", e.getJobName())
                .addExtra("operation", e.getOperation());
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数校验异常
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ApiResult<?> handleMethodArgumentNotValidException(MethodArgumentNotValidException e,
                                                              HttpServletRequest request) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        String message = fieldErrors.stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        log.error("参数校验异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理请求体解析异常
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ApiResult<?> handleHttpMessageNotReadable(HttpMessageNotReadableException e,
                                                     HttpServletRequest request) {
        log.error("请求体解析失败: {}", e.getMessage());
        return ApiResult.error(ResultCode.BAD_REQUEST);
    }

    /**
     * 处理参数非法异常
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ApiResult<?> handleIllegalArgument(IllegalArgumentException e, HttpServletRequest request) {
        log.error("参数非法: {}", e.getMessage());
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), e.getMessage());
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        String requestURI = request.getRequestURI();
        String method = request.getMethod();

        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}", requestURI, method, e.getMessage(), e);

        // 生产环境隐藏详细错误信息
        String message = "系统内部错误，请联系管理员";
        if (isDevEnvironment()) {
            message = e.getMessage();
        }

        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), message);
    }

    /**
     * 判断是否为开发环境
     */
    private boolean isDevEnvironment() {
        String activeProfile = System.getProperty("spring.profiles.active");
        return "dev".equals(activeProfile) || "test".equals(activeProfile);
    }
}
