package com.wangbin.scheduler.core.port;

import com.wangbin.scheduler.common.exception.SchedulerException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 带超时的外部端口调用。
 * <p>
 * 调用在独立线程池执行，超过 {@code timeout} 即取消并抛出 {@link SchedulerException}，
 * 调用方把超时当作普通失败处理。运行时异常原样抛出，受检异常包装后抛出。
 */
@Slf4j
public class PortInvoker {

    private final ExecutorService executor;
    private final Duration timeout;

    public PortInvoker(ExecutorService executor, Duration timeout) {
        this.executor = Objects.requireNonNull(executor);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeout = timeout;
    }

    public <T> T call(String operation, Callable<T> call) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("外部调用超时: {} ({}ms)", operation, timeout.toMillis());
            throw SchedulerException.timeout(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw SchedulerException.portFailure(operation, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw SchedulerException.portFailure(operation, e);
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
