package com.wangbin.scheduler.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 调度定时器线程池，摘要与流失告警两个轮询器共用
     */
    @Bean(name = "schedulerTimer", destroyMethod = "shutdown")
    public ScheduledExecutorService schedulerTimer() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                2,
                buildNamedThreadFactory("scheduler-timer", true)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 外部端口调用线程池（IO密集型），用于带超时的调用
     */
    @Bean(name = "portCallExecutor", destroyMethod = "shutdownNow")
    public ThreadPoolExecutor portCallExecutor(SchedulerProperties properties) {
        SchedulerProperties.Port port = properties.getPort();
        int poolSize = Math.max(1, port.getPoolSize());
        return new ThreadPoolExecutor(
                poolSize,
                poolSize,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, port.getQueueCapacity())),
                buildNamedThreadFactory("port-call", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
