package com.sutdahub.gameservice.clock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 对局时钟线程池。
 *
 * 使用方：
 * 1. TimeoutSupervisor：固定间隔扫描巡检索引；
 * 2. SutdaServiceImpl：流局后的一次性延时重发。
 *
 * 线程为守护线程，名称前缀可配置（默认 sutda-clock-N）。
 * 关闭后不再执行尚未到期的延时任务与周期任务，取消的任务立即出队。
 */
@Slf4j
@Configuration
public class ClockSchedulerConfig {

    @Bean(name = "turnClockScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor turnClockScheduler(
            @Value("${scheduler.clock.corePoolSize:2}") int corePoolSize,
            @Value("${scheduler.clock.threadPrefix:sutda-clock-}") String threadPrefix) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                Math.max(1, corePoolSize), daemonThreads(threadPrefix), new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        log.info("对局时钟线程池: corePoolSize={}, prefix={}", executor.getCorePoolSize(), threadPrefix);
        return executor;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + seq.getAndIncrement());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, e) -> log.error("时钟线程异常退出: {}", th.getName(), e));
            return t;
        };
    }
}
