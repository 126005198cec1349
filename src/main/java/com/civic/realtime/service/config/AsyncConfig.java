package com.civic.realtime.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools for the realtime layer.
 *
 * The scheduler runs reconnection delays, acknowledgment timeouts and
 * heartbeats. The dispatch executor drains subscription mailboxes so slow
 * consumers never block the transport thread.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final RealtimeConfig realtimeConfig;

    // ==================== Executor Beans ====================

    @Bean(name = "realtimeScheduler")
    public ThreadPoolTaskScheduler realtimeScheduler(Clock clock) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("realtime-sched-");
        scheduler.setClock(clock);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        log.info("Initializing realtime scheduler");
        return scheduler;
    }

    /**
     * Executor draining subscription mailboxes.
     */
    @Bean(name = "realtimeDispatchExecutor")
    public ThreadPoolTaskExecutor realtimeDispatchExecutor() {
        int threads = realtimeConfig.getDispatch().getThreadCount();
        log.info("Initializing dispatch executor with {} platform threads", threads);
        return createPlatformThreadPool("realtime-dispatch-", threads, threads, 1000);
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                            int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
