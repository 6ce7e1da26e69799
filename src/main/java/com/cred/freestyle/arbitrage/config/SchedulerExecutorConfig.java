package com.cred.freestyle.arbitrage.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for alert scans.
 *
 * @author Arbitrage Team
 */
@Configuration
public class SchedulerExecutorConfig {

    @Value("${arbitrage.alerts.scheduler.workers:4}")
    private int workers;

    @Value("${arbitrage.alerts.scheduler.queue-capacity:1000}")
    private int queueCapacity;

    @Bean(name = "alertScanExecutor")
    public ThreadPoolTaskExecutor alertScanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("alert-scan-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
