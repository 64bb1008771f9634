package com.regimetrader.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for the per-instrument cycle tasks. CallerRunsPolicy keeps a cycle progressing
 * when every worker is busy.
 */
@Configuration
public class AsyncConfig {

    @Value("${regimetrader.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${regimetrader.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${regimetrader.async.queue-capacity:100}")
    private int queueCapacity;

    @Bean("tradingExecutor")
    public ThreadPoolTaskExecutor tradingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("trading-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
