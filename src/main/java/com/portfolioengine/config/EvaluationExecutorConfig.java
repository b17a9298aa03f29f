package com.portfolioengine.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for per-instrument evaluations and the clock every time-based rule reads.
 *
 * <p>CallerRunsPolicy applies back-pressure to the snapshot feed instead of dropping ticks.
 */
@Configuration
public class EvaluationExecutorConfig {

    @Value("${engine.evaluation.core-pool-size:4}")
    private int corePoolSize;

    @Value("${engine.evaluation.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${engine.evaluation.queue-capacity:1000}")
    private int queueCapacity;

    @Bean("evaluationExecutor")
    public ThreadPoolTaskExecutor evaluationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("evaluate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
