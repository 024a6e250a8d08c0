package com.fintech.paymentengine.config;

import com.fintech.paymentengine.exception.InvariantViolationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pool shared by {@code @Scheduled} sweeps and per-transaction background tasks, and
 * the retry policy applied to background tasks.
 * <p>
 * Invariant violations are not retried: repeating them cannot succeed and they need a human.
 */
@Configuration
public class TaskSchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${payments.tasks.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("payment-tasks-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    public RetryTemplate backgroundTaskRetryTemplate(
            @Value("${payments.tasks.max-attempts:5}") int maxAttempts,
            @Value("${payments.tasks.initial-backoff-ms:2000}") long initialBackoffMs,
            @Value("${payments.tasks.max-backoff-ms:300000}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .notRetryOn(InvariantViolationException.class)
                .build();
    }
}
