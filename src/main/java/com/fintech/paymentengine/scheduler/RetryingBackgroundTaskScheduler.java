package com.fintech.paymentengine.scheduler;

import com.fintech.paymentengine.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongConsumer;

/**
 * {@link BackgroundTaskScheduler} running on Spring's {@link TaskScheduler} thread pool, with
 * retries driven by a {@link RetryTemplate}.
 */
@Component
@Slf4j
public class RetryingBackgroundTaskScheduler implements BackgroundTaskScheduler {

    private final TaskScheduler taskScheduler;
    private final RetryTemplate retryTemplate;
    private final Map<BackgroundTask, LongConsumer> handlers = new ConcurrentHashMap<>();

    public RetryingBackgroundTaskScheduler(TaskScheduler taskScheduler, RetryTemplate backgroundTaskRetryTemplate) {
        this.taskScheduler = taskScheduler;
        this.retryTemplate = backgroundTaskRetryTemplate;
    }

    @Override
    public void registerHandler(BackgroundTask task, LongConsumer handler) {
        if (handlers.putIfAbsent(task, handler) != null) {
            throw new IllegalStateException("Handler already registered for " + task);
        }
    }

    @Override
    public void schedule(BackgroundTask task, Long transactionId, Duration delay) {
        if (!handlers.containsKey(task)) {
            throw new IllegalStateException("No handler registered for " + task);
        }
        String correlationId = CorrelationContext.currentCorrelationId();
        Runnable submit = () -> taskScheduler.schedule(
                () -> execute(task, transactionId, correlationId),
                Instant.now().plus(delay));

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit.run();
                }
            });
            log.debug("Task {} for transaction {} deferred until commit", task, transactionId);
        } else {
            submit.run();
        }
    }

    void execute(BackgroundTask task, Long transactionId, String correlationId) {
        LongConsumer handler = handlers.get(task);
        try {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY,
                    correlationId != null ? correlationId : CorrelationContext.generateCorrelationId());
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));

            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying task {} for transaction {} (attempt {})",
                            task, transactionId, context.getRetryCount() + 1);
                }
                handler.accept(transactionId);
                return null;
            }, context -> {
                log.error("Task {} for transaction {} gave up after {} attempts",
                        task, transactionId, context.getRetryCount(), context.getLastThrowable());
                return null;
            });
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }
}
