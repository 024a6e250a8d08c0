package com.fintech.paymentengine.scheduler;

import java.time.Duration;
import java.util.function.LongConsumer;

/**
 * Asynchronous execution of per-transaction background work.
 * <p>
 * Delivery is at least once: a handler that throws is retried with exponential backoff, and
 * the same task may run more than once. Handlers must therefore be idempotent. When called
 * inside a database transaction, the task is only submitted after that transaction commits.
 */
public interface BackgroundTaskScheduler {

    void schedule(BackgroundTask task, Long transactionId, Duration delay);

    void registerHandler(BackgroundTask task, LongConsumer handler);
}
