package com.fintech.paymentengine.service;

import com.fintech.paymentengine.dto.ReconciliationResult;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionEventType;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import com.fintech.paymentengine.exception.GatewayApiException;
import com.fintech.paymentengine.exception.ReconciliationException;
import com.fintech.paymentengine.gateway.DeclineCodes;
import com.fintech.paymentengine.repository.PaymentTransactionRepository;
import com.fintech.paymentengine.repository.TransactionEventLogRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings PENDING transactions to a conclusion when webhooks alone did not.
 * <p>
 * The status poll asks the gateway about every PENDING transaction still inside its polling
 * window; the timeout sweep handles the ones whose window has elapsed. Both work in pages,
 * go through {@link PaymentSystemController} for every row and keep going when a row fails.
 * Each is guarded against overlapping runs in this JVM; across nodes, the row locks taken by
 * the controller make concurrent runs safe.
 */
@Service
@Slf4j
public class ReconciliationService {

    private final PaymentTransactionRepository transactionRepository;
    private final TransactionEventLogRepository eventLogRepository;
    private final PaymentSystemController controller;
    private final TransactionEventLogService eventLogService;
    private final MeterRegistry meterRegistry;

    @Value("${payments.reconciliation.batch-size:100}")
    private int batchSize = 100;

    @Value("${payments.reconciliation.poll-cadence-seconds:60}")
    private long pollCadenceSeconds = 60;

    @Value("${payments.reconciliation.max-pages:10000}")
    private int maxPages = 10000;

    // Metrics
    private Counter polledCounter;
    private Counter gatewayErrorCounter;
    private Counter failureCounter;
    private Counter expiredDepositCounter;
    private Counter stuckWithdrawalCounter;
    private Timer pollTimer;
    private Timer timeoutTimer;

    private final AtomicBoolean pollRunning = new AtomicBoolean(false);
    private final AtomicBoolean timeoutRunning = new AtomicBoolean(false);

    public ReconciliationService(PaymentTransactionRepository transactionRepository,
                                 TransactionEventLogRepository eventLogRepository,
                                 PaymentSystemController controller,
                                 TransactionEventLogService eventLogService,
                                 MeterRegistry meterRegistry) {
        this.transactionRepository = transactionRepository;
        this.eventLogRepository = eventLogRepository;
        this.controller = controller;
        this.eventLogService = eventLogService;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        polledCounter = Counter.builder("reconciliation.transactions.polled")
                .description("Transactions whose status was queried by the poll")
                .register(meterRegistry);

        gatewayErrorCounter = Counter.builder("reconciliation.gateway.errors")
                .description("Errors communicating with payment gateways during the poll")
                .register(meterRegistry);

        failureCounter = Counter.builder("reconciliation.transactions.failure")
                .description("Transactions that could not be reconciled because of an unexpected error")
                .register(meterRegistry);

        expiredDepositCounter = Counter.builder("reconciliation.deposits.expired")
                .description("Deposits failed by the timeout sweep")
                .register(meterRegistry);

        stuckWithdrawalCounter = Counter.builder("reconciliation.withdrawals.stuck")
                .description("Withdrawals found past their deadline")
                .register(meterRegistry);

        pollTimer = Timer.builder("reconciliation.poll.duration")
                .description("Time taken to complete a status poll run")
                .register(meterRegistry);

        timeoutTimer = Timer.builder("reconciliation.timeout.duration")
                .description("Time taken to complete a timeout sweep")
                .register(meterRegistry);
    }

    /**
     * Queries the gateway for every PENDING transaction inside its polling window that was not
     * checked within the poll cadence.
     *
     * @throws ReconciliationException if a poll is already running
     */
    public ReconciliationResult reconcilePendingTransactions() {
        if (!pollRunning.compareAndSet(false, true)) {
            log.warn("Status poll already in progress, skipping this run");
            throw new ReconciliationException("Status poll already in progress");
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .run("status-poll")
                .startedAt(LocalDateTime.now())
                .build();

        log.info("Starting status poll of pending transactions");

        try {
            return pollTimer.record(() -> {
                pollAll(result);
                result.setCompletedAt(LocalDateTime.now());

                log.info("Status poll completed. Processed: {}, SUCCESS: {}, FAILED: {}, other: {}, " +
                                "still pending: {}, errors: {}",
                        result.getTotalProcessed(),
                        result.getUpdatedToSuccess(),
                        result.getUpdatedToFailed(),
                        result.getUpdatedToOther(),
                        result.getStillPending(),
                        result.getErrors());

                return result;
            });
        } finally {
            pollRunning.set(false);
        }
    }

    private void pollAll(ReconciliationResult result) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime checkedBefore = now.minusSeconds(pollCadenceSeconds);
        long afterId = 0L;
        int pages = 0;
        List<PaymentTransaction> page;

        do {
            page = transactionRepository.findDueForStatusCheck(
                    TransactionStatus.PENDING, now, checkedBefore, afterId, PageRequest.of(0, batchSize));

            log.debug("Polling page {} with {} transactions", pages, page.size());

            for (PaymentTransaction transaction : page) {
                pollTransaction(transaction, result);
            }
            if (!page.isEmpty()) {
                afterId = lastId(page);
            }

            pages++;
            if (pages >= maxPages) {
                log.warn("Reached maximum page limit ({}), stopping status poll", maxPages);
                break;
            }
        } while (page.size() == batchSize);
    }

    private void pollTransaction(PaymentTransaction transaction, ReconciliationResult result) {
        result.incrementTotalProcessed();
        polledCounter.increment();

        try {
            TransactionStatus status = controller.checkStatus(transaction.getId());
            switch (status) {
                case SUCCESS:
                    result.incrementUpdatedToSuccess();
                    break;
                case FAILED:
                    result.incrementUpdatedToFailed();
                    break;
                case PENDING:
                    result.incrementStillPending();
                    break;
                default:
                    result.incrementUpdatedToOther();
                    break;
            }
        } catch (GatewayApiException e) {
            log.warn("Gateway error polling transaction {}: {}", transaction.getId(), e.getMessage());
            gatewayErrorCounter.increment();
            result.addError(transaction.getId(), transaction.getIdInPaymentSystem(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error polling transaction {}: {}", transaction.getId(), e.getMessage(), e);
            failureCounter.increment();
            result.addError(transaction.getId(), transaction.getIdInPaymentSystem(), "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Fails deposits whose polling window elapsed and flags withdrawals in the same situation.
     * Withdrawals stay PENDING: the payout may still have gone out.
     *
     * @throws ReconciliationException if a sweep is already running
     */
    public ReconciliationResult failExpiredTransactions() {
        if (!timeoutRunning.compareAndSet(false, true)) {
            log.warn("Timeout sweep already in progress, skipping this run");
            throw new ReconciliationException("Timeout sweep already in progress");
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .run("timeout-sweep")
                .startedAt(LocalDateTime.now())
                .build();

        try {
            return timeoutTimer.record(() -> {
                LocalDateTime now = LocalDateTime.now();
                expireDeposits(now, result);
                flagStuckWithdrawals(now, result);
                result.setCompletedAt(LocalDateTime.now());

                log.info("Timeout sweep completed. Deposits failed: {}, withdrawals needing review: {}, errors: {}",
                        result.getUpdatedToFailed(), result.getRequiresManualReview(), result.getErrors());
                return result;
            });
        } finally {
            timeoutRunning.set(false);
        }
    }

    private void expireDeposits(LocalDateTime now, ReconciliationResult result) {
        LocalDateTime createdBefore = now.minusSeconds(controller.ttlSeconds(TransactionType.DEPOSIT));
        long afterId = 0L;
        int pages = 0;
        List<PaymentTransaction> page;
        do {
            page = transactionRepository.findExpired(TransactionStatus.PENDING, TransactionType.DEPOSIT,
                    now, createdBefore, afterId, PageRequest.of(0, batchSize));
            for (PaymentTransaction deposit : page) {
                result.incrementTotalProcessed();
                try {
                    if (controller.failTransaction(deposit.getId(), DeclineCodes.DEPOSIT_NOT_PROCESSED_IN_TIME, null)) {
                        log.info("Deposit {} not processed in time, failed", deposit.getId());
                        expiredDepositCounter.increment();
                        result.incrementUpdatedToFailed();
                    }
                } catch (Exception e) {
                    log.error("Failed to expire deposit {}: {}", deposit.getId(), e.getMessage(), e);
                    result.addError(deposit.getId(), deposit.getIdInPaymentSystem(), e.getMessage());
                }
            }
            if (!page.isEmpty()) {
                afterId = lastId(page);
            }
            pages++;
        } while (page.size() == batchSize && pages < maxPages);
    }

    private void flagStuckWithdrawals(LocalDateTime now, ReconciliationResult result) {
        LocalDateTime createdBefore = now.minusSeconds(controller.ttlSeconds(TransactionType.WITHDRAWAL));
        long afterId = 0L;
        int pages = 0;
        List<PaymentTransaction> page;
        do {
            page = transactionRepository.findExpired(TransactionStatus.PENDING, TransactionType.WITHDRAWAL,
                    now, createdBefore, afterId, PageRequest.of(0, batchSize));
            for (PaymentTransaction withdrawal : page) {
                result.incrementTotalProcessed();
                result.incrementRequiresManualReview();
                log.warn("Withdrawal {} is still PENDING after its deadline {}, needs manual review",
                        withdrawal.getId(), withdrawal.getCheckStatusUntil());
                if (!eventLogRepository.existsByTransactionIdAndEventType(
                        withdrawal.getId(), TransactionEventType.WITHDRAWAL_STUCK_IN_PROCESSING)) {
                    eventLogService.record(withdrawal.getId(), TransactionEventType.WITHDRAWAL_STUCK_IN_PROCESSING,
                            "Withdrawal not resolved before " + withdrawal.getCheckStatusUntil());
                    stuckWithdrawalCounter.increment();
                }
            }
            if (!page.isEmpty()) {
                afterId = lastId(page);
            }
            pages++;
        } while (page.size() == batchSize && pages < maxPages);
    }

    private static long lastId(List<PaymentTransaction> page) {
        return page.get(page.size() - 1).getId();
    }

    /**
     * Transaction counts per status, for dashboards.
     */
    public ReconciliationStats getStats() {
        return ReconciliationStats.builder()
                .pendingCount(transactionRepository.countByStatus(TransactionStatus.PENDING))
                .successCount(transactionRepository.countByStatus(TransactionStatus.SUCCESS))
                .failedCount(transactionRepository.countByStatus(TransactionStatus.FAILED))
                .refundedCount(transactionRepository.countByStatus(TransactionStatus.REFUNDED))
                .chargedBackCount(transactionRepository.countByStatus(TransactionStatus.CHARGED_BACK))
                .isPollRunning(pollRunning.get())
                .isTimeoutSweepRunning(timeoutRunning.get())
                .build();
    }

    @lombok.Data
    @lombok.Builder
    public static class ReconciliationStats {
        private long pendingCount;
        private long successCount;
        private long failedCount;
        private long refundedCount;
        private long chargedBackCount;
        private boolean isPollRunning;
        private boolean isTimeoutSweepRunning;
    }
}
