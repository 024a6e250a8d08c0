package com.fintech.paymentengine.scheduler;

import com.fintech.paymentengine.dto.ReconciliationResult;
import com.fintech.paymentengine.exception.ReconciliationException;
import com.fintech.paymentengine.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic status poll and timeout sweep.
 * <p>
 * fixedDelay keeps a run from starting before the previous one finished.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Value("${payments.reconciliation.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${payments.reconciliation.error-rate-alert:0.1}")
    private double errorRateAlert;

    @Scheduled(fixedDelayString = "${payments.reconciliation.scheduler.poll-interval-ms:60000}",
            initialDelayString = "${payments.reconciliation.scheduler.initial-delay-ms:30000}")
    public void runStatusPoll() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping status poll");
            return;
        }

        try {
            ReconciliationResult result = reconciliationService.reconcilePendingTransactions();
            logResult(result);

            if (result.getTotalProcessed() > 0 && result.getErrors() > result.getTotalProcessed() * errorRateAlert) {
                log.warn("High error rate detected in status poll: {} errors out of {} processed",
                        result.getErrors(), result.getTotalProcessed());
            }
        } catch (ReconciliationException e) {
            log.warn("Status poll skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled status poll failed with unexpected error", e);
        }
    }

    @Scheduled(fixedDelayString = "${payments.reconciliation.scheduler.timeout-interval-ms:300000}",
            initialDelayString = "${payments.reconciliation.scheduler.initial-delay-ms:30000}")
    public void runTimeoutSweep() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping timeout sweep");
            return;
        }

        try {
            ReconciliationResult result = reconciliationService.failExpiredTransactions();
            if (result.getRequiresManualReview() > 0) {
                log.warn("{} withdrawals are past their deadline and need manual review",
                        result.getRequiresManualReview());
            }
        } catch (ReconciliationException e) {
            log.warn("Timeout sweep skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled timeout sweep failed with unexpected error", e);
        }
    }

    private void logResult(ReconciliationResult result) {
        if (result.getTotalProcessed() == 0) {
            log.info("No pending transactions due for a status check");
        } else {
            log.info("Status poll completed in {}ms: {} processed, {} succeeded, {} failed, {} errors",
                    result.getDurationMs(),
                    result.getTotalProcessed(),
                    result.getUpdatedToSuccess(),
                    result.getUpdatedToFailed(),
                    result.getErrors());
        }
    }
}
