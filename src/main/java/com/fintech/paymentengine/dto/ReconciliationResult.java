package com.fintech.paymentengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one status-poll or timeout sweep run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private String run;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int totalProcessed = 0;

    @Builder.Default
    private int updatedToSuccess = 0;

    @Builder.Default
    private int updatedToFailed = 0;

    /**
     * REFUNDED or CHARGED_BACK.
     */
    @Builder.Default
    private int updatedToOther = 0;

    @Builder.Default
    private int stillPending = 0;

    /**
     * Withdrawals past their deadline, left PENDING for an operator.
     */
    @Builder.Default
    private int requiresManualReview = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<ReconciliationError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReconciliationError {
        private Long transactionId;
        private String idInPaymentSystem;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementTotalProcessed() {
        this.totalProcessed++;
    }

    public void incrementUpdatedToSuccess() {
        this.updatedToSuccess++;
    }

    public void incrementUpdatedToFailed() {
        this.updatedToFailed++;
    }

    public void incrementUpdatedToOther() {
        this.updatedToOther++;
    }

    public void incrementStillPending() {
        this.stillPending++;
    }

    public void incrementRequiresManualReview() {
        this.requiresManualReview++;
    }

    public void addError(Long transactionId, String idInPaymentSystem, String errorMessage) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(ReconciliationError.builder()
                .transactionId(transactionId)
                .idInPaymentSystem(idInPaymentSystem)
                .errorMessage(errorMessage)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
