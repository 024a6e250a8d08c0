package com.fintech.paymentengine.entity;

/**
 * Lifecycle status of a payment transaction.
 * <p>
 * PENDING is the only non-terminal status. The single transition allowed out of a terminal
 * status is SUCCESS -> CHARGED_BACK.
 */
public enum TransactionStatus {
    /**
     * Accepted locally, outcome at the provider not yet known
     */
    PENDING,

    /**
     * Provider confirmed the money movement
     */
    SUCCESS,

    /**
     * Provider declined, or the transaction timed out locally
     */
    FAILED,

    /**
     * Money returned to the payer before settlement
     */
    REFUNDED,

    /**
     * Payer disputed a successful deposit
     */
    CHARGED_BACK;

    public boolean isFinal() {
        return this != PENDING;
    }
}
