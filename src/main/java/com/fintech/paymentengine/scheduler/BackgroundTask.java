package com.fintech.paymentengine.scheduler;

/**
 * Background jobs that operate on a single payment transaction.
 */
public enum BackgroundTask {
    /**
     * Query the gateway for the transaction's status and sync it
     */
    CHECK_STATUS,

    /**
     * Run the second leg of a deposit
     */
    DEPOSIT_FINALIZATION
}
