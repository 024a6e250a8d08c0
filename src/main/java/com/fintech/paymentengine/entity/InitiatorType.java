package com.fintech.paymentengine.entity;

/**
 * Who caused a ledger event.
 */
public enum InitiatorType {
    /**
     * Automatic processing: callbacks, polling, sweeps
     */
    SYSTEM,

    /**
     * A back-office operator
     */
    USER,

    /**
     * Another internal service acting through the API
     */
    SERVICE
}
