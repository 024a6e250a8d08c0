package com.fintech.paymentengine.exception;

/**
 * Raised when a reconciliation or timeout sweep cannot start, e.g. because one is already
 * running in this instance.
 */
public class ReconciliationException extends PaymentEngineException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
