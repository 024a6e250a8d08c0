package com.fintech.paymentengine.exception;

/**
 * A correctness rule was broken: a status regression, conflicting decline data on a repeated
 * delivery, a remote amount that does not match, an unknown ledger event type.
 * <p>
 * Never caught and converted into a business outcome. The surrounding database transaction
 * rolls back and the case needs manual investigation.
 */
public class InvariantViolationException extends PaymentEngineException {

    private final Long transactionId;

    public InvariantViolationException(String message) {
        this(message, null);
    }

    public InvariantViolationException(String message, Long transactionId) {
        super(message);
        this.transactionId = transactionId;
    }

    public Long getTransactionId() {
        return transactionId;
    }
}
