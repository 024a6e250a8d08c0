package com.fintech.paymentengine.exception;

/**
 * Base exception for payment processing errors.
 */
public class PaymentEngineException extends RuntimeException {

    public PaymentEngineException(String message) {
        super(message);
    }

    public PaymentEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
