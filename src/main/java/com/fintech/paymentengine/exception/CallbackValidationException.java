package com.fintech.paymentengine.exception;

import com.fintech.paymentengine.entity.CallbackErrorType;

/**
 * An incoming callback was rejected before any state was touched.
 */
public class CallbackValidationException extends PaymentEngineException {

    private final CallbackErrorType errorType;

    public CallbackValidationException(String message, CallbackErrorType errorType) {
        super(message);
        this.errorType = errorType;
    }

    public CallbackValidationException(String message, CallbackErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public CallbackErrorType getErrorType() {
        return errorType;
    }
}
