package com.fintech.paymentengine.entity;

/**
 * Classification stored on an incoming callback that could not be applied.
 */
public enum CallbackErrorType {
    INVALID_SIGNATURE,
    PARSING_ERROR,
    TRANSACTION_NOT_FOUND,
    INVARIANT_VIOLATION,
    DUPLICATE,
    UNKNOWN_ERROR
}
