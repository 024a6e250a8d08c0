package com.fintech.paymentengine.entity;

public enum TransactionEventType {
    ERROR,
    GATEWAY_DECLINE,
    RISK_DECLINE,
    STATUS_CHANGED,
    CALLBACK_RECEIVED,
    WITHDRAWAL_STUCK_IN_PROCESSING
}
