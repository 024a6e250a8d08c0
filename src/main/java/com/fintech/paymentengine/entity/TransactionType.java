package com.fintech.paymentengine.entity;

public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL
}
