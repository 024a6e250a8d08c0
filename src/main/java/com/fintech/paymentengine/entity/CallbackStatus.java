package com.fintech.paymentengine.entity;

public enum CallbackStatus {
    PENDING,
    SUCCESS,
    FAILED,
    IGNORED
}
