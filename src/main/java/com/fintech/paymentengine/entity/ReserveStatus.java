package com.fintech.paymentengine.entity;

public enum ReserveStatus {
    ACTIVE,
    RELEASED
}
