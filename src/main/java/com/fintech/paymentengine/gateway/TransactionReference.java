package com.fintech.paymentengine.gateway;

import lombok.Value;

import java.util.UUID;

/**
 * How a callback points at its transaction: the provider's id, our uuid, or both.
 */
@Value
public class TransactionReference {

    String idInPaymentSystem;
    UUID uuid;

    public boolean isEmpty() {
        return (idInPaymentSystem == null || idInPaymentSystem.isBlank()) && uuid == null;
    }
}
