package com.fintech.paymentengine.exception;

import com.fintech.paymentengine.domain.Money;

public class InsufficientFundsException extends PaymentEngineException {

    private final Long walletId;

    public InsufficientFundsException(Long walletId, Money available, Money requested) {
        super(String.format("Wallet %d has %s available, %s requested", walletId, available, requested));
        this.walletId = walletId;
    }

    public Long getWalletId() {
        return walletId;
    }
}
