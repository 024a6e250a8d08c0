package com.fintech.paymentengine.domain;

import lombok.Value;

/**
 * The three balances of a wallet at one point in time.
 */
@Value
public class BalanceSnapshot {

    Money operational;
    Money frozen;
    Money pending;

    public static BalanceSnapshot zero(String currency) {
        Money zero = Money.zero(currency);
        return new BalanceSnapshot(zero, zero, zero);
    }

    public String getCurrency() {
        return operational.getCurrency();
    }

    public Money getAvailable() {
        return operational.subtract(frozen).subtract(pending);
    }

    public boolean hasNegativeBalance() {
        return operational.isNegative() || frozen.isNegative() || pending.isNegative();
    }

    @Override
    public String toString() {
        return "operational=" + operational.getAmount().toPlainString()
                + ", frozen=" + frozen.getAmount().toPlainString()
                + ", pending=" + pending.getAmount().toPlainString();
    }
}
