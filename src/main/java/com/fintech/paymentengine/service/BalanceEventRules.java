package com.fintech.paymentengine.service;

import com.fintech.paymentengine.domain.BalanceSnapshot;
import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.exception.InvariantViolationException;
import lombok.Value;

/**
 * Fixed table of balance deltas per ledger event type.
 * <p>
 * Pure functions only; locking and persistence live in {@link BalanceUpdateService}.
 */
public final class BalanceEventRules {

    private BalanceEventRules() {
    }

    /**
     * Result of applying one event: the new balances and the signed amount recorded in the
     * audit row (negative for debits).
     */
    @Value
    public static class BalanceChange {
        BalanceSnapshot before;
        BalanceSnapshot after;
        Money signedAmount;
    }

    public static BalanceChange apply(BalanceSnapshot before, BalanceTransactionType type, Money amount) {
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Ledger amount must be positive, got " + amount);
        }
        if (!amount.getCurrency().equals(before.getCurrency())) {
            throw new IllegalArgumentException(
                    "Currency mismatch: wallet holds " + before.getCurrency() + ", event is in " + amount.getCurrency());
        }

        Money operational = before.getOperational();
        Money frozen = before.getFrozen();
        Money pending = before.getPending();
        Money signed = amount;

        switch (type) {
            case OPERATION_CONFIRMED:
                operational = operational.add(amount);
                pending = pending.add(amount);
                break;
            case SETTLEMENT_FROM_PROVIDER:
                pending = pending.subtract(amount);
                break;
            case SETTLEMENT_REQUEST:
            case ROLLING_RESERVE_HOLD:
            case FROZEN:
                frozen = frozen.add(amount);
                break;
            case SETTLEMENT_CANCEL:
            case ROLLING_RESERVE_RELEASE:
            case UNFROZEN:
                frozen = frozen.subtract(amount);
                break;
            case SETTLEMENT_CONFIRMED:
                operational = operational.subtract(amount);
                frozen = frozen.subtract(amount);
                signed = amount.negate();
                break;
            case FEE:
            case CHARGE_BACK:
                operational = operational.subtract(amount);
                signed = amount.negate();
                break;
            case MANUAL_ADJUSTMENT:
            case SETTLEMENT_REVERSAL:
                operational = operational.add(amount);
                break;
            default:
                throw new InvariantViolationException("No balance rule for ledger event type " + type);
        }

        return new BalanceChange(before, new BalanceSnapshot(operational, frozen, pending), signed);
    }
}
