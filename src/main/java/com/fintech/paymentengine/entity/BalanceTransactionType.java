package com.fintech.paymentengine.entity;

/**
 * Business reason of a ledger event. Each reason maps to a fixed set of balance deltas,
 * see {@code BalanceEventRules}.
 */
public enum BalanceTransactionType {
    OPERATION_CONFIRMED,
    SETTLEMENT_FROM_PROVIDER,
    SETTLEMENT_REQUEST,
    SETTLEMENT_CANCEL,
    SETTLEMENT_CONFIRMED,
    SETTLEMENT_REVERSAL,
    ROLLING_RESERVE_HOLD,
    ROLLING_RESERVE_RELEASE,
    FROZEN,
    UNFROZEN,
    FEE,
    CHARGE_BACK,
    MANUAL_ADJUSTMENT,
    /**
     * Opening balances imported from a legacy system. Never applied through the ledger.
     */
    INITIAL_MIGRATION
}
