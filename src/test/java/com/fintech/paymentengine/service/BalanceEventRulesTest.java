package com.fintech.paymentengine.service;

import com.fintech.paymentengine.domain.BalanceSnapshot;
import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.exception.InvariantViolationException;
import com.fintech.paymentengine.service.BalanceEventRules.BalanceChange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BalanceEventRulesTest {

    private static final String USD = "USD";

    private static BalanceSnapshot balances(String operational, String frozen, String pending) {
        return new BalanceSnapshot(Money.of(operational, USD), Money.of(frozen, USD), Money.of(pending, USD));
    }

    private static Money usd(String amount) {
        return Money.of(amount, USD);
    }

    @Nested
    @DisplayName("Deposit events")
    class DepositEvents {

        @Test
        @DisplayName("OPERATION_CONFIRMED credits operational and pending")
        void operationConfirmed() {
            BalanceChange change = BalanceEventRules.apply(balances("100.00", "0.00", "0.00"),
                    BalanceTransactionType.OPERATION_CONFIRMED, usd("30.01"));

            assertThat(change.getAfter()).isEqualTo(balances("130.01", "0.00", "30.01"));
            assertThat(change.getSignedAmount()).isEqualTo(usd("30.01"));
        }

        @Test
        @DisplayName("SETTLEMENT_FROM_PROVIDER clears pending and leaves operational")
        void settlementFromProvider() {
            BalanceChange change = BalanceEventRules.apply(balances("130.01", "0.00", "30.01"),
                    BalanceTransactionType.SETTLEMENT_FROM_PROVIDER, usd("30.01"));

            assertThat(change.getAfter()).isEqualTo(balances("130.01", "0.00", "0.00"));
            assertThat(change.getAfter().getAvailable()).isEqualTo(usd("130.01"));
        }
    }

    @Nested
    @DisplayName("Withdrawal events")
    class WithdrawalEvents {

        @Test
        @DisplayName("SETTLEMENT_REQUEST freezes the amount")
        void settlementRequest() {
            BalanceChange change = BalanceEventRules.apply(balances("1000.00", "0.00", "0.00"),
                    BalanceTransactionType.SETTLEMENT_REQUEST, usd("100.00"));

            assertThat(change.getAfter()).isEqualTo(balances("1000.00", "100.00", "0.00"));
            assertThat(change.getAfter().getAvailable()).isEqualTo(usd("900.00"));
        }

        @Test
        @DisplayName("SETTLEMENT_CONFIRMED debits operational and frozen with a negative signed amount")
        void settlementConfirmed() {
            BalanceChange change = BalanceEventRules.apply(balances("1000.00", "100.00", "0.00"),
                    BalanceTransactionType.SETTLEMENT_CONFIRMED, usd("100.00"));

            assertThat(change.getAfter()).isEqualTo(balances("900.00", "0.00", "0.00"));
            assertThat(change.getSignedAmount()).isEqualTo(usd("-100.00"));
        }

        @Test
        @DisplayName("SETTLEMENT_CANCEL releases the frozen amount")
        void settlementCancel() {
            BalanceChange change = BalanceEventRules.apply(balances("1000.00", "100.00", "0.00"),
                    BalanceTransactionType.SETTLEMENT_CANCEL, usd("100.00"));

            assertThat(change.getAfter()).isEqualTo(balances("1000.00", "0.00", "0.00"));
        }
    }

    @Nested
    @DisplayName("Other events")
    class OtherEvents {

        @Test
        @DisplayName("FEE and CHARGE_BACK debit operational only")
        void debits() {
            BalanceSnapshot before = balances("50.00", "10.00", "5.00");

            assertThat(BalanceEventRules.apply(before, BalanceTransactionType.FEE, usd("1.50")).getAfter())
                    .isEqualTo(balances("48.50", "10.00", "5.00"));
            assertThat(BalanceEventRules.apply(before, BalanceTransactionType.CHARGE_BACK, usd("20.00")).getSignedAmount())
                    .isEqualTo(usd("-20.00"));
        }

        @Test
        @DisplayName("MANUAL_ADJUSTMENT and SETTLEMENT_REVERSAL credit operational only")
        void credits() {
            BalanceSnapshot before = balances("50.00", "10.00", "5.00");

            assertThat(BalanceEventRules.apply(before, BalanceTransactionType.MANUAL_ADJUSTMENT, usd("5.00")).getAfter())
                    .isEqualTo(balances("55.00", "10.00", "5.00"));
            assertThat(BalanceEventRules.apply(before, BalanceTransactionType.SETTLEMENT_REVERSAL, usd("5.00")).getAfter())
                    .isEqualTo(balances("55.00", "10.00", "5.00"));
        }

        @ParameterizedTest
        @EnumSource(value = BalanceTransactionType.class, names = {"ROLLING_RESERVE_HOLD", "FROZEN"})
        @DisplayName("Holds move funds into frozen")
        void holds(BalanceTransactionType type) {
            assertThat(BalanceEventRules.apply(balances("50.00", "0.00", "0.00"), type, usd("5.00")).getAfter())
                    .isEqualTo(balances("50.00", "5.00", "0.00"));
        }

        @Test
        @DisplayName("A debit larger than the balance produces a negative result instead of failing")
        void negativeResultIsReturned() {
            BalanceChange change = BalanceEventRules.apply(balances("10.00", "0.00", "0.00"),
                    BalanceTransactionType.FEE, usd("15.00"));

            assertThat(change.getAfter().hasNegativeBalance()).isTrue();
        }
    }

    @Nested
    @DisplayName("Rejected input")
    class RejectedInput {

        @Test
        @DisplayName("INITIAL_MIGRATION has no balance rule")
        void initialMigrationIsRejected() {
            assertThatThrownBy(() -> BalanceEventRules.apply(balances("0.00", "0.00", "0.00"),
                    BalanceTransactionType.INITIAL_MIGRATION, usd("1.00")))
                    .isInstanceOf(InvariantViolationException.class);
        }

        @Test
        @DisplayName("Zero and negative amounts are rejected")
        void nonPositiveAmounts() {
            assertThatThrownBy(() -> BalanceEventRules.apply(balances("0.00", "0.00", "0.00"),
                    BalanceTransactionType.FEE, usd("0.00")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BalanceEventRules.apply(balances("0.00", "0.00", "0.00"),
                    BalanceTransactionType.FEE, usd("-1.00")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Amounts in another currency are rejected")
        void currencyMismatch() {
            assertThatThrownBy(() -> BalanceEventRules.apply(balances("0.00", "0.00", "0.00"),
                    BalanceTransactionType.MANUAL_ADJUSTMENT, Money.of("1.00", "EUR")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
