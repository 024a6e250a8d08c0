package com.fintech.paymentengine.service;

import com.fintech.paymentengine.IntegrationTestBase;
import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.dto.BalanceReplayResult;
import com.fintech.paymentengine.dto.BalanceUpdateRequest;
import com.fintech.paymentengine.entity.BalanceTransaction;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.entity.InitiatorType;
import com.fintech.paymentengine.exception.InvariantViolationException;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class BalanceUpdateServiceTest extends IntegrationTestBase {

    @Autowired
    private BalanceUpdateService balanceUpdateService;

    @Autowired
    private BalanceAuditService balanceAuditService;

    @Autowired
    private MeterRegistry meterRegistry;

    private BalanceTransaction apply(CurrencyWallet wallet, BalanceTransactionType type, String amount) {
        return balanceUpdateService.updateBalance(BalanceUpdateRequest.builder()
                .walletId(wallet.getId())
                .type(type)
                .amount(Money.of(amount, wallet.getCurrency()))
                .description("test " + type)
                .build());
    }

    @Nested
    @DisplayName("Applying events")
    class ApplyingEvents {

        @Test
        @DisplayName("Should write balances and an audit row with before and after values")
        void shouldWriteAuditRow() {
            CurrencyWallet wallet = createFundedWallet("USD", "1000.00");

            BalanceTransaction entry = apply(wallet, BalanceTransactionType.SETTLEMENT_REQUEST, "100.00");

            CurrencyWallet updated = reloadWallet(wallet.getId());
            assertThat(updated.getOperational()).isEqualTo(Money.of("1000.00", "USD"));
            assertThat(updated.getFrozen()).isEqualTo(Money.of("100.00", "USD"));
            assertThat(updated.getAvailable()).isEqualTo(Money.of("900.00", "USD"));

            assertThat(entry.getType()).isEqualTo(BalanceTransactionType.SETTLEMENT_REQUEST);
            assertThat(entry.getAmount()).isEqualByComparingTo("100.00");
            assertThat(entry.getFrozenBefore()).isEqualByComparingTo("0.00");
            assertThat(entry.getFrozenAfter()).isEqualByComparingTo("100.00");
            assertThat(entry.getOperationalBefore()).isEqualByComparingTo("1000.00");
            assertThat(entry.getOperationalAfter()).isEqualByComparingTo("1000.00");
            assertThat(entry.getInitiator()).isEqualTo(InitiatorType.SYSTEM);
        }

        @Test
        @DisplayName("Should record debits with a negative signed amount")
        void shouldRecordDebitsNegative() {
            CurrencyWallet wallet = createFundedWallet("EUR", "50.00");

            BalanceTransaction entry = apply(wallet, BalanceTransactionType.FEE, "2.50");

            assertThat(entry.getAmount()).isEqualByComparingTo("-2.50");
            assertThat(reloadWallet(wallet.getId()).getOperational()).isEqualTo(Money.of("47.50", "EUR"));
        }

        @Test
        @DisplayName("Should reject event types without a balance rule and change nothing")
        void shouldRejectUnknownEventType() {
            CurrencyWallet wallet = createFundedWallet("USD", "10.00");
            int entriesBefore = balanceTransactionRepository.findByWalletIdOrderByIdAsc(wallet.getId()).size();

            assertThatThrownBy(() -> apply(wallet, BalanceTransactionType.INITIAL_MIGRATION, "1.00"))
                    .isInstanceOf(InvariantViolationException.class);

            assertThat(balanceTransactionRepository.findByWalletIdOrderByIdAsc(wallet.getId())).hasSize(entriesBefore);
            assertThat(reloadWallet(wallet.getId()).getOperational()).isEqualTo(Money.of("10.00", "USD"));
        }

        @Test
        @DisplayName("Should reject amounts in a currency other than the wallet's")
        void shouldRejectForeignCurrency() {
            CurrencyWallet wallet = createFundedWallet("USD", "10.00");

            assertThatThrownBy(() -> balanceUpdateService.updateBalance(BalanceUpdateRequest.builder()
                    .walletId(wallet.getId())
                    .type(BalanceTransactionType.FEE)
                    .amount(Money.of("1.00", "EUR"))
                    .build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Negative balances")
    class NegativeBalances {

        @Test
        @DisplayName("Should log a critical error and count it, but still write the event")
        void shouldAlarmButProceed(CapturedOutput output) {
            CurrencyWallet wallet = createFundedWallet("USD", "10.00");
            double before = meterRegistry.get("ledger.balance.negative").counter().count();

            apply(wallet, BalanceTransactionType.FEE, "15.00");

            assertThat(reloadWallet(wallet.getId()).getOperational()).isEqualTo(Money.of("-5.00", "USD"));
            assertThat(output.getOut()).contains("Negative balance on wallet " + wallet.getId());
            assertThat(meterRegistry.get("ledger.balance.negative").counter().count()).isEqualTo(before + 1);
        }
    }

    @Nested
    @DisplayName("Audit replay")
    class AuditReplay {

        @Test
        @DisplayName("Replaying the audit trail from zero reproduces the wallet")
        void replayReproducesWallet() {
            CurrencyWallet wallet = createFundedWallet("MXN", "500.00");
            apply(wallet, BalanceTransactionType.OPERATION_CONFIRMED, "30.01");
            apply(wallet, BalanceTransactionType.SETTLEMENT_FROM_PROVIDER, "30.01");
            apply(wallet, BalanceTransactionType.SETTLEMENT_REQUEST, "100.00");
            apply(wallet, BalanceTransactionType.SETTLEMENT_CONFIRMED, "100.00");
            apply(wallet, BalanceTransactionType.FROZEN, "20.00");
            apply(wallet, BalanceTransactionType.UNFROZEN, "5.00");
            apply(wallet, BalanceTransactionType.FEE, "0.99");

            BalanceReplayResult result = balanceAuditService.replay(wallet.getId());

            assertThat(result.isConsistent()).isTrue();
            assertThat(result.getEntriesReplayed()).isEqualTo(8);
            assertThat(result.getReplayedOperational()).isEqualByComparingTo("429.02");
            assertThat(result.getReplayedFrozen()).isEqualByComparingTo("15.00");
            assertThat(result.getReplayedPending()).isEqualByComparingTo("0.00");
        }

        @Test
        @DisplayName("A wallet changed outside the ledger is reported as inconsistent")
        void detectsOutOfBandChange() {
            CurrencyWallet wallet = createFundedWallet("USD", "100.00");
            jdbcTemplate.update("UPDATE currency_wallets SET operational_balance = ? WHERE id = ?",
                    new BigDecimal("150.00"), wallet.getId());

            BalanceReplayResult result = balanceAuditService.replay(wallet.getId());

            assertThat(result.isConsistent()).isFalse();
            assertThat(result.getReplayedOperational()).isEqualByComparingTo("100.00");
            assertThat(result.getStoredOperational()).isEqualByComparingTo("150.00");
        }

        @Test
        @DisplayName("Audit rows are listed in the order they were written")
        void ledgerIsOrdered() {
            CurrencyWallet wallet = createFundedWallet("USD", "100.00");
            apply(wallet, BalanceTransactionType.FEE, "1.00");

            List<BalanceTransaction> ledger = balanceTransactionRepository.findByWalletIdOrderByIdAsc(wallet.getId());

            assertThat(ledger).extracting(BalanceTransaction::getType)
                    .containsExactly(BalanceTransactionType.MANUAL_ADJUSTMENT, BalanceTransactionType.FEE);
            assertThat(ledger.get(0).getInitiator()).isEqualTo(InitiatorType.USER);
        }
    }
}
