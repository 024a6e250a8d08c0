package com.fintech.paymentengine.service;

import com.fintech.paymentengine.domain.BalanceSnapshot;
import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.dto.BalanceReplayResult;
import com.fintech.paymentengine.entity.BalanceTransaction;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import com.fintech.paymentengine.repository.BalanceTransactionRepository;
import com.fintech.paymentengine.repository.CurrencyWalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds wallet balances from the ledger audit trail and checks them against the stored
 * wallet row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAuditService {

    private final CurrencyWalletRepository walletRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;

    @Transactional(readOnly = true)
    public BalanceReplayResult replay(Long walletId) {
        CurrencyWallet wallet = walletRepository.findById(walletId)
                .orElseThrow(() -> new ResourceNotFoundException("Wallet", walletId));
        List<BalanceTransaction> entries = balanceTransactionRepository.findByWalletIdOrderByIdAsc(walletId);

        String currency = wallet.getCurrency();
        BalanceSnapshot current = BalanceSnapshot.zero(currency);
        List<Long> inconsistent = new ArrayList<>();

        for (BalanceTransaction entry : entries) {
            BalanceSnapshot recordedBefore = snapshot(currency,
                    entry.getOperationalBefore(), entry.getFrozenBefore(), entry.getPendingBefore());
            BalanceSnapshot recordedAfter = snapshot(currency,
                    entry.getOperationalAfter(), entry.getFrozenAfter(), entry.getPendingAfter());

            BalanceSnapshot replayed = BalanceEventRules.apply(
                    current, entry.getType(), Money.of(entry.getAmount().abs(), currency)).getAfter();

            if (!recordedBefore.equals(current) || !recordedAfter.equals(replayed)) {
                log.warn("Audit entry {} on wallet {} does not chain: expected before [{}], recorded [{}]",
                        entry.getId(), walletId, current, recordedBefore);
                inconsistent.add(entry.getId());
            }
            current = replayed;
        }

        BalanceReplayResult result = BalanceReplayResult.builder()
                .walletId(walletId)
                .currency(currency)
                .entriesReplayed(entries.size())
                .replayedOperational(current.getOperational().getAmount())
                .replayedFrozen(current.getFrozen().getAmount())
                .replayedPending(current.getPending().getAmount())
                .storedOperational(wallet.getOperational().getAmount())
                .storedFrozen(wallet.getFrozen().getAmount())
                .storedPending(wallet.getPending().getAmount())
                .inconsistentEntryIds(inconsistent)
                .build();

        if (!result.isConsistent()) {
            log.error(BalanceUpdateService.CRITICAL, "Wallet {} does not match its audit trail: {}", walletId, result);
        }
        return result;
    }

    private static BalanceSnapshot snapshot(String currency, BigDecimal operational, BigDecimal frozen, BigDecimal pending) {
        return new BalanceSnapshot(
                Money.of(operational, currency),
                Money.of(frozen, currency),
                Money.of(pending, currency));
    }
}
