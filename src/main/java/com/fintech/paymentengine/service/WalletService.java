package com.fintech.paymentengine.service;

import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.dto.BalanceUpdateRequest;
import com.fintech.paymentengine.dto.CreateWalletRequest;
import com.fintech.paymentengine.dto.WalletOperationRequest;
import com.fintech.paymentengine.entity.BalanceTransaction;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.entity.InitiatorType;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import com.fintech.paymentengine.repository.BalanceTransactionRepository;
import com.fintech.paymentengine.repository.CurrencyWalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Wallet administration. Balances start at zero and only change through ledger events.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    static final Set<BalanceTransactionType> MANUAL_OPERATIONS = EnumSet.of(
            BalanceTransactionType.MANUAL_ADJUSTMENT,
            BalanceTransactionType.FEE,
            BalanceTransactionType.FROZEN,
            BalanceTransactionType.UNFROZEN);

    private final CurrencyWalletRepository walletRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;
    private final BalanceUpdateService balanceUpdateService;

    @Transactional
    public CurrencyWallet create(CreateWalletRequest request) {
        // normalises and validates the currency code
        String currency = Money.zero(request.getCurrency()).getCurrency();
        boolean hasPercent = request.getRollingReservePercent() != null && request.getRollingReservePercent().signum() > 0;
        if (hasPercent && request.getRollingReserveDays() == null) {
            throw new IllegalArgumentException("rollingReserveDays is required with rollingReservePercent");
        }

        CurrencyWallet wallet = walletRepository.save(CurrencyWallet.builder()
                .name(request.getName())
                .currency(currency)
                .sandbox(request.isSandbox())
                .rollingReservePercent(request.getRollingReservePercent())
                .rollingReserveDays(request.getRollingReserveDays())
                .build());
        log.info("Created {} wallet {} ({}){}", currency, wallet.getId(), wallet.getName(),
                wallet.isSandbox() ? " in sandbox mode" : "");
        return wallet;
    }

    @Transactional(readOnly = true)
    public CurrencyWallet get(Long walletId) {
        return walletRepository.findById(walletId)
                .orElseThrow(() -> new ResourceNotFoundException("Wallet", walletId));
    }

    /**
     * Applies an operator-initiated ledger event.
     */
    @Transactional
    public BalanceTransaction applyManualOperation(Long walletId, WalletOperationRequest request) {
        if (!MANUAL_OPERATIONS.contains(request.getType())) {
            throw new IllegalArgumentException(request.getType() + " cannot be applied manually, allowed: " + MANUAL_OPERATIONS);
        }
        CurrencyWallet wallet = balanceUpdateService.lockWallet(walletId);
        log.info("Manual {} of {} {} requested on wallet {}",
                request.getType(), request.getAmount(), wallet.getCurrency(), walletId);
        return balanceUpdateService.applyLocked(wallet, BalanceUpdateRequest.builder()
                .walletId(walletId)
                .type(request.getType())
                .amount(Money.of(request.getAmount(), wallet.getCurrency()))
                .initiator(InitiatorType.USER)
                .description(request.getDescription())
                .build());
    }

    @Transactional(readOnly = true)
    public List<BalanceTransaction> getLedger(Long walletId) {
        get(walletId);
        return balanceTransactionRepository.findByWalletIdOrderByIdAsc(walletId);
    }
}
