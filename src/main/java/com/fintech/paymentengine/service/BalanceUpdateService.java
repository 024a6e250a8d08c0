package com.fintech.paymentengine.service;

import com.fintech.paymentengine.domain.BalanceSnapshot;
import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.dto.BalanceUpdateRequest;
import com.fintech.paymentengine.entity.BalanceTransaction;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import com.fintech.paymentengine.repository.BalanceTransactionRepository;
import com.fintech.paymentengine.repository.CurrencyWalletRepository;
import com.fintech.paymentengine.service.BalanceEventRules.BalanceChange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The balance ledger.
 * <p>
 * Every balance change is one event applied to a wallet row locked with
 * {@code PESSIMISTIC_WRITE}: the new balances and an immutable {@link BalanceTransaction}
 * are written in the same database transaction. A balance going negative is reported with
 * the {@code CRITICAL} marker and the {@code ledger.balance.negative} counter, and the write
 * still goes through so that the audit trail shows exactly what happened.
 */
@Service
@Slf4j
public class BalanceUpdateService {

    static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private final CurrencyWalletRepository walletRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;
    private final MeterRegistry meterRegistry;

    @Value("${payments.ledger.instant-settlement:true}")
    private boolean instantSettlement = true;

    @PersistenceContext
    private EntityManager entityManager;

    private Counter negativeBalanceCounter;

    public BalanceUpdateService(CurrencyWalletRepository walletRepository,
                                BalanceTransactionRepository balanceTransactionRepository,
                                MeterRegistry meterRegistry) {
        this.walletRepository = walletRepository;
        this.balanceTransactionRepository = balanceTransactionRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        negativeBalanceCounter = Counter.builder("ledger.balance.negative")
                .description("Ledger events that left a wallet balance below zero")
                .register(meterRegistry);
    }

    /**
     * Locks the wallet and applies a single event.
     */
    @Transactional
    public BalanceTransaction updateBalance(BalanceUpdateRequest request) {
        CurrencyWallet wallet = lockWallet(request.getWalletId());
        return applyLocked(wallet, request);
    }

    /**
     * Credits a confirmed deposit: OPERATION_CONFIRMED followed by SETTLEMENT_FROM_PROVIDER
     * when settlement is instant. The wallet lock is taken once for both events.
     */
    @Transactional
    public List<BalanceTransaction> confirmDeposit(PaymentTransaction transaction) {
        CurrencyWallet wallet = lockWallet(transaction.getWallet().getId());
        Money amount = transaction.getMoney();

        List<BalanceTransaction> written = new ArrayList<>(2);
        written.add(applyLocked(wallet, BalanceUpdateRequest.builder()
                .walletId(wallet.getId())
                .type(BalanceTransactionType.OPERATION_CONFIRMED)
                .amount(amount)
                .paymentTransaction(transaction)
                .description("Deposit confirmed")
                .build()));

        if (instantSettlement) {
            written.add(applyLocked(wallet, BalanceUpdateRequest.builder()
                    .walletId(wallet.getId())
                    .type(BalanceTransactionType.SETTLEMENT_FROM_PROVIDER)
                    .amount(amount)
                    .paymentTransaction(transaction)
                    .description("Settlement received from provider")
                    .build()));
        }
        return written;
    }

    /**
     * Locks the wallet row and reloads its balances, so a copy read earlier in the same
     * persistence context cannot be used as the starting point.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CurrencyWallet lockWallet(Long walletId) {
        CurrencyWallet wallet = walletRepository.findByIdForUpdate(walletId)
                .orElseThrow(() -> new ResourceNotFoundException("Wallet", walletId));
        entityManager.flush();
        entityManager.refresh(wallet);
        return wallet;
    }

    /**
     * Applies an event to a wallet the caller already holds the lock on.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceTransaction applyLocked(CurrencyWallet wallet, BalanceUpdateRequest request) {
        Objects.requireNonNull(request.getType(), "type");
        Objects.requireNonNull(request.getAmount(), "amount");
        if (request.getWalletId() != null && !request.getWalletId().equals(wallet.getId())) {
            throw new IllegalArgumentException("Request targets wallet " + request.getWalletId()
                    + " but wallet " + wallet.getId() + " is locked");
        }

        BalanceSnapshot before = snapshot(wallet);
        BalanceChange change = BalanceEventRules.apply(before, request.getType(), request.getAmount());
        BalanceSnapshot after = change.getAfter();

        if (after.hasNegativeBalance()) {
            negativeBalanceCounter.increment();
            log.error(CRITICAL, "Negative balance on wallet {} after {} of {} (transaction {}): before [{}], after [{}]",
                    wallet.getId(),
                    request.getType(),
                    request.getAmount(),
                    request.getPaymentTransaction() == null ? null : request.getPaymentTransaction().getId(),
                    before,
                    after);
        }

        wallet.setOperationalBalance(after.getOperational().getAmount());
        wallet.setFrozenBalance(after.getFrozen().getAmount());
        wallet.setPendingBalance(after.getPending().getAmount());
        walletRepository.save(wallet);

        BalanceTransaction entry = balanceTransactionRepository.save(BalanceTransaction.builder()
                .wallet(wallet)
                .type(request.getType())
                .amount(change.getSignedAmount().getAmount())
                .currency(wallet.getCurrency())
                .operationalBefore(before.getOperational().getAmount())
                .operationalAfter(after.getOperational().getAmount())
                .frozenBefore(before.getFrozen().getAmount())
                .frozenAfter(after.getFrozen().getAmount())
                .pendingBefore(before.getPending().getAmount())
                .pendingAfter(after.getPending().getAmount())
                .paymentTransaction(request.getPaymentTransaction())
                .description(request.getDescription())
                .initiator(request.getInitiator())
                .build());

        meterRegistry.counter("ledger.events", "type", request.getType().name()).increment();
        log.info("Applied {} {} to wallet {}: [{}] -> [{}]",
                request.getType(), request.getAmount(), wallet.getId(), before, after);

        return entry;
    }

    public static BalanceSnapshot snapshot(CurrencyWallet wallet) {
        return new BalanceSnapshot(wallet.getOperational(), wallet.getFrozen(), wallet.getPending());
    }
}
