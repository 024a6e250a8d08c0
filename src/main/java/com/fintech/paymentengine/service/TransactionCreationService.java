package com.fintech.paymentengine.service;

import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.dto.BalanceUpdateRequest;
import com.fintech.paymentengine.dto.CreateTransactionRequest;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import com.fintech.paymentengine.exception.InsufficientFundsException;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import com.fintech.paymentengine.gateway.GatewayClientRegistry;
import com.fintech.paymentengine.repository.CurrencyWalletRepository;
import com.fintech.paymentengine.repository.PaymentTransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates deposits and withdrawals and hands them to the {@link PaymentSystemController}.
 */
@Service
@Slf4j
public class TransactionCreationService {

    private final PaymentTransactionRepository transactionRepository;
    private final CurrencyWalletRepository walletRepository;
    private final BalanceUpdateService balanceUpdateService;
    private final GatewayClientRegistry gatewayRegistry;
    private final PaymentSystemController controller;
    private final TransactionTemplate transactionTemplate;

    public TransactionCreationService(PaymentTransactionRepository transactionRepository,
                                      CurrencyWalletRepository walletRepository,
                                      BalanceUpdateService balanceUpdateService,
                                      GatewayClientRegistry gatewayRegistry,
                                      PaymentSystemController controller,
                                      TransactionTemplate transactionTemplate) {
        this.transactionRepository = transactionRepository;
        this.walletRepository = walletRepository;
        this.balanceUpdateService = balanceUpdateService;
        this.gatewayRegistry = gatewayRegistry;
        this.controller = controller;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Inserts a PENDING deposit and sends it to the gateway.
     *
     * @return the transaction as it stands after the gateway answered
     */
    public PaymentTransaction createDeposit(CreateTransactionRequest request) {
        Money amount = validate(request);
        PaymentTransaction created = transactionTemplate.execute(status -> {
            CurrencyWallet wallet = walletRepository.findById(request.getWalletId())
                    .orElseThrow(() -> new ResourceNotFoundException("Wallet", request.getWalletId()));
            requireWalletCurrency(wallet, amount);
            return transactionRepository.save(newTransaction(request, wallet, TransactionType.DEPOSIT, amount));
        });

        log.info("Created deposit {} of {} on wallet {} via {}",
                created.getId(), amount, request.getWalletId(), request.getSystemType());
        controller.runDeposit(created.getId());
        return reload(created.getId());
    }

    /**
     * Freezes the amount on the wallet, inserts a PENDING withdrawal and sends it to the
     * gateway. The balance check and the freeze happen under the wallet lock.
     *
     * @throws InsufficientFundsException if the wallet's available balance is below the amount
     */
    public PaymentTransaction createWithdrawal(CreateTransactionRequest request) {
        Money amount = validate(request);
        PaymentTransaction created = transactionTemplate.execute(status -> {
            CurrencyWallet wallet = balanceUpdateService.lockWallet(request.getWalletId());
            requireWalletCurrency(wallet, amount);

            Money available = wallet.getAvailable();
            if (available.compareTo(amount) < 0) {
                throw new InsufficientFundsException(wallet.getId(), available, amount);
            }

            PaymentTransaction transaction = transactionRepository.save(
                    newTransaction(request, wallet, TransactionType.WITHDRAWAL, amount));
            balanceUpdateService.applyLocked(wallet, BalanceUpdateRequest.builder()
                    .walletId(wallet.getId())
                    .type(BalanceTransactionType.SETTLEMENT_REQUEST)
                    .amount(amount)
                    .paymentTransaction(transaction)
                    .description("Withdrawal requested")
                    .build());
            return transaction;
        });

        log.info("Created withdrawal {} of {} on wallet {} via {}",
                created.getId(), amount, request.getWalletId(), request.getSystemType());
        controller.runWithdraw(created.getId());
        return reload(created.getId());
    }

    private Money validate(CreateTransactionRequest request) {
        if (!gatewayRegistry.supports(request.getSystemType())) {
            throw new IllegalArgumentException("Unknown payment system: " + request.getSystemType());
        }
        Money amount = Money.of(request.getAmount(), request.getCurrency());
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
        return amount;
    }

    private static void requireWalletCurrency(CurrencyWallet wallet, Money amount) {
        if (!wallet.getCurrency().equals(amount.getCurrency())) {
            throw new IllegalArgumentException(String.format(
                    "Wallet %d holds %s, transaction is in %s", wallet.getId(), wallet.getCurrency(), amount.getCurrency()));
        }
    }

    private static PaymentTransaction newTransaction(CreateTransactionRequest request, CurrencyWallet wallet,
                                                     TransactionType type, Money amount) {
        return PaymentTransaction.builder()
                .wallet(wallet)
                .systemType(request.getSystemType())
                .type(type)
                .status(TransactionStatus.PENDING)
                .amount(amount.getAmount())
                .currency(amount.getCurrency())
                .customerId(request.getCustomerId())
                .customerInstrumentId(request.getCustomerInstrumentId())
                .callbackUrl(request.getCallbackUrl())
                .redirectUrl(request.getRedirectUrl())
                .build();
    }

    private PaymentTransaction reload(Long transactionId) {
        return transactionRepository.findWithWalletById(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
    }
}
