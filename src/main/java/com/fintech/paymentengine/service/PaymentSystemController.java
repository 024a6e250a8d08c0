package com.fintech.paymentengine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.paymentengine.dto.BalanceUpdateRequest;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionEventType;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import com.fintech.paymentengine.event.TransactionFinalizedEvent;
import com.fintech.paymentengine.exception.InvariantViolationException;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import com.fintech.paymentengine.gateway.Decline;
import com.fintech.paymentengine.gateway.DeclineCodes;
import com.fintech.paymentengine.gateway.GatewayClient;
import com.fintech.paymentengine.gateway.GatewayClientRegistry;
import com.fintech.paymentengine.gateway.GatewayResponse;
import com.fintech.paymentengine.gateway.RemoteTransactionStatus;
import com.fintech.paymentengine.observability.CorrelationContext;
import com.fintech.paymentengine.repository.PaymentTransactionRepository;
import com.fintech.paymentengine.risk.RiskCheck;
import com.fintech.paymentengine.risk.RiskDecision;
import com.fintech.paymentengine.scheduler.BackgroundTask;
import com.fintech.paymentengine.scheduler.BackgroundTaskScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Drives payment transactions through their lifecycle against the gateway they belong to.
 * <p>
 * Gateway calls are made without holding any lock. Their results are applied in a short
 * database transaction that starts by locking the transaction row, so concurrent callbacks,
 * polls and retries are serialised per transaction. {@link #syncRemoteStatus} is the only
 * place where a transaction reaches a terminal status, and the only place that calls the
 * ledger for it; it acts only on a PENDING row, which makes every terminal outcome hit the
 * ledger at most once.
 */
@Service
@Slf4j
public class PaymentSystemController {

    private final PaymentTransactionRepository transactionRepository;
    private final BalanceUpdateService balanceUpdateService;
    private final RollingReserveService rollingReserveService;
    private final GatewayClientRegistry gatewayRegistry;
    private final BackgroundTaskScheduler taskScheduler;
    private final RiskCheck riskCheck;
    private final TransactionEventLogService eventLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Value("${payments.ttl.deposit-seconds:172800}")
    private long depositTtlSeconds = 172800;

    @Value("${payments.ttl.withdrawal-seconds:86400}")
    private long withdrawalTtlSeconds = 86400;

    @Value("${payments.status-check.initial-delay-seconds:30}")
    private long statusCheckDelaySeconds = 30;

    public PaymentSystemController(PaymentTransactionRepository transactionRepository,
                                   BalanceUpdateService balanceUpdateService,
                                   RollingReserveService rollingReserveService,
                                   GatewayClientRegistry gatewayRegistry,
                                   BackgroundTaskScheduler taskScheduler,
                                   RiskCheck riskCheck,
                                   TransactionEventLogService eventLogService,
                                   ApplicationEventPublisher eventPublisher,
                                   TransactionTemplate transactionTemplate,
                                   ObjectMapper objectMapper,
                                   MeterRegistry meterRegistry) {
        this.transactionRepository = transactionRepository;
        this.balanceUpdateService = balanceUpdateService;
        this.rollingReserveService = rollingReserveService;
        this.gatewayRegistry = gatewayRegistry;
        this.taskScheduler = taskScheduler;
        this.riskCheck = riskCheck;
        this.eventLogService = eventLogService;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    // ---------------------------------------------------------------- deposit

    /**
     * Sends a PENDING deposit to its gateway. Any error ends the transaction as FAILED with
     * {@link DeclineCodes#INTERNAL_ERROR}; it is never left without a way to terminate.
     */
    public void runDeposit(Long transactionId) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
        try {
            PaymentTransaction transaction = loadWithWallet(transactionId);
            if (transaction.getStatus() != TransactionStatus.PENDING) {
                log.info("Transaction {} is not in initial status ({}), deposit not sent",
                        transactionId, transaction.getStatus());
                return;
            }
            if (!transaction.isDeposit()) {
                log.info("Transaction {} is not a deposit", transactionId);
                return;
            }

            try {
                RiskDecision decision = riskCheck.evaluate(transaction);
                if (decision.isDeclined()) {
                    transactionTemplate.executeWithoutResult(status -> declineByRisk(transactionId, decision.getDecline()));
                    return;
                }

                GatewayClient client = gatewayRegistry.forTransaction(transaction);
                GatewayResponse response = client.deposit(transaction);
                transactionTemplate.executeWithoutResult(status ->
                        applyInitiationResponse(client, transactionId, response, "deposit"));
            } catch (Exception e) {
                log.error("Error during deposit processing for transaction {}: {}", transactionId, e.getMessage(), e);
                transactionTemplate.executeWithoutResult(status ->
                        failAfterError(transactionId, "Error during deposit processing: " + e.getMessage(), e));
            }
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Second leg of a deposit, e.g. once the payer returns from 3-D-Secure. Errors are handled
     * like in {@link #runDeposit(Long)}.
     */
    public void runDepositFinalization(Long transactionId) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
        try {
            PaymentTransaction transaction = loadWithWallet(transactionId);
            if (transaction.getStatus() != TransactionStatus.PENDING) {
                log.info("Transaction {} is not pending ({}), finalization skipped",
                        transactionId, transaction.getStatus());
                return;
            }
            if (!transaction.isDeposit()) {
                log.info("Transaction {} is not a deposit", transactionId);
                return;
            }

            try {
                GatewayClient client = gatewayRegistry.forTransaction(transaction);
                GatewayResponse response = client.depositFinalize(transaction);
                transactionTemplate.executeWithoutResult(status ->
                        applyInitiationResponse(client, transactionId, response, "deposit finalization"));
            } catch (Exception e) {
                log.error("Error during deposit finalization for transaction {}: {}", transactionId, e.getMessage(), e);
                transactionTemplate.executeWithoutResult(status ->
                        failAfterError(transactionId, "Error during deposit finalization: " + e.getMessage(), e));
            }
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private void applyInitiationResponse(GatewayClient client, Long transactionId, GatewayResponse response, String step) {
        PaymentTransaction transaction = lockTransaction(transactionId);
        if (transaction.getStatus() != TransactionStatus.PENDING) {
            log.info("Transaction {} became {} while the {} was in flight, response ignored",
                    transactionId, transaction.getStatus(), step);
            return;
        }

        switch (response.getStatus()) {
            case FAILED:
                Decline decline = Objects.requireNonNull(response.getDecline(), "FAILED response without decline");
                log.info("Gateway declined {} of transaction {}: {} {}",
                        step, transactionId, decline.getCode(), decline.getReason());
                failLocked(transaction, decline.getCode(), decline.getReason());
                break;
            case SUCCESS:
                storeGatewayState(transaction, client, response);
                syncLocked(transaction, RemoteTransactionStatus.builder()
                        .operationStatus(TransactionStatus.SUCCESS)
                        .idInPaymentSystem(response.getIdInPaymentSystem())
                        .build());
                break;
            case PENDING:
            default:
                storeGatewayState(transaction, client, response);
                startStatusChecks(transaction);
                break;
        }
    }

    private void failAfterError(Long transactionId, String description, Exception error) {
        PaymentTransaction transaction = lockTransaction(transactionId);
        eventLogService.recordError(transactionId, description, error);
        if (transaction.getStatus() == TransactionStatus.PENDING) {
            failLocked(transaction, DeclineCodes.INTERNAL_ERROR, null);
        }
    }

    // ---------------------------------------------------------------- withdraw

    /**
     * Sends a PENDING withdrawal to its gateway.
     * <p>
     * Neither a FAILED answer nor an exception changes the status here: the payout may have
     * been accepted anyway, so only an authoritative status query can end the transaction.
     */
    public void runWithdraw(Long transactionId) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
        try {
            PaymentTransaction transaction = loadWithWallet(transactionId);
            if (transaction.getStatus() != TransactionStatus.PENDING) {
                log.info("Transaction {} is not in initial status ({}), withdrawal not sent",
                        transactionId, transaction.getStatus());
                return;
            }
            if (!transaction.isWithdrawal()) {
                log.info("Transaction {} is not a withdrawal", transactionId);
                return;
            }

            try {
                // nothing has reached the provider yet, a risk decline is final
                RiskDecision decision = riskCheck.evaluate(transaction);
                if (decision.isDeclined()) {
                    transactionTemplate.executeWithoutResult(status -> declineByRisk(transactionId, decision.getDecline()));
                    return;
                }

                GatewayClient client = gatewayRegistry.forTransaction(transaction);
                GatewayResponse response = client.withdraw(transaction);
                transactionTemplate.executeWithoutResult(status -> applyWithdrawResponse(client, transactionId, response));
            } catch (Exception e) {
                log.error("Error during withdrawal processing for transaction {}: {}", transactionId, e.getMessage(), e);
                transactionTemplate.executeWithoutResult(status -> keepPendingAfterError(transactionId, e));
            }
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private void applyWithdrawResponse(GatewayClient client, Long transactionId, GatewayResponse response) {
        PaymentTransaction transaction = lockTransaction(transactionId);
        if (transaction.getStatus() != TransactionStatus.PENDING) {
            log.info("Transaction {} became {} while the withdrawal was in flight, response ignored",
                    transactionId, transaction.getStatus());
            return;
        }

        if (response.isDeclined()) {
            Decline decline = response.getDecline();
            log.warn("Gateway rejected withdrawal {} ({} {}), waiting for status query",
                    transactionId,
                    decline == null ? null : decline.getCode(),
                    decline == null ? null : decline.getReason());
            eventLogService.record(transactionId, TransactionEventType.GATEWAY_DECLINE,
                    "Withdrawal rejected by gateway, status left pending",
                    decline == null ? null : declineExtra(decline));
        }
        storeGatewayState(transaction, client, response);
        startStatusChecks(transaction);
    }

    private void keepPendingAfterError(Long transactionId, Exception error) {
        PaymentTransaction transaction = lockTransaction(transactionId);
        eventLogService.recordError(transactionId, "Error during withdrawal processing: " + error.getMessage(), error);
        if (transaction.getStatus() == TransactionStatus.PENDING && transaction.getCheckStatusUntil() == null) {
            // the poller has to resolve it
            transaction.setCheckStatusUntil(LocalDateTime.now().plusSeconds(ttlSeconds(transaction.getType())));
            transactionRepository.save(transaction);
        }
    }

    // ---------------------------------------------------------------- status

    /**
     * Queries the gateway for the transaction's status and syncs the answer.
     *
     * @return the local status after the check
     */
    public TransactionStatus checkStatus(Long transactionId) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
        try {
            PaymentTransaction transaction = loadWithWallet(transactionId);
            if (transaction.getStatus().isFinal()) {
                log.debug("Transaction {} already {}, status check skipped", transactionId, transaction.getStatus());
                return transaction.getStatus();
            }

            GatewayClient client = gatewayRegistry.forTransaction(transaction);
            RemoteTransactionStatus remote;
            try {
                remote = client.getTransactionStatus(transaction);
            } catch (RuntimeException e) {
                transactionTemplate.executeWithoutResult(status -> {
                    PaymentTransaction locked = lockTransaction(transactionId);
                    locked.recordStatusCheck(e.getMessage());
                    transactionRepository.save(locked);
                });
                throw e;
            }

            return transactionTemplate.execute(status -> {
                PaymentTransaction locked = lockTransaction(transactionId);
                locked.recordStatusCheck(null);
                if (locked.getStatus().isFinal() && !remote.isFinal()) {
                    log.info("Transaction {} was finalised as {} while polling, remote PENDING ignored",
                            transactionId, locked.getStatus());
                    return locked.getStatus();
                }
                try {
                    syncLocked(locked, remote);
                } catch (InvariantViolationException e) {
                    // journalled in its own transaction, this one rolls back
                    eventLogService.recordError(transactionId, "Remote status rejected: " + e.getMessage(), e);
                    throw e;
                }
                transactionRepository.save(locked);
                return locked.getStatus();
            });
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Locks the transaction and applies a remote status to it.
     *
     * @throws InvariantViolationException if the remote status contradicts the local one; the
     *                                     database transaction rolls back and nothing changes
     */
    @Transactional
    public PaymentTransaction syncRemoteStatus(Long transactionId, RemoteTransactionStatus remote) {
        PaymentTransaction transaction = lockTransaction(transactionId);
        syncLocked(transaction, remote);
        return transactionRepository.save(transaction);
    }

    /**
     * Applies a remote status to a transaction the caller has locked.
     * <p>
     * A terminal remote status moves a PENDING transaction to that status and applies its
     * ledger effect. The same terminal status again is a no-op. SUCCESS to CHARGED_BACK is
     * allowed for deposits. Everything else is an invariant violation.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void syncLocked(PaymentTransaction transaction, RemoteTransactionStatus remoteStatus) {
        Objects.requireNonNull(remoteStatus.getOperationStatus(), "remote operation status");
        RemoteTransactionStatus remote = gatewayRegistry.get(transaction.getSystemType())
                .adjustRemoteStatus(transaction, remoteStatus);

        TransactionStatus current = transaction.getStatus();
        TransactionStatus target = remote.getOperationStatus();

        if (target == TransactionStatus.FAILED) {
            requireSameDecline(transaction, remote);
        }

        if (!remote.isFinal()) {
            if (current.isFinal()) {
                throw new InvariantViolationException(String.format(
                        "Transaction %d is %s locally but PENDING at the provider", transaction.getId(), current),
                        transaction.getId());
            }
            storeProviderId(transaction, remote.getIdInPaymentSystem());
            return;
        }

        if (target == current) {
            log.info("Transaction {} already {}, repeated remote status ignored", transaction.getId(), current);
            return;
        }

        if (current == TransactionStatus.PENDING) {
            finalizePending(transaction, remote);
        } else if (current == TransactionStatus.SUCCESS && target == TransactionStatus.CHARGED_BACK) {
            chargeBack(transaction);
        } else {
            throw new InvariantViolationException(String.format(
                    "Transaction %d cannot move from %s to %s", transaction.getId(), current, target),
                    transaction.getId());
        }
    }

    private void finalizePending(PaymentTransaction transaction, RemoteTransactionStatus remote) {
        TransactionStatus target = remote.getOperationStatus();
        storeProviderId(transaction, remote.getIdInPaymentSystem());

        switch (target) {
            case SUCCESS:
                requireSameAmount(transaction, remote);
                if (transaction.isDeposit()) {
                    balanceUpdateService.confirmDeposit(transaction);
                    rollingReserveService.holdForDeposit(transaction);
                } else {
                    applyLedger(transaction, BalanceTransactionType.SETTLEMENT_CONFIRMED, "Withdrawal confirmed by provider");
                }
                finalizeStatus(transaction, TransactionStatus.SUCCESS);
                break;
            case FAILED:
                failLocked(transaction, remote.getDeclineCode(), remote.getDeclineReason());
                break;
            case REFUNDED:
                if (transaction.isWithdrawal()) {
                    applyLedger(transaction, BalanceTransactionType.SETTLEMENT_CANCEL, "Withdrawal refunded by provider");
                }
                finalizeStatus(transaction, TransactionStatus.REFUNDED);
                break;
            case CHARGED_BACK:
                if (transaction.isWithdrawal()) {
                    throw new InvariantViolationException(
                            "Withdrawal " + transaction.getId() + " cannot be charged back", transaction.getId());
                }
                // never credited, nothing to take back
                finalizeStatus(transaction, TransactionStatus.CHARGED_BACK);
                break;
            default:
                throw new InvariantViolationException("Unexpected remote status " + target, transaction.getId());
        }
    }

    private void chargeBack(PaymentTransaction transaction) {
        if (!transaction.isDeposit()) {
            throw new InvariantViolationException(
                    "Withdrawal " + transaction.getId() + " cannot be charged back", transaction.getId());
        }
        applyLedger(transaction, BalanceTransactionType.CHARGE_BACK, "Deposit charged back");
        finalizeStatus(transaction, TransactionStatus.CHARGED_BACK);
    }

    // ---------------------------------------------------------------- fail

    /**
     * Locks the transaction and fails it if it is still PENDING.
     *
     * @return true if this call failed the transaction
     */
    @Transactional
    public boolean failTransaction(Long transactionId, String declineCode, String declineReason) {
        PaymentTransaction transaction = lockTransaction(transactionId);
        if (transaction.getStatus() != TransactionStatus.PENDING) {
            log.info("Transaction {} is {}, not failing it", transactionId, transaction.getStatus());
            return false;
        }
        failLocked(transaction, declineCode, declineReason);
        transactionRepository.save(transaction);
        return true;
    }

    private void failLocked(PaymentTransaction transaction, String declineCode, String declineReason) {
        if (transaction.isWithdrawal()) {
            applyLedger(transaction, BalanceTransactionType.SETTLEMENT_CANCEL, "Withdrawal failed, funds released");
        }
        transaction.setDeclineCode(declineCode);
        transaction.setDeclineReason(declineReason);
        finalizeStatus(transaction, TransactionStatus.FAILED);
    }

    private void declineByRisk(Long transactionId, Decline decline) {
        PaymentTransaction transaction = lockTransaction(transactionId);
        if (transaction.getStatus() != TransactionStatus.PENDING) {
            return;
        }
        log.info("Risk check declined transaction {}: {} {}", transactionId, decline.getCode(), decline.getReason());
        eventLogService.record(transactionId, TransactionEventType.RISK_DECLINE, "Declined by risk check", declineExtra(decline));
        failLocked(transaction, decline.getCode(), decline.getReason());
    }

    // ---------------------------------------------------------------- helpers

    private void finalizeStatus(PaymentTransaction transaction, TransactionStatus target) {
        TransactionStatus previous = transaction.getStatus();
        transaction.setStatus(target);
        transaction.setCheckStatusUntil(null);
        transactionRepository.save(transaction);

        eventLogService.record(transaction.getId(), TransactionEventType.STATUS_CHANGED, previous + " -> " + target);
        meterRegistry.counter("payments.transactions.finalized",
                "type", transaction.getType().name(), "status", target.name()).increment();
        eventPublisher.publishEvent(new TransactionFinalizedEvent(
                transaction.getId(),
                transaction.getUuid(),
                transaction.getType(),
                previous,
                target,
                transaction.getDeclineCode(),
                transaction.getCallbackUrl()));

        log.info("Transaction {} {} -> {}", transaction.getId(), previous, target);
    }

    private void applyLedger(PaymentTransaction transaction, BalanceTransactionType type, String description) {
        balanceUpdateService.updateBalance(BalanceUpdateRequest.builder()
                .walletId(transaction.getWallet().getId())
                .type(type)
                .amount(transaction.getMoney())
                .paymentTransaction(transaction)
                .description(description)
                .build());
    }

    private void startStatusChecks(PaymentTransaction transaction) {
        if (transaction.getCheckStatusUntil() == null) {
            transaction.setCheckStatusUntil(LocalDateTime.now().plusSeconds(ttlSeconds(transaction.getType())));
        }
        transactionRepository.save(transaction);
        taskScheduler.schedule(BackgroundTask.CHECK_STATUS, transaction.getId(),
                Duration.ofSeconds(statusCheckDelaySeconds));
    }

    private void storeGatewayState(PaymentTransaction transaction, GatewayClient client, GatewayResponse response) {
        storeProviderId(transaction, response.getIdInPaymentSystem());
        if (response.getExtra() != null && !response.getExtra().isEmpty()) {
            transaction.putAllExtra(client.getSystemType(), response.getExtra());
        }
        if (response.getRedirectForm() != null) {
            try {
                transaction.setInstruction(objectMapper.writeValueAsString(response.getRedirectForm()));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialise redirect form", e);
            }
        }
    }

    private void storeProviderId(PaymentTransaction transaction, String idInPaymentSystem) {
        if (idInPaymentSystem == null || idInPaymentSystem.isBlank()) {
            return;
        }
        if (transaction.getIdInPaymentSystem() == null) {
            transaction.setIdInPaymentSystem(idInPaymentSystem);
        } else if (!transaction.getIdInPaymentSystem().equals(idInPaymentSystem)) {
            log.warn("Transaction {} has provider id {}, provider now reports {}; keeping the original",
                    transaction.getId(), transaction.getIdInPaymentSystem(), idInPaymentSystem);
        }
    }

    /**
     * A repeat answer that carries no decline details says nothing about the decline, so only
     * values the provider actually reports are compared with the recorded ones.
     */
    private void requireSameDecline(PaymentTransaction transaction, RemoteTransactionStatus remote) {
        if (transaction.getDeclineCode() != null && remote.getDeclineCode() != null
                && !transaction.getDeclineCode().equals(remote.getDeclineCode())) {
            throw new InvariantViolationException(String.format(
                    "Transaction %d was declined with code '%s', provider now reports '%s'",
                    transaction.getId(), transaction.getDeclineCode(), remote.getDeclineCode()), transaction.getId());
        }
        if (transaction.getDeclineReason() != null && remote.getDeclineReason() != null
                && !transaction.getDeclineReason().equals(remote.getDeclineReason())) {
            throw new InvariantViolationException(String.format(
                    "Transaction %d was declined with reason '%s', provider now reports '%s'",
                    transaction.getId(), transaction.getDeclineReason(), remote.getDeclineReason()), transaction.getId());
        }
    }

    private void requireSameAmount(PaymentTransaction transaction, RemoteTransactionStatus remote) {
        if (remote.getRemoteAmount() != null && !remote.getRemoteAmount().equals(transaction.getMoney())) {
            throw new InvariantViolationException(String.format(
                    "Transaction %d is for %s, provider reports %s",
                    transaction.getId(), transaction.getMoney(), remote.getRemoteAmount()), transaction.getId());
        }
    }

    private static Map<String, String> declineExtra(Decline decline) {
        return decline.getReason() == null
                ? Map.of("decline_code", decline.getCode())
                : Map.of("decline_code", decline.getCode(), "decline_reason", decline.getReason());
    }

    public long ttlSeconds(TransactionType type) {
        return type == TransactionType.DEPOSIT ? depositTtlSeconds : withdrawalTtlSeconds;
    }

    private PaymentTransaction loadWithWallet(Long transactionId) {
        return transactionRepository.findWithWalletById(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
    }

    private PaymentTransaction lockTransaction(Long transactionId) {
        return transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
    }
}
