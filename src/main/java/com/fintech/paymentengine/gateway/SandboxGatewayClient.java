package com.fintech.paymentengine.gateway;

import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionStatus;
import lombok.extern.slf4j.Slf4j;

/**
 * Decorator used for sandbox wallets: money operations never reach the provider and
 * complete successfully on the first status query. Callback handling is delegated to the
 * wrapped client so that sandbox webhooks are parsed and verified like real ones.
 */
@Slf4j
public class SandboxGatewayClient implements GatewayClient {

    static final String ID_PREFIX = "sandbox-";

    private final GatewayClient delegate;

    public SandboxGatewayClient(GatewayClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public String getSystemType() {
        return delegate.getSystemType();
    }

    @Override
    public GatewayResponse deposit(PaymentTransaction transaction) {
        log.info("Sandbox deposit for transaction {}", transaction.getId());
        return GatewayResponse.pending(ID_PREFIX + transaction.getUuid());
    }

    @Override
    public GatewayResponse withdraw(PaymentTransaction transaction) {
        log.info("Sandbox withdrawal for transaction {}", transaction.getId());
        return GatewayResponse.pending(ID_PREFIX + transaction.getUuid());
    }

    @Override
    public GatewayResponse depositFinalize(PaymentTransaction transaction) {
        return GatewayResponse.pending(transaction.getIdInPaymentSystem());
    }

    @Override
    public RemoteTransactionStatus getTransactionStatus(PaymentTransaction transaction) {
        return RemoteTransactionStatus.builder()
                .operationStatus(TransactionStatus.SUCCESS)
                .idInPaymentSystem(transaction.getIdInPaymentSystem())
                .transactionUuid(transaction.getUuid())
                .remoteAmount(transaction.getMoney())
                .build();
    }

    @Override
    public boolean isCallbackSignatureValid(CallbackRequest callback) {
        return delegate.isCallbackSignatureValid(callback);
    }

    @Override
    public CallbackParseResult parseCallback(CallbackRequest callback) {
        return delegate.parseCallback(callback);
    }

    @Override
    public String resolveEventType(CallbackRequest callback) {
        return delegate.resolveEventType(callback);
    }

    @Override
    public RemoteTransactionStatus adjustRemoteStatus(PaymentTransaction transaction, RemoteTransactionStatus remote) {
        return delegate.adjustRemoteStatus(transaction, remote);
    }

    public GatewayClient getDelegate() {
        return delegate;
    }
}
