package com.fintech.paymentengine.gateway;

import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.exception.GatewayApiException;

/**
 * Capability contract of one payment system.
 * <p>
 * Implementations translate between a provider's wire format and the engine's canonical
 * lifecycle. They retry transport failures themselves and report what is left as
 * {@link GatewayApiException}. Declines are returned, not thrown. Implementations never
 * change the transaction they are given; values to persist go into the returned objects.
 * <p>
 * Keys written to {@code PaymentTransaction#extra} use {@link #getSystemType()} as namespace.
 */
public interface GatewayClient {

    /**
     * Identifier this client is registered under, stored on transactions as system_type.
     */
    String getSystemType();

    GatewayResponse deposit(PaymentTransaction transaction);

    /**
     * Sends a payout. A FAILED answer here is only a hint; financial truth comes from
     * {@link #getTransactionStatus(PaymentTransaction)}.
     */
    GatewayResponse withdraw(PaymentTransaction transaction);

    /**
     * Second leg of deposits that need one, e.g. after 3-D-Secure.
     */
    default GatewayResponse depositFinalize(PaymentTransaction transaction) {
        return GatewayResponse.pending(transaction.getIdInPaymentSystem());
    }

    RemoteTransactionStatus getTransactionStatus(PaymentTransaction transaction);

    /**
     * Verifies the authenticity of a callback. Called before anything else is done with it.
     */
    boolean isCallbackSignatureValid(CallbackRequest callback);

    CallbackParseResult parseCallback(CallbackRequest callback);

    /**
     * Cheap classification of a callback used for replay detection. Must not throw.
     */
    default String resolveEventType(CallbackRequest callback) {
        return "callback";
    }

    /**
     * Hook for provider-specific corrections applied before a remote status is synced,
     * e.g. mapping a provider error code straight to FAILED.
     */
    default RemoteTransactionStatus adjustRemoteStatus(PaymentTransaction transaction, RemoteTransactionStatus remote) {
        return remote;
    }
}
