package com.fintech.paymentengine.gateway;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What a gateway made of an incoming callback.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CallbackParseResult {

    public enum Kind {
        /**
         * The payload carries an authoritative status to sync
         */
        STATUS,

        /**
         * Informational event, nothing to do
         */
        IGNORED,

        /**
         * The transaction is moving at the provider; ask for its status instead of trusting the payload
         */
        NEEDS_STATUS_CHECK
    }

    private final Kind kind;
    private final RemoteTransactionStatus remoteStatus;
    private final TransactionReference reference;
    private final String reason;

    public static CallbackParseResult status(RemoteTransactionStatus remoteStatus) {
        return new CallbackParseResult(Kind.STATUS, remoteStatus,
                new TransactionReference(remoteStatus.getIdInPaymentSystem(), remoteStatus.getTransactionUuid()), null);
    }

    public static CallbackParseResult ignored(String reason) {
        return new CallbackParseResult(Kind.IGNORED, null, null, reason);
    }

    public static CallbackParseResult needsStatusCheck(TransactionReference reference) {
        return new CallbackParseResult(Kind.NEEDS_STATUS_CHECK, null, reference, null);
    }
}
