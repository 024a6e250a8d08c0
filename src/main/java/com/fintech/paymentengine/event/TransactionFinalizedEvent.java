package com.fintech.paymentengine.event;

import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import lombok.Value;

import java.util.UUID;

/**
 * Published inside the database transaction that moved a payment to a terminal status.
 * Listeners that notify the merchant should use {@code @TransactionalEventListener} so they
 * only fire once the status change is committed.
 */
@Value
public class TransactionFinalizedEvent {

    Long transactionId;
    UUID transactionUuid;
    TransactionType type;
    TransactionStatus previousStatus;
    TransactionStatus status;
    String declineCode;
    String callbackUrl;
}
