package com.fintech.paymentengine.gateway;

import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.entity.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * The provider's view of a transaction, produced by a status query or a parsed callback.
 */
@Value
@Builder(toBuilder = true)
public class RemoteTransactionStatus {

    TransactionStatus operationStatus;

    String idInPaymentSystem;

    /**
     * Our own transaction uuid, when the provider echoes it back.
     */
    UUID transactionUuid;

    String declineCode;

    String declineReason;

    /**
     * Amount the provider reports having moved, if it reports one.
     */
    Money remoteAmount;

    Map<String, Object> rawData;

    public static RemoteTransactionStatus pending(String idInPaymentSystem) {
        return RemoteTransactionStatus.builder()
                .operationStatus(TransactionStatus.PENDING)
                .idInPaymentSystem(idInPaymentSystem)
                .build();
    }

    public boolean isFinal() {
        return operationStatus != null && operationStatus.isFinal();
    }
}
