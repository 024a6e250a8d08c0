package com.fintech.paymentengine.dto;

import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.InitiatorType;
import com.fintech.paymentengine.entity.PaymentTransaction;
import lombok.Builder;
import lombok.Value;

/**
 * One ledger event to apply to a wallet.
 */
@Value
@Builder
public class BalanceUpdateRequest {

    Long walletId;

    BalanceTransactionType type;

    /**
     * Unsigned, strictly positive amount. The sign is derived from {@code type}.
     */
    Money amount;

    @Builder.Default
    InitiatorType initiator = InitiatorType.SYSTEM;

    PaymentTransaction paymentTransaction;

    String description;
}
