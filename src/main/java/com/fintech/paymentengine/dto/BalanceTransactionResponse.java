package com.fintech.paymentengine.dto;

import com.fintech.paymentengine.entity.BalanceTransaction;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.InitiatorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceTransactionResponse {

    private Long id;
    private BalanceTransactionType type;
    private BigDecimal amount;
    private String currency;
    private BigDecimal operationalBefore;
    private BigDecimal operationalAfter;
    private BigDecimal frozenBefore;
    private BigDecimal frozenAfter;
    private BigDecimal pendingBefore;
    private BigDecimal pendingAfter;
    private Long paymentTransactionId;
    private InitiatorType initiator;
    private String description;
    private LocalDateTime createdAt;

    public static BalanceTransactionResponse from(BalanceTransaction entry) {
        return BalanceTransactionResponse.builder()
                .id(entry.getId())
                .type(entry.getType())
                .amount(entry.getAmount())
                .currency(entry.getCurrency())
                .operationalBefore(entry.getOperationalBefore())
                .operationalAfter(entry.getOperationalAfter())
                .frozenBefore(entry.getFrozenBefore())
                .frozenAfter(entry.getFrozenAfter())
                .pendingBefore(entry.getPendingBefore())
                .pendingAfter(entry.getPendingAfter())
                .paymentTransactionId(entry.getPaymentTransaction() == null ? null : entry.getPaymentTransaction().getId())
                .initiator(entry.getInitiator())
                .description(entry.getDescription())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
