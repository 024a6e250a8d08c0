package com.fintech.paymentengine.dto;

import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    private Long id;
    private UUID uuid;
    private Long walletId;
    private String systemType;
    private TransactionType type;
    private TransactionStatus status;
    private BigDecimal amount;
    private String currency;
    private String idInPaymentSystem;
    private String declineCode;
    private String declineReason;

    /**
     * Redirect form as JSON, present while the payer still has to act.
     */
    private String instruction;

    private LocalDateTime checkStatusUntil;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static TransactionResponse from(PaymentTransaction transaction) {
        return TransactionResponse.builder()
                .id(transaction.getId())
                .uuid(transaction.getUuid())
                .walletId(transaction.getWallet().getId())
                .systemType(transaction.getSystemType())
                .type(transaction.getType())
                .status(transaction.getStatus())
                .amount(transaction.getMoney().getAmount())
                .currency(transaction.getCurrency())
                .idInPaymentSystem(transaction.getIdInPaymentSystem())
                .declineCode(transaction.getDeclineCode())
                .declineReason(transaction.getDeclineReason())
                .instruction(transaction.getInstruction())
                .checkStatusUntil(transaction.getCheckStatusUntil())
                .createdAt(transaction.getCreatedAt())
                .updatedAt(transaction.getUpdatedAt())
                .build();
    }
}
