package com.fintech.paymentengine.dto;

import com.fintech.paymentengine.entity.BalanceTransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Manual balance operation by an operator. Only MANUAL_ADJUSTMENT, FEE, FROZEN and UNFROZEN
 * are accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletOperationRequest {

    @NotNull
    private BalanceTransactionType type;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal amount;

    @Size(max = 500)
    private String description;
}
