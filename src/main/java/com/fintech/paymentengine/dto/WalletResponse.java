package com.fintech.paymentengine.dto;

import com.fintech.paymentengine.entity.CurrencyWallet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletResponse {

    private Long id;
    private String name;
    private String currency;
    private boolean sandbox;
    private BigDecimal operationalBalance;
    private BigDecimal frozenBalance;
    private BigDecimal pendingBalance;
    private BigDecimal availableBalance;
    private BigDecimal rollingReservePercent;
    private Integer rollingReserveDays;

    public static WalletResponse from(CurrencyWallet wallet) {
        return WalletResponse.builder()
                .id(wallet.getId())
                .name(wallet.getName())
                .currency(wallet.getCurrency())
                .sandbox(wallet.isSandbox())
                .operationalBalance(wallet.getOperational().getAmount())
                .frozenBalance(wallet.getFrozen().getAmount())
                .pendingBalance(wallet.getPending().getAmount())
                .availableBalance(wallet.getAvailable().getAmount())
                .rollingReservePercent(wallet.getRollingReservePercent())
                .rollingReserveDays(wallet.getRollingReserveDays())
                .build();
    }
}
